package com.learnguard.llm.multimodal;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MediaInput {

    String text;
    byte[] audio;
    String audioFormat;
    byte[] image;
    String imageFormat;

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public boolean hasAudio() {
        return audio != null && audio.length > 0;
    }

    public boolean hasImage() {
        return image != null && image.length > 0;
    }
}
