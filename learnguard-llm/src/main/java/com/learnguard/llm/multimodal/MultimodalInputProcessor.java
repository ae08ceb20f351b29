package com.learnguard.llm.multimodal;

import com.learnguard.common.model.InputType;
import com.learnguard.llm.config.LlmProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Turns text, voice and image input into a single query text before moderation.
 * Transcription and image description are delegated to external clients with a bounded wait.
 */
@Service
@Slf4j
public class MultimodalInputProcessor {

    static final Set<String> IMAGE_FORMATS = Set.of("jpeg", "jpg", "png", "webp", "gif");
    static final Set<String> AUDIO_FORMATS = Set.of("mp3", "wav", "ogg", "m4a");

    private final ObjectProvider<SpeechToTextClient> speechToText;
    private final ObjectProvider<ImageDescriptionClient> imageDescription;
    private final LlmProperties.Multimodal config;

    public MultimodalInputProcessor(ObjectProvider<SpeechToTextClient> speechToText,
                                    ObjectProvider<ImageDescriptionClient> imageDescription,
                                    LlmProperties properties) {
        this.speechToText = speechToText;
        this.imageDescription = imageDescription;
        this.config = properties.getMultimodal();
    }

    public ProcessedInput process(MediaInput input) {
        List<String> parts = new ArrayList<>();

        if (input.hasAudio()) {
            String format = requireFormat(input.getAudioFormat(), AUDIO_FORMATS, "audio");
            SpeechToTextClient client = speechToText.getIfAvailable();
            if (client == null) {
                throw new MediaProcessingException("Speech-to-text service is not configured");
            }
            String transcript = callWithTimeout("speech-to-text", () -> client.transcribe(input.getAudio(), format));
            log.info("[MULTIMODAL] Audio transcribed | format={} | bytes={} | transcriptLength={}",
                format, input.getAudio().length, transcript.length());
            parts.add(transcript);
        }

        if (input.hasText()) {
            parts.add(input.getText().trim());
        }

        if (input.hasImage()) {
            String format = requireFormat(input.getImageFormat(), IMAGE_FORMATS, "image");
            if (input.getImage().length > config.getMaxImageBytes()) {
                throw new MediaProcessingException("Image exceeds maximum size of "
                    + (config.getMaxImageBytes() / (1024 * 1024)) + "MB");
            }
            ImageDescriptionClient client = imageDescription.getIfAvailable();
            if (client == null) {
                throw new MediaProcessingException("Image description service is not configured");
            }
            String description = callWithTimeout("image-description", () -> client.describe(input.getImage(), format));
            log.info("[MULTIMODAL] Image described | format={} | bytes={} | descriptionLength={}",
                format, input.getImage().length, description.length());
            parts.add("[Image: " + description + "]");
        }

        if (parts.isEmpty()) {
            throw new MediaProcessingException("No text, audio or image input provided");
        }
        return new ProcessedInput(String.join("\n", parts), inputTypeOf(input));
    }

    static InputType inputTypeOf(MediaInput input) {
        int modalities = (input.hasText() ? 1 : 0) + (input.hasAudio() ? 1 : 0) + (input.hasImage() ? 1 : 0);
        if (modalities > 1) {
            return InputType.MULTIMODAL;
        }
        if (input.hasAudio()) {
            return InputType.VOICE;
        }
        if (input.hasImage()) {
            return InputType.IMAGE;
        }
        return InputType.TEXT;
    }

    private String requireFormat(String format, Set<String> supported, String kind) {
        String normalized = format == null ? "" : format.toLowerCase(Locale.ROOT).replace(".", "");
        if (!supported.contains(normalized)) {
            throw new MediaProcessingException("Unsupported " + kind + " format: " + format);
        }
        return normalized;
    }

    private String callWithTimeout(String service, Supplier<String> call) {
        CompletableFuture<String> future = CompletableFuture.supplyAsync(call);
        try {
            String result = future.get(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (result == null || result.isBlank()) {
                throw new MediaProcessingException(service + " returned no text");
            }
            return result.trim();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new MediaProcessingException(service + " timed out", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new MediaProcessingException(service + " interrupted", e);
        } catch (ExecutionException e) {
            log.warn("[MULTIMODAL] {} failed | error={}", service, e.getCause().getMessage());
            throw new MediaProcessingException(service + " failed: " + e.getCause().getMessage(), e.getCause());
        }
    }
}
