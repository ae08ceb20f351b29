package com.learnguard.api.dto.request;

import com.learnguard.common.model.ConversationContext;
import com.learnguard.common.model.CourseContext;
import com.learnguard.common.model.LearnerProfile;
import com.learnguard.common.model.QueryType;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * A learner question. Audio and image arrive base64-encoded; when present they are
 * transcribed or described and merged with {@code query} before moderation.
 */
@Data
public class QueryRequest {

    @NotBlank(message = "userId is required")
    private String userId;

    @NotBlank(message = "sessionId is required")
    private String sessionId;

    private String query;

    private QueryType queryType; // inferred when absent

    private LearnerProfile userProfile;

    private CourseContext courseContext;

    private ConversationContext conversation;

    private byte[] audio;

    private String audioFormat;

    private byte[] image;

    private String imageFormat;

    public boolean hasMedia() {
        return (audio != null && audio.length > 0) || (image != null && image.length > 0);
    }
}
