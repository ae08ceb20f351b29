package com.learnguard.common.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A learner question. Immutable once built; the coordinator fills in a missing
 * classification by deriving a copy with {@link #withQueryType(QueryType)}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LearningRequest {

    String id;
    String userId;
    String sessionId;
    String query;
    QueryType queryType;
    @Builder.Default
    InputType inputType = InputType.TEXT;
    LearnerProfile userProfile;
    CourseContext courseContext;
    ConversationContext conversation;
    @Builder.Default
    Instant timestamp = Instant.now();

    public LearningRequest withQueryType(QueryType type) {
        return toBuilder().queryType(type).build();
    }

    /** Stated age, or the age derived from the grade when only the grade is known. */
    public Integer learnerAge() {
        return userProfile == null ? null : userProfile.effectiveAge();
    }

    public String courseId() {
        return courseContext == null ? null : courseContext.getCourseId();
    }

    public int materialCount() {
        return courseContext == null ? 0 : courseContext.materialCount();
    }
}
