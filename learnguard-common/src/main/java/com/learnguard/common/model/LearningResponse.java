package com.learnguard.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Generated (or redirect) answer. Never mutated after creation; the cache hands
 * out a copy with {@code cached = true} through {@link #asCached()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LearningResponse {

    public static final String SAFETY_FILTER_PROVIDER = "safety_filter";
    public static final String SAFETY_FILTER_MODEL = "content_moderation";

    String id;
    String requestId;
    String text;
    String provider;
    String model;
    double confidence;
    SafetyLevel safetyLevel;
    int tokensUsed;
    long latencyMs;
    boolean cached;
    @Builder.Default
    Instant timestamp = Instant.now();
    @Builder.Default
    ResponseMetadata metadata = ResponseMetadata.empty();

    public LearningResponse asCached() {
        return toBuilder().cached(true).build();
    }

    @JsonIgnore
    public boolean isEscalationRecommended() {
        return metadata != null && metadata.isEscalationRecommended();
    }

    /** High/critical answers and answers flagged for escalation must never reach the cache. */
    @JsonIgnore
    public boolean isCacheable() {
        return !(safetyLevel != null && safetyLevel.isUncacheable()) && !isEscalationRecommended();
    }
}
