package com.learnguard.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Set;

/**
 * Verdict of one checker, or of the combiner over many checkers.
 * Categories keep insertion order; the first one names the dominant violation.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModerationResult {

    boolean appropriate;
    double confidence;
    @Singular
    Set<String> categories;
    SafetyLevel severity;
    String reason;
    SuggestedAction suggestedAction;
    @Singular
    List<SafetyCheck> checks;

    public String primaryCategory() {
        return categories.isEmpty() ? null : categories.iterator().next();
    }

    @JsonIgnore
    public boolean isBlocked() {
        return suggestedAction == SuggestedAction.BLOCK;
    }

    public static ModerationResult allowAll(double confidence) {
        return ModerationResult.builder()
            .appropriate(true)
            .confidence(confidence)
            .severity(SafetyLevel.LOW)
            .suggestedAction(SuggestedAction.ALLOW)
            .build();
    }
}
