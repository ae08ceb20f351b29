package com.learnguard.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ResponseMetadata {

    @Singular
    List<String> sources;
    @Singular
    List<Citation> citations;
    @Singular
    List<String> suggestedFollowUps;
    boolean escalationRecommended;
    @Singular
    List<String> contentWarnings;
    @Singular
    List<SafetyCheck> safetyChecks;

    public static ResponseMetadata empty() {
        return ResponseMetadata.builder().build();
    }

    public boolean hasSources() {
        return !sources.isEmpty() || !citations.isEmpty();
    }
}
