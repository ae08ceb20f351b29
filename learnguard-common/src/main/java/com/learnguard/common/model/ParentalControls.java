package com.learnguard.common.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ParentalControls {

    boolean enabled;
    @Singular
    List<String> restrictedTopics;
    @Builder.Default
    FilterLevel contentFilterLevel = FilterLevel.MODERATE;

    public enum FilterLevel {
        STRICT,
        MODERATE,
        BASIC
    }
}
