package com.learnguard.common.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SafetyCheck {

    public static final String ERROR_TYPE = "error";

    String type;
    boolean passed;
    double confidence;
    String details;

    public static SafetyCheck passed(String type, double confidence, String details) {
        return new SafetyCheck(type, true, confidence, details);
    }

    public static SafetyCheck failed(String type, double confidence, String details) {
        return new SafetyCheck(type, false, confidence, details);
    }

    /** Synthetic check used when a checker itself breaks; fails closed. */
    public static SafetyCheck systemError(String details) {
        return new SafetyCheck(ERROR_TYPE, false, 1.0, details);
    }
}
