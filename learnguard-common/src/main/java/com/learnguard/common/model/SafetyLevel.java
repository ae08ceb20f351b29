package com.learnguard.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Ordered severity: LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL. Declaration order is the order.
 */
@Getter
@RequiredArgsConstructor
public enum SafetyLevel {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    @JsonValue
    private final String code;

    public boolean isAtLeast(SafetyLevel other) {
        return compareTo(other) >= 0;
    }

    /** Levels that may never be written to the response cache. */
    public boolean isUncacheable() {
        return isAtLeast(HIGH);
    }

    public static SafetyLevel max(SafetyLevel a, SafetyLevel b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) >= 0 ? a : b;
    }

    @JsonCreator
    public static SafetyLevel fromString(String value) {
        for (SafetyLevel level : values()) {
            if (level.code.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown safety level: " + value);
    }
}
