package com.learnguard.core.escalation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ConditionType {

    SAFETY_CHECK_FAILED("safety_check_failed"),
    REPEATED_QUESTIONS("repeated_questions"),
    EMOTIONAL_DISTRESS("emotional_distress"),
    COMPLEX_ACADEMIC("complex_academic");

    @JsonValue
    private final String code;

    @JsonCreator
    public static ConditionType fromString(String value) {
        for (ConditionType type : values()) {
            if (type.code.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown escalation condition: " + value);
    }
}
