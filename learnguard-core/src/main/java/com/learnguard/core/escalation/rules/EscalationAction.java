package com.learnguard.core.escalation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class EscalationAction {

    public static final String URGENCY = "urgency";
    public static final String INVOLVE_COUNSELOR = "involve_counselor";
    public static final String INTERVENTION_NEEDED = "intervention_needed";
    public static final String EXPERTISE_NEEDED = "expertise_needed";

    Type type;
    @Singular
    Map<String, String> parameters;

    public boolean hasFlag(String name) {
        return Boolean.parseBoolean(parameters.get(name));
    }

    public static EscalationAction notifyTeacher(Map<String, String> parameters) {
        return EscalationAction.builder().type(Type.NOTIFY_TEACHER).parameters(parameters).build();
    }

    @Getter
    @RequiredArgsConstructor
    public enum Type {
        NOTIFY_TEACHER("notify_teacher"),
        BLOCK_USER("block_user"),
        REQUIRE_SUPERVISION("require_supervision"),
        CUSTOM_RESPONSE("custom_response");

        @JsonValue
        private final String code;

        @JsonCreator
        public static Type fromString(String value) {
            for (Type type : values()) {
                if (type.code.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown escalation action: " + value);
        }
    }
}
