package com.learnguard.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum InputType {

    TEXT("text"),
    VOICE("voice"),
    IMAGE("image"),
    MULTIMODAL("multimodal");

    @JsonValue
    private final String code;

    public boolean carriesImage() {
        return this == IMAGE || this == MULTIMODAL;
    }

    @JsonCreator
    public static InputType fromString(String value) {
        for (InputType type : values()) {
            if (type.code.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown input type: " + value);
    }
}
