package com.learnguard.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Fixed taxonomy of learner questions. Drives provider preference,
 * model choice and cache lifetime.
 */
@Getter
@RequiredArgsConstructor
public enum QueryType {

    GENERAL_QUESTION("general_question"),
    HOMEWORK_HELP("homework_help"),
    CONCEPT_EXPLANATION("concept_explanation"),
    PROBLEM_SOLVING("problem_solving"),
    CREATIVE_WRITING("creative_writing"),
    CODE_ASSISTANCE("code_assistance"),
    MATH_PROBLEM("math_problem"),
    LANGUAGE_LEARNING("language_learning");

    @JsonValue
    private final String code;

    @JsonCreator
    public static QueryType fromString(String value) {
        for (QueryType type : values()) {
            if (type.code.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown query type: " + value);
    }
}
