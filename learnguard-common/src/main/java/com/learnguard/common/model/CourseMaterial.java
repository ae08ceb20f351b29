package com.learnguard.common.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CourseMaterial {

    String id;
    String title;
    MaterialType type;
    String content;
    Double relevanceScore;

    public enum MaterialType {
        LESSON,
        EXERCISE,
        READING,
        VIDEO,
        DOCUMENT
    }
}
