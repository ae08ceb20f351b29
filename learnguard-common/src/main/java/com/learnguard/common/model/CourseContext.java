package com.learnguard.common.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class CourseContext {

    String courseId;
    String courseName;
    String subject;
    String gradeLevel;
    String currentLesson;
    @Singular
    List<String> learningObjectives;
    @Singular
    List<CourseMaterial> materials;

    public int materialCount() {
        return materials == null ? 0 : materials.size();
    }
}
