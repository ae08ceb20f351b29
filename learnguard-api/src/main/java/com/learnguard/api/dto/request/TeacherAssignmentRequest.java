package com.learnguard.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class TeacherAssignmentRequest {

    @NotBlank(message = "studentId is required")
    private String studentId;

    @NotBlank(message = "teacherId is required")
    private String teacherId;

    private String courseId; // null assigns the teacher for every course
}
