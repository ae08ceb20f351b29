package com.learnguard.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ResolveEscalationRequest {

    @NotBlank(message = "teacherId is required")
    private String teacherId;

    @NotBlank(message = "resolution is required")
    private String resolution;
}
