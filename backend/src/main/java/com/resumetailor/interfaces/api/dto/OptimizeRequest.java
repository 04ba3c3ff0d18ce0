package com.resumetailor.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record OptimizeRequest(
        @NotBlank(message = "User id is required")
        @Size(max = 100, message = "User id must not exceed 100 characters")
        String userId,

        @NotBlank(message = "Job description is required")
        @Size(max = 20000, message = "Job description must not exceed 20000 characters")
        String jobDescription
) {}
