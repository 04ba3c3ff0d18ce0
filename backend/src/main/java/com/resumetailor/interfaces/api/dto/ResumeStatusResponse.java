package com.resumetailor.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.resumetailor.domain.resume.model.Resume;

import java.time.LocalDateTime;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResumeStatusResponse(
        UUID resumeId,
        String originalFilename,
        String status,
        int keywordsAdded,
        boolean pdfAvailable,
        String failureReason,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static ResumeStatusResponse from(Resume resume) {
        return new ResumeStatusResponse(
                resume.getId(),
                resume.getOriginalFilename(),
                resume.getOptimizationStatus().name(),
                resume.getKeywordsAdded(),
                resume.getRenderedPath() != null,
                resume.getFailureReason(),
                resume.getCreatedAt(),
                resume.getUpdatedAt());
    }
}
