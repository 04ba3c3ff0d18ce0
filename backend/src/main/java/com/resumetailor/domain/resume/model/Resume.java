package com.resumetailor.domain.resume.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "resumes")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Resume {

    @Id
    private UUID id;

    @Column(nullable = false, length = 100)
    private String userId;

    @Column(nullable = false)
    private String originalFilename;

    @Column(length = 500)
    private String originalPath;

    @Column(length = 500)
    private String optimizedPath;

    @Column(length = 500)
    private String renderedPath;

    @Lob
    @Column(columnDefinition = "CLOB")
    private String jobDescription;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OptimizationStatus optimizationStatus;

    @Column(nullable = false)
    private int keywordsAdded;

    @Column(length = 1000)
    private String failureReason;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @Builder
    public Resume(String userId, String originalFilename) {
        this.id = UUID.randomUUID();
        this.userId = userId;
        this.originalFilename = originalFilename;
        this.optimizationStatus = OptimizationStatus.PENDING;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    public boolean isOwnedBy(String userId) {
        return this.userId.equals(userId);
    }

    public void markUploaded(String originalPath) {
        this.originalPath = originalPath;
        updateStatus(OptimizationStatus.UPLOADED, 0);
    }

    public void startOptimization(String jobDescription) {
        this.jobDescription = jobDescription;
        this.failureReason = null;
        updateStatus(OptimizationStatus.PROCESSING, 0);
    }

    public void completeOptimization(String optimizedPath, String renderedPath, int keywordsAdded) {
        this.optimizedPath = optimizedPath;
        this.renderedPath = renderedPath;
        updateStatus(OptimizationStatus.COMPLETED, keywordsAdded);
    }

    public void failOptimization(String reason) {
        this.failureReason = reason;
        updateStatus(OptimizationStatus.FAILED, 0);
    }

    public void updateStatus(OptimizationStatus status, int keywordsCount) {
        this.optimizationStatus = status;
        this.keywordsAdded = keywordsCount;
        this.updatedAt = LocalDateTime.now();
    }
}
