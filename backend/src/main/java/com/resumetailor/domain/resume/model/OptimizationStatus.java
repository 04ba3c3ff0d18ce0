package com.resumetailor.domain.resume.model;

public enum OptimizationStatus {
    PENDING,
    UPLOADED,
    PROCESSING,
    COMPLETED,
    FAILED
}
