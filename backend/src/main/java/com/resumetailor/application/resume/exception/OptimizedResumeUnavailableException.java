package com.resumetailor.application.resume.exception;

public class OptimizedResumeUnavailableException extends RuntimeException {
    public OptimizedResumeUnavailableException(String message) {
        super(message);
    }
}
