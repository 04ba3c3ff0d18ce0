package com.resumetailor.application.resume.exception;

public class InvalidResumeFileException extends RuntimeException {
    public InvalidResumeFileException(String message) {
        super(message);
    }
}
