package com.resumetailor.infrastructure.optimization;

/**
 * Invalid optimization input: missing or unreadable source document, empty resume text,
 * or a job description below the minimum length. No partial output is produced.
 */
public class ResumeInputException extends RuntimeException {

    public ResumeInputException(String message) {
        super(message);
    }

    public ResumeInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
