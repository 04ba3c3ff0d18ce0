package com.resumetailor.infrastructure.optimization;

/**
 * The rebuilt document could not be written. The source file is left untouched.
 */
public class ResumeOutputException extends RuntimeException {

    public ResumeOutputException(String message) {
        super(message);
    }

    public ResumeOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
