package com.resumetailor.infrastructure.storage;

public class ResumeStorageException extends RuntimeException {

    public ResumeStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
