package com.resumetailor.infrastructure.ai;

public class TokenPredictionException extends RuntimeException {

    public TokenPredictionException(String message) {
        super(message);
    }

    public TokenPredictionException(String message, Throwable cause) {
        super(message, cause);
    }
}
