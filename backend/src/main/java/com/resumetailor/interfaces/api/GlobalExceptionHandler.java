package com.resumetailor.interfaces.api;

import com.resumetailor.application.resume.exception.InvalidResumeFileException;
import com.resumetailor.application.resume.exception.OptimizedResumeUnavailableException;
import com.resumetailor.application.resume.exception.ResumeAccessDeniedException;
import com.resumetailor.application.resume.exception.ResumeNotFoundException;
import com.resumetailor.infrastructure.ai.TokenPredictionException;
import com.resumetailor.infrastructure.optimization.ResumeInputException;
import com.resumetailor.infrastructure.optimization.ResumeOutputException;
import com.resumetailor.infrastructure.storage.ResumeStorageException;
import com.resumetailor.interfaces.api.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResumeNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResumeNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("RESUME_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(ResumeAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(ResumeAccessDeniedException e) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(new ErrorResponse("RESUME_ACCESS_DENIED", e.getMessage()));
    }

    @ExceptionHandler(InvalidResumeFileException.class)
    public ResponseEntity<ErrorResponse> handleInvalidFile(InvalidResumeFileException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_RESUME_FILE", e.getMessage()));
    }

    @ExceptionHandler(OptimizedResumeUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(OptimizedResumeUnavailableException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("OPTIMIZED_RESUME_UNAVAILABLE", e.getMessage()));
    }

    @ExceptionHandler(ResumeInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ResumeInputException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_OPTIMIZATION_INPUT", e.getMessage()));
    }

    @ExceptionHandler(ResumeOutputException.class)
    public ResponseEntity<ErrorResponse> handleOutput(ResumeOutputException e) {
        log.error("[GlobalExceptionHandler] Optimized resume could not be written", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("OPTIMIZATION_OUTPUT_ERROR", e.getMessage()));
    }

    @ExceptionHandler(ResumeStorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(ResumeStorageException e) {
        log.error("[GlobalExceptionHandler] Storage failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("STORAGE_ERROR", e.getMessage()));
    }

    @ExceptionHandler(TokenPredictionException.class)
    public ResponseEntity<ErrorResponse> handlePrediction(TokenPredictionException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("PREDICTION_ERROR", e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("INVALID_STATE", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_ARGUMENT", e.getMessage()));
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleMissingPart(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("MISSING_PARAMETER", e.getMessage()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(MaxUploadSizeExceededException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("FILE_TOO_LARGE", "Resume file exceeds the upload size limit."));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getDefaultMessage())
                .orElse("Invalid request.");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("[GlobalExceptionHandler] Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "Internal server error. Please try again later."));
    }
}
