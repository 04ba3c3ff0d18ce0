package com.resumetailor.application.resume.exception;

public class ResumeAccessDeniedException extends RuntimeException {
    public ResumeAccessDeniedException() {
        super("This resume belongs to another user.");
    }
}
