package com.resumetailor.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
