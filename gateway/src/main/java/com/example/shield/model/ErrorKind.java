package com.example.shield.model;

import org.springframework.http.HttpStatus;

/**
 * The external error contract. Each kind has a fixed status and a generic
 * public message; nothing else about the failure reaches the caller unredacted.
 */
public enum ErrorKind {
    VALIDATION(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Input validation failed"),
    AUTH(HttpStatus.UNAUTHORIZED, "AUTH_ERROR", "Authentication failed"),
    AUTHORIZATION(HttpStatus.FORBIDDEN, "AUTHORIZATION_ERROR", "Insufficient permissions"),
    RATE_LIMIT(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMIT_ERROR", "Too many requests"),
    CSRF(HttpStatus.FORBIDDEN, "CSRF_ERROR", "CSRF validation failed"),
    UPLOAD(HttpStatus.BAD_REQUEST, "UPLOAD_ERROR", "File upload failed"),
    STORAGE(HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR", "Internal server error"),
    UNEXPECTED(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");

    private final HttpStatus status;
    private final String code;
    private final String publicMessage;

    ErrorKind(HttpStatus status, String code, String publicMessage) {
        this.status = status;
        this.code = code;
        this.publicMessage = publicMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getPublicMessage() {
        return publicMessage;
    }
}
