package com.facttracker.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable error kinds surfaced to API callers.
 *
 * The name is written to the {@code errorCode} property of every problem
 * response so clients can branch on it without parsing messages.
 */
public enum ErrorCode {

    NOT_FOUND(HttpStatus.NOT_FOUND, "resource-not-found"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "access-denied"),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "validation-failed"),
    INVALID_ARGUMENT(HttpStatus.BAD_REQUEST, "invalid-argument"),
    STORAGE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "storage-failure"),
    BUSY(HttpStatus.SERVICE_UNAVAILABLE, "busy");

    private final HttpStatus status;
    private final String typeSlug;

    ErrorCode(HttpStatus status, String typeSlug) {
        this.status = status;
        this.typeSlug = typeSlug;
    }

    public HttpStatus getStatus() {
        return status;
    }

    /**
     * Last path segment of the problem {@code type} URI.
     */
    public String getTypeSlug() {
        return typeSlug;
    }
}
