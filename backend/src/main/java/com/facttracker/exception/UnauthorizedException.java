package com.facttracker.exception;

/**
 * Exception thrown when a caller attempts to access a ledger they do not own.
 *
 * This exception is distinct from authentication failures. Authentication
 * failures (401) occur when the caller cannot prove their identity (invalid or
 * missing JWT). Authorization failures (403) occur when an authenticated
 * caller targets a user id whose username differs from their own.
 *
 * GlobalExceptionHandler maps this to HTTP 403 Forbidden with RFC 7807 format.
 *
 * @see com.facttracker.exception.GlobalExceptionHandler
 * @see com.facttracker.service.AccessGuard
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }

    public ErrorCode getErrorCode() {
        return ErrorCode.FORBIDDEN;
    }

    /**
     * Constructs a new UnauthorizedException for cross-user access attempts.
     *
     * @param userId the ID of the user whose ledger was targeted
     * @return an UnauthorizedException with a formatted message
     */
    public static UnauthorizedException crossUserAccess(Long userId) {
        return new UnauthorizedException(
                String.format("Forbidden: cannot access other user's data (user %d).", userId)
        );
    }

    /**
     * Constructs a new UnauthorizedException for a request without a caller identity.
     *
     * @return an UnauthorizedException with a formatted message
     */
    public static UnauthorizedException missingIdentity() {
        return new UnauthorizedException("Forbidden: no verified caller identity was supplied.");
    }
}
