package com.facttracker.exception;

/**
 * Exception thrown when the target user id does not exist.
 *
 * GlobalExceptionHandler maps this to HTTP 404 Not Found.
 */
public class UserNotFoundException extends RuntimeException {

    private final Long userId;

    public UserNotFoundException(Long userId) {
        super(String.format("User %d not found.", userId));
        this.userId = userId;
    }

    public Long getUserId() {
        return userId;
    }

    public ErrorCode getErrorCode() {
        return ErrorCode.NOT_FOUND;
    }
}
