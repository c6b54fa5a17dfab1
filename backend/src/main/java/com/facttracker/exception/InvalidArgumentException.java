package com.facttracker.exception;

/**
 * Exception thrown when a query argument is outside its accepted range.
 *
 * Unlike {@link FactValidationException}, which concerns the shape of a fact
 * being written, this covers read parameters such as the page limit. Values
 * are rejected, never clamped. GlobalExceptionHandler maps this to HTTP 400.
 */
public class InvalidArgumentException extends RuntimeException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    public ErrorCode getErrorCode() {
        return ErrorCode.INVALID_ARGUMENT;
    }

    /**
     * Constructs a new InvalidArgumentException for an out-of-range limit.
     *
     * @param limit the rejected value
     * @param min the smallest accepted value
     * @param max the largest accepted value
     * @return an InvalidArgumentException with a formatted message
     */
    public static InvalidArgumentException limitOutOfRange(int limit, int min, int max) {
        return new InvalidArgumentException(
                String.format("limit must be between %d and %d (got %d)", min, max, limit)
        );
    }
}
