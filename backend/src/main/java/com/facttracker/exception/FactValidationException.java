package com.facttracker.exception;

/**
 * Exception thrown when a fact to be appended is malformed.
 *
 * Raised by the ledger itself (blank content) and by the entry points for
 * fields that exceed their allowed length. GlobalExceptionHandler maps this
 * to HTTP 400 Bad Request.
 */
public class FactValidationException extends RuntimeException {

    private final String field;

    public FactValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * Gets the name of the offending field.
     *
     * @return the field name as it appears in the request body
     */
    public String getField() {
        return field;
    }

    public ErrorCode getErrorCode() {
        return ErrorCode.VALIDATION_ERROR;
    }

    public static FactValidationException emptyContent() {
        return new FactValidationException("content", "Fact content cannot be null or empty");
    }

    public static FactValidationException tooLong(String field, int maxLength) {
        return new FactValidationException(field,
                String.format("Field '%s' must be at most %d characters", field, maxLength));
    }
}
