package com.facttracker.exception;

/**
 * Exception thrown when the user store fails to read or write a record.
 *
 * Wraps Spring's {@code DataAccessException} and {@code TransactionException}
 * hierarchies at the service boundary so callers see one stable error kind.
 * A failure during a write means the surrounding transaction was rolled back
 * in full and the caller may retry the whole operation.
 *
 * GlobalExceptionHandler maps this to HTTP 500 Internal Server Error.
 *
 * @see com.facttracker.service.FactService
 */
public class StorageFailureException extends RuntimeException {

    private final String operation;

    /**
     * Constructs a new StorageFailureException for the given operation.
     *
     * @param operation the entry point that failed (e.g., "add-fact", "list-facts")
     * @param userId the user whose record was being accessed
     * @param cause the underlying storage error
     */
    public StorageFailureException(String operation, Long userId, Throwable cause) {
        super(String.format("Storage failure during %s for user %d. Please retry the operation.",
                operation, userId), cause);
        this.operation = operation;
    }

    /**
     * Gets the operation during which storage failed.
     *
     * @return the operation name
     */
    public String getOperation() {
        return operation;
    }

    public ErrorCode getErrorCode() {
        return ErrorCode.STORAGE_FAILURE;
    }
}
