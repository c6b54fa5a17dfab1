package com.facttracker.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.net.URI;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for REST API endpoints.
 *
 * This class provides centralized exception handling across all controllers,
 * converting exceptions into RFC 7807 compliant error responses. Every ledger
 * error carries an {@code errorCode} property with one of the stable
 * {@link ErrorCode} names so clients never need to parse the message text.
 *
 * <p>RFC 7807 Response Format:
 * <pre>
 * {
 *   "type": "https://api.facttracker.dev/errors/access-denied",
 *   "title": "Access Denied",
 *   "status": 403,
 *   "detail": "Forbidden: cannot access other user's data (user 7).",
 *   "instance": "/api/users/7/facts",
 *   "errorCode": "FORBIDDEN",
 *   "timestamp": "2024-02-26T10:30:00"
 * }
 * </pre>
 *
 * <p>Handled Exception Categories:
 * <ul>
 *   <li>Not found (404): target user id does not exist</li>
 *   <li>Authorization errors (403): caller does not own the target user</li>
 *   <li>Validation errors (400): blank content, oversize fields, malformed bodies</li>
 *   <li>Invalid arguments (400): limit outside [1, 500], non-numeric parameters</li>
 *   <li>Busy (503): per-user append could not be serialized in time</li>
 *   <li>Storage failures (500): user store read/write errors</li>
 * </ul>
 *
 * Missing or invalid bearer tokens never reach this class; Spring Security
 * answers those with 401 before dispatch.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7807">RFC 7807 Specification</a>
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String BASE_ERROR_URI = "https://api.facttracker.dev/errors";
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ISO_DATE_TIME;
    private static final String RETRY_AFTER_SECONDS = "1";

    /**
     * Handles UserNotFoundException - the target user id does not exist.
     *
     * @param ex the UserNotFoundException
     * @param request the web request context
     * @return RFC 7807 problem details with 404 status
     */
    @ExceptionHandler(UserNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleUserNotFoundException(
            UserNotFoundException ex,
            WebRequest request
    ) {
        log.warn("User lookup failed: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                ex.getErrorCode(), "User Not Found", ex.getMessage(), request);

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problemDetail);
    }

    /**
     * Handles UnauthorizedException - authenticated caller targets another user's ledger.
     *
     * @param ex the UnauthorizedException
     * @param request the web request context
     * @return RFC 7807 problem details with 403 status
     */
    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ProblemDetail> handleUnauthorizedException(
            UnauthorizedException ex,
            WebRequest request
    ) {
        log.warn("Authorization failed: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                ex.getErrorCode(), "Access Denied", ex.getMessage(), request);

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problemDetail);
    }

    /**
     * Handles FactValidationException - the fact to append is malformed.
     *
     * @param ex the FactValidationException
     * @param request the web request context
     * @return RFC 7807 problem details with 400 status and the offending field
     */
    @ExceptionHandler(FactValidationException.class)
    public ResponseEntity<ProblemDetail> handleFactValidationException(
            FactValidationException ex,
            WebRequest request
    ) {
        log.warn("Fact validation failed: field={}, message={}", ex.getField(), ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                ex.getErrorCode(), "Validation Failed", ex.getMessage(), request);
        problemDetail.setProperty("errors", Map.of(ex.getField(), ex.getMessage()));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles MethodArgumentNotValidException - bean validation failures on request bodies.
     *
     * @param ex the MethodArgumentNotValidException
     * @param request the web request context
     * @return RFC 7807 problem details with 400 status and validation errors
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidationException(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        log.warn("Request validation failed: {}", ex.getMessage());

        Map<String, String> validationErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                validationErrors.put(error.getField(), error.getDefaultMessage()));

        ProblemDetail problemDetail = createProblemDetail(
                ErrorCode.VALIDATION_ERROR,
                "Validation Failed",
                "Request validation failed. Please check the 'errors' property for details.",
                request
        );
        problemDetail.setProperty("errors", validationErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles HttpMessageNotReadableException - malformed request body.
     *
     * @param ex the HttpMessageNotReadableException
     * @param request the web request context
     * @return RFC 7807 problem details with 400 status
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleHttpMessageNotReadableException(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        log.warn("Request body parsing failed: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                ErrorCode.VALIDATION_ERROR,
                "Invalid Request Body",
                "The request body is malformed or contains invalid JSON. Please check your request format.",
                request
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles InvalidArgumentException - query argument outside its accepted range.
     *
     * @param ex the InvalidArgumentException
     * @param request the web request context
     * @return RFC 7807 problem details with 400 status
     */
    @ExceptionHandler(InvalidArgumentException.class)
    public ResponseEntity<ProblemDetail> handleInvalidArgumentException(
            InvalidArgumentException ex,
            WebRequest request
    ) {
        log.warn("Invalid argument: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                ex.getErrorCode(), "Invalid Argument", ex.getMessage(), request);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles MethodArgumentTypeMismatchException - e.g. {@code ?limit=abc}.
     *
     * @param ex the MethodArgumentTypeMismatchException
     * @param request the web request context
     * @return RFC 7807 problem details with 400 status
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatchException(
            MethodArgumentTypeMismatchException ex,
            WebRequest request
    ) {
        log.warn("Parameter type mismatch: name={}, value={}", ex.getName(), ex.getValue());

        ProblemDetail problemDetail = createProblemDetail(
                ErrorCode.INVALID_ARGUMENT,
                "Invalid Argument",
                String.format("Parameter '%s' has an invalid value.", ex.getName()),
                request
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles BusyException - the per-user append could not be serialized in time.
     *
     * Includes a {@code Retry-After} header; the operation is safe to retry
     * because nothing was written.
     *
     * @param ex the BusyException
     * @param request the web request context
     * @return RFC 7807 problem details with 503 status
     */
    @ExceptionHandler(BusyException.class)
    public ResponseEntity<ProblemDetail> handleBusyException(
            BusyException ex,
            WebRequest request
    ) {
        log.warn("Append rejected as busy: userId={}, message={}", ex.getUserId(), ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                ex.getErrorCode(), "Busy", ex.getMessage(), request);

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                .body(problemDetail);
    }

    /**
     * Handles StorageFailureException - the user store failed during an operation.
     *
     * @param ex the StorageFailureException
     * @param request the web request context
     * @return RFC 7807 problem details with 500 status
     */
    @ExceptionHandler(StorageFailureException.class)
    public ResponseEntity<ProblemDetail> handleStorageFailureException(
            StorageFailureException ex,
            WebRequest request
    ) {
        log.error("Storage failure: operation={}, message={}", ex.getOperation(), ex.getMessage(), ex);

        ProblemDetail problemDetail = createProblemDetail(
                ex.getErrorCode(), "Storage Failure", ex.getMessage(), request);
        problemDetail.setProperty("operation", ex.getOperation());
        problemDetail.setProperty("errorId", generateErrorId());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problemDetail);
    }

    /**
     * Handles NoResourceFoundException - invalid endpoint.
     *
     * @param ex the NoResourceFoundException
     * @param request the web request context
     * @return RFC 7807 problem details with 404 status
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ProblemDetail> handleNoResourceFoundException(
            NoResourceFoundException ex,
            WebRequest request
    ) {
        log.warn("Endpoint not found: {} {}", ex.getHttpMethod(), ex.getResourcePath());

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND,
                String.format("The requested endpoint '%s /%s' does not exist.",
                        ex.getHttpMethod(), ex.getResourcePath()));
        problemDetail.setType(URI.create(BASE_ERROR_URI + "/endpoint-not-found"));
        problemDetail.setTitle("Endpoint Not Found");
        applyInstanceAndTimestamp(problemDetail, request);

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problemDetail);
    }

    /**
     * Fallback handler for all unhandled exceptions.
     *
     * @param ex the unhandled exception
     * @param request the web request context
     * @return RFC 7807 problem details with 500 status
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnhandledException(
            Exception ex,
            WebRequest request
    ) {
        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please try again later or contact support if the issue persists.");
        problemDetail.setType(URI.create(BASE_ERROR_URI + "/internal-error"));
        problemDetail.setTitle("Internal Server Error");
        applyInstanceAndTimestamp(problemDetail, request);
        problemDetail.setProperty("errorId", generateErrorId());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problemDetail);
    }

    /**
     * Creates a ProblemDetail object for a ledger error kind.
     *
     * @param errorCode the stable error kind; decides status and type URI
     * @param title a short, human-readable title
     * @param detail a detailed explanation
     * @param request the web request context
     * @return a populated ProblemDetail object
     */
    private ProblemDetail createProblemDetail(
            ErrorCode errorCode,
            String title,
            String detail,
            WebRequest request
    ) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(errorCode.getStatus(), detail);

        problemDetail.setType(URI.create(String.format("%s/%s", BASE_ERROR_URI, errorCode.getTypeSlug())));
        problemDetail.setTitle(title);
        problemDetail.setProperty("errorCode", errorCode.name());
        applyInstanceAndTimestamp(problemDetail, request);

        return problemDetail;
    }

    private void applyInstanceAndTimestamp(ProblemDetail problemDetail, WebRequest request) {
        String description = request.getDescription(false);
        if (description != null && description.startsWith("uri=")) {
            problemDetail.setInstance(URI.create(description.substring(4)));
        }
        problemDetail.setProperty("timestamp", LocalDateTime.now().format(TIMESTAMP_FORMATTER));
    }

    /**
     * Generates a unique error ID for tracking and debugging.
     *
     * @return a unique error identifier
     */
    private String generateErrorId() {
        return String.format("ERR-%d", System.currentTimeMillis());
    }
}
