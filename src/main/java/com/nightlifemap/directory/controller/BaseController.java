package com.nightlifemap.directory.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nightlifemap.directory.exception.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Base controller with common functionality and error handling.
 * Every error body carries the error code, a message and whether the client may retry.
 */
@RestController
public abstract class BaseController {

    private static final Logger logger = LoggerFactory.getLogger(BaseController.class);

    /**
     * Extract authenticated user ID (set by the upstream authentication layer).
     */
    protected String extractUserId(HttpServletRequest request) {
        String userId = (String) request.getAttribute("userId");
        if (userId == null || userId.trim().isEmpty()) {
            throw new UnauthorizedException("No authenticated user");
        }
        return userId;
    }

    protected String extractUserRole(HttpServletRequest request) {
        Object role = request.getAttribute("userRole");
        return role instanceof String ? (String) role : null;
    }

    /**
     * Error response DTO for consistent error formatting.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        private final String error;
        private final String message;
        private final boolean retryable;
        private final long timestamp;
        private final ValidRange validRange;

        public ErrorResponse(String error, String message, boolean retryable) {
            this(error, message, retryable, null);
        }

        public ErrorResponse(String error, String message, boolean retryable, ValidRange validRange) {
            this.error = error;
            this.message = message;
            this.retryable = retryable;
            this.validRange = validRange;
            this.timestamp = System.currentTimeMillis();
        }

        public String getError() { return error; }
        public String getMessage() { return message; }
        public boolean isRetryable() { return retryable; }
        public long getTimestamp() { return timestamp; }
        public ValidRange getValidRange() { return validRange; }
    }

    /**
     * {min, max} pairs; {@code cols} is null when the requested row does not exist.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ValidRange {
        private final int[] rows;
        private final int[] cols;

        public ValidRange(int[] rows, int[] cols) {
            this.rows = rows;
            this.cols = cols;
        }

        public int[] getRows() { return rows; }
        public int[] getCols() { return cols; }
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedException e) {
        logger.warn("Unauthorized access attempt: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
            .body(new ErrorResponse("UNAUTHORIZED", e.getMessage(), false));
    }

    @ExceptionHandler(OutOfBoundsException.class)
    public ResponseEntity<ErrorResponse> handleOutOfBounds(OutOfBoundsException e) {
        logger.warn("Out of bounds placement: {}", e.getMessage());
        ValidRange validRange = e.getValidRows() == null ? null : new ValidRange(e.getValidRows(), e.getValidCols());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(e.getErrorKind().name(), e.getMessage(), e.isRetryable(), validRange));
    }

    @ExceptionHandler(PlacementFatalException.class)
    public ResponseEntity<ErrorResponse> handleFatal(PlacementFatalException e) {
        logger.error("Placement left venue {} without a position (original cell {})",
            e.getDetachedVenueId(), e.getOriginalCell());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse(e.getErrorKind().name(),
                e.getMessage() + ". Operator intervention required, do not retry.", false));
    }

    @ExceptionHandler(PlacementException.class)
    public ResponseEntity<ErrorResponse> handlePlacement(PlacementException e) {
        HttpStatus status = statusFor(e.getErrorKind());
        if (status.is5xxServerError()) {
            logger.error("Placement failed ({}): {}", e.getErrorKind(), e.getMessage());
        } else {
            logger.warn("Placement rejected ({}): {}", e.getErrorKind(), e.getMessage());
        }
        return ResponseEntity.status(status)
            .body(new ErrorResponse(e.getErrorKind().name(), e.getMessage(), e.isRetryable()));
    }

    @ExceptionHandler(PlacementInProgressException.class)
    public ResponseEntity<ErrorResponse> handlePlacementInProgress(PlacementInProgressException e) {
        logger.info("Placement in progress: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse("PLACEMENT_IN_PROGRESS", e.getMessage(), true));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException e) {
        logger.debug("Resource not found: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse(PlacementErrorKind.NOT_FOUND.name(), e.getMessage(),
                PlacementErrorKind.NOT_FOUND.isRetryable()));
    }

    @ExceptionHandler(TransactionFailedException.class)
    public ResponseEntity<ErrorResponse> handleTransactionFailed(TransactionFailedException e) {
        logger.error("Transaction failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse("TRANSACTION_FAILED", "Operation could not be completed", true));
    }

    @ExceptionHandler(RepositoryException.class)
    public ResponseEntity<ErrorResponse> handleRepository(RepositoryException e) {
        logger.error("Repository error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("REPOSITORY_ERROR", "Internal server error", false));
    }

    @ExceptionHandler(InvalidKeyException.class)
    public ResponseEntity<ErrorResponse> handleInvalidKey(InvalidKeyException e) {
        logger.warn("Invalid key format: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(PlacementErrorKind.INVALID_INPUT.name(), e.getMessage(), true));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        logger.warn("Method argument validation error: {}", e.getMessage());
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .findFirst()
            .orElse("Invalid input");
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(PlacementErrorKind.INVALID_INPUT.name(), message, true));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(PlacementErrorKind.INVALID_INPUT.name(), "Malformed request body", true));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception e) {
        logger.error("Unexpected error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred", false));
    }

    private static HttpStatus statusFor(PlacementErrorKind kind) {
        switch (kind) {
            case INVALID_INPUT:
            case OUT_OF_BOUNDS:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CONFLICT:
                return HttpStatus.CONFLICT;
            case SWAP_FAILED:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case FATAL:
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
