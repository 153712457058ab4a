package com.flagship.pharmacy_ledger.exception;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the ledger's failure taxonomy onto HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String RETRY_AFTER_SECONDS = "1";

    /**
     * A repeated event is not an error: the first submission's effect stands.
     */
    @ExceptionHandler(AlreadyAppliedException.class)
    public ResponseEntity<AlreadyAppliedResponse> handleAlreadyApplied(AlreadyAppliedException e) {
        log.info("Already applied, ignoring: {}", e.getMessage());
        return ResponseEntity.ok(new AlreadyAppliedResponse(AlreadyAppliedResponse.ALREADY_APPLIED,
                e.getExternalId(), e.getMessage(), Instant.now()));
    }

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<ApiError> handleInsufficientStock(InsufficientStockException e) {
        log.warn("Insufficient stock: {}", e.getMessage());
        Map<String, String> details = new LinkedHashMap<>();
        details.put("batch", e.getBatchKey());
        details.put("requested", String.valueOf(e.getRequested()));
        details.put("available", String.valueOf(e.getAvailable()));
        return error(HttpStatus.CONFLICT, "Insufficient Stock", e.getMessage(), details);
    }

    @ExceptionHandler(BalanceMismatchException.class)
    public ResponseEntity<ApiError> handleBalanceMismatch(BalanceMismatchException e) {
        log.warn("Balance mismatch: {}", e.getMessage());
        Map<String, String> details = new LinkedHashMap<>();
        details.put("tran_id", e.getTranId());
        details.put("flagged_entry_id", e.getFlaggedEntryId().toString());
        details.put("declared_balance", e.getDeclaredBalance().toPlainString());
        details.put("computed_balance", e.getComputedBalance().toPlainString());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "Balance Mismatch", e.getMessage(), details);
    }

    @ExceptionHandler(ConcurrencyTimeoutException.class)
    public ResponseEntity<ApiError> handleConcurrencyTimeout(ConcurrencyTimeoutException e) {
        log.warn("Concurrency timeout: {}", e.getMessage());
        ApiError body = ApiError.builder()
            .error("Busy")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
            .body(body);
    }

    @ExceptionHandler(AlreadyApprovedException.class)
    public ResponseEntity<ApiError> handleAlreadyApproved(AlreadyApprovedException e) {
        log.warn("Already approved: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, "Already Approved", e.getMessage(), null);
    }

    @ExceptionHandler(LedgerConflictException.class)
    public ResponseEntity<ApiError> handleLedgerConflict(LedgerConflictException e) {
        log.warn("Ledger conflict: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, "Ledger Conflict", e.getMessage(), null);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(ResourceNotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return error(HttpStatus.BAD_REQUEST, "Missing Required Header",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());
        return error(HttpStatus.BAD_REQUEST, "Missing Required Parameter",
                "Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return error(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(ConstraintViolationException e) {
        log.warn("Validation failed: {}", e.getMessage());
        Map<String, String> errors = e.getConstraintViolations()
            .stream()
            .collect(Collectors.toMap(
                violation -> violation.getPropertyPath().toString(),
                violation -> violation.getMessage(),
                (existing, replacement) -> existing
            ));
        return error(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid Request", "Malformed request", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String error, String message,
                                                  Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }
}
