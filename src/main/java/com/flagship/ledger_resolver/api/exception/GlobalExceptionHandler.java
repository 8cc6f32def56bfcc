package com.flagship.ledger_resolver.api.exception;

import com.flagship.ledger_resolver.exception.CacheInconsistencyException;
import com.flagship.ledger_resolver.exception.DidNotFoundAnywhereException;
import com.flagship.ledger_resolver.exception.LedgerNotFoundException;
import com.flagship.ledger_resolver.exception.LookupCancelledException;
import com.flagship.ledger_resolver.exception.NoLedgerConfiguredException;
import com.flagship.ledger_resolver.exception.PoolCloseException;
import com.flagship.ledger_resolver.exception.PoolConfigException;
import com.flagship.ledger_resolver.exception.PoolOpenException;
import com.flagship.ledger_resolver.observability.CorrelationContext;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps resolution failures to consistent JSON error responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({LedgerNotFoundException.class, DidNotFoundAnywhereException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage());
    }

    @ExceptionHandler(NoLedgerConfiguredException.class)
    public ResponseEntity<ErrorResponse> handleNoLedger(NoLedgerConfiguredException e) {
        log.warn("No ledger configured");
        return respond(HttpStatus.NOT_FOUND, "No Ledger Configured", e.getMessage());
    }

    @ExceptionHandler(CacheInconsistencyException.class)
    public ResponseEntity<ErrorResponse> handleCacheInconsistency(CacheInconsistencyException e) {
        log.warn("Cache inconsistency: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Cache Inconsistency", e.getMessage());
    }

    @ExceptionHandler(PoolConfigException.class)
    public ResponseEntity<ErrorResponse> handlePoolConfig(PoolConfigException e) {
        log.warn("Pool configuration error: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Pool Configuration Error", e.getMessage());
    }

    @ExceptionHandler({PoolOpenException.class, PoolCloseException.class})
    public ResponseEntity<ErrorResponse> handlePoolFailure(RuntimeException e) {
        log.error("Ledger pool failure: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "Ledger Pool Failure", e.getMessage());
    }

    @ExceptionHandler(LookupCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(LookupCancelledException e) {
        log.warn("Lookup cancelled: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Lookup Cancelled", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        error -> error.getField(),
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing
                ));

        ErrorResponse error = ErrorResponse.builder()
                .error("Validation Failed")
                .message("Request validation failed")
                .details(errors)
                .correlationId(currentCorrelationId())
                .timestamp(Instant.now())
                .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception e) {
        log.warn("Invalid request parameter: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .error(error)
                .message(message)
                .correlationId(currentCorrelationId())
                .timestamp(Instant.now())
                .build());
    }

    private static String currentCorrelationId() {
        return CorrelationContext.hasCorrelationId() ? CorrelationContext.getCorrelationId() : null;
    }

    @Value
    @Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        String correlationId;
        Instant timestamp;
    }
}
