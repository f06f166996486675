package com.linkvault.sync.controller;

import com.linkvault.sync.aggregator.AggregatorException;
import com.linkvault.sync.aggregator.ItemLoginRequiredException;
import com.linkvault.sync.aggregator.RateLimitedException;
import com.linkvault.sync.connection.ConnectionNotFoundException;
import com.linkvault.sync.connection.DuplicateConnectionException;
import com.linkvault.sync.controller.dto.ErrorResponseDto;
import com.linkvault.sync.security.CredentialException;
import com.linkvault.sync.security.RequestContextHolder;
import com.linkvault.sync.service.SyncCancelledException;
import com.linkvault.sync.storage.StorageException;
import jakarta.validation.ConstraintViolationException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            ConstraintViolationException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(ConnectionNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(ConnectionNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "CONNECTION_NOT_FOUND", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(DuplicateConnectionException.class)
    public ResponseEntity<ErrorResponseDto> handleDuplicate(DuplicateConnectionException ex) {
        return build(HttpStatus.CONFLICT, "DUPLICATE_CONNECTION", ex.getMessage(),
                Map.of("existingItemId", ex.existingConnectionId()));
    }

    @ExceptionHandler(ItemLoginRequiredException.class)
    public ResponseEntity<ErrorResponseDto> handleLoginRequired(ItemLoginRequiredException ex) {
        return build(HttpStatus.CONFLICT, "ITEM_LOGIN_REQUIRED", "Institution requires the user to log in again",
                Map.of("aggregatorCode", ex.errorCode()));
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ErrorResponseDto> handleRateLimited(RateLimitedException ex) {
        return build(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED", "Aggregator rate limit reached, retry later",
                Map.of("aggregatorCode", ex.errorCode()));
    }

    @ExceptionHandler(AggregatorException.class)
    public ResponseEntity<ErrorResponseDto> handleAggregator(AggregatorException ex) {
        return build(HttpStatus.BAD_GATEWAY, "AGGREGATOR_ERROR", ex.getMessage(),
                Map.of("aggregatorCode", ex.errorCode()));
    }

    @ExceptionHandler(CredentialException.class)
    public ResponseEntity<ErrorResponseDto> handleCredential(CredentialException ex) {
        log.error("Credential failure: {}", ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "CREDENTIAL_ERROR", "Stored credential could not be used", Map.of());
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponseDto> handleStorage(StorageException ex) {
        log.error("Storage failure", ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "STORAGE_ERROR", "Storage temporarily unavailable", Map.of());
    }

    @ExceptionHandler(SyncCancelledException.class)
    public ResponseEntity<ErrorResponseDto> handleCancelled(SyncCancelledException ex) {
        return build(HttpStatus.CONFLICT, "SYNC_CANCELLED", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponseDto> handleAuthentication(AuthenticationException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return build(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled exception", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", Map.of());
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, RequestContextHolder.currentTraceId()));
    }
}
