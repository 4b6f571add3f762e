package com.postx.pool.exception;

import com.postx.pool.dto.ErrorResponse;
import jakarta.validation.ConstraintViolationException;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps pool errors to structured JSON. Pool-not-configured and pool-exhausted are operational
 * conditions and always reach the caller with their own error codes.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex, WebRequest request) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult()
                .getAllErrors()
                .forEach(
                        error -> {
                            String fieldName =
                                    error instanceof FieldError
                                            ? ((FieldError) error).getField()
                                            : error.getObjectName();
                            errors.put(fieldName, error.getDefaultMessage());
                        });

        ErrorResponse errorResponse =
                createErrorResponse(
                        HttpStatus.BAD_REQUEST,
                        "VALIDATION_ERROR",
                        "Validation failed for one or more fields",
                        request);
        errorResponse.setValidationErrors(errors);

        log.warn("Validation error: {}", errors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(
            Exception ex, WebRequest request) {
        log.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(
                        createErrorResponse(
                                HttpStatus.BAD_REQUEST,
                                "MALFORMED_REQUEST",
                                "Request could not be read",
                                request));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, WebRequest request) {
        Map<String, String> errors = new HashMap<>();
        ex.getConstraintViolations()
                .forEach(v -> errors.put(v.getPropertyPath().toString(), v.getMessage()));

        ErrorResponse errorResponse =
                createErrorResponse(
                        HttpStatus.BAD_REQUEST,
                        "VALIDATION_ERROR",
                        "Validation failed for one or more parameters",
                        request);
        errorResponse.setValidationErrors(errors);

        log.warn("Constraint violation: {}", errors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(PoolNotConfiguredException.class)
    public ResponseEntity<ErrorResponse> handlePoolNotConfigured(
            PoolNotConfiguredException ex, WebRequest request) {
        log.warn("Pool not configured: brand={}, platform={}", ex.getBrandId(), ex.getPlatform());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(
                        createErrorResponse(
                                HttpStatus.NOT_FOUND,
                                "POOL_NOT_CONFIGURED",
                                ex.getMessage(),
                                request));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(
            ResourceNotFoundException ex, WebRequest request) {
        log.warn("Resource not found: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(
                        createErrorResponse(
                                HttpStatus.NOT_FOUND, "RESOURCE_NOT_FOUND", ex.getMessage(), request));
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApiException(ApiException ex, WebRequest request) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("API error {}: {}", ex.getErrorCode(), ex.getMessage());
        } else {
            log.warn("API error {}: {}", ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatus())
                .body(createErrorResponse(ex.getStatus(), ex.getErrorCode(), ex.getMessage(), request));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, WebRequest request) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(
                        createErrorResponse(
                                HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, WebRequest request) {
        ErrorResponse errorResponse =
                createErrorResponse(
                        HttpStatus.INTERNAL_SERVER_ERROR,
                        "INTERNAL_ERROR",
                        "An unexpected error occurred",
                        request);
        log.error("Unexpected error [{}]: {}", errorResponse.getRequestId(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private ErrorResponse createErrorResponse(
            HttpStatus status, String errorCode, String message, WebRequest request) {
        return ErrorResponse.builder()
                .status(status.value())
                .errorCode(errorCode)
                .message(message)
                .path(request.getDescription(false).replace("uri=", ""))
                .requestId(UUID.randomUUID().toString())
                .timestamp(LocalDateTime.now())
                .build();
    }
}
