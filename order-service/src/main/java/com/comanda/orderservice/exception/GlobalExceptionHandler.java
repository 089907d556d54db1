package com.comanda.orderservice.exception;

import com.comanda.common.dto.ErrorResponse;
import com.comanda.common.dto.ValidationErrorResponse;
import com.comanda.common.exception.EngineException;
import com.comanda.common.exception.ErrorCategory;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Single entry point for every typed engine failure. The category decides
     * the HTTP status, the error code carries the precise reason.
     */
    @ExceptionHandler(EngineException.class)
    public ResponseEntity<ErrorResponse> handleEngineException(
            EngineException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        HttpStatus status = statusFor(ex.getCategory());

        if (ex.isRetryable()) {
            log.warn("[{}] Retryable failure - Path: {} - Code: {} - {}",
                    correlationId, request.getRequestURI(), ex.getErrorCode(), ex.getMessage());
        } else {
            log.debug("[{}] Request rejected - Path: {} - Code: {} - {}",
                    correlationId, request.getRequestURI(), ex.getErrorCode(), ex.getMessage());
        }

        return build(status, ex.getMessage(), ex.getCategory().name(), ex.getErrorCode(), request, correlationId);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        Map<String, String> validationErrors = new HashMap<>();

        ex.getBindingResult().getAllErrors().forEach(error -> {
            if (error instanceof FieldError fieldError) {
                validationErrors.put(fieldError.getField(), error.getDefaultMessage());
            }
        });

        String correlationId = generateCorrelationId();
        log.debug("[{}] Validation failed - Path: {} - Errors: {}", correlationId, request.getRequestURI(), validationErrors);

        ValidationErrorResponse errorResponse = ValidationErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .message("Validation failed")
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .validationErrors(validationErrors)
                .errorCode("VALIDATION_FAILED")
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            Exception ex,
            HttpServletRequest request) {

        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), ErrorCategory.VALIDATION.name(),
                "INVALID_ARGUMENT", request, generateCorrelationId());
    }

    /**
     * Stale writes that escape the engine (courier profile edits racing a
     * reservation, for instance). The caller should re-read and retry.
     */
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLockingFailureException(
            OptimisticLockingFailureException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.warn("[{}] Optimistic locking conflict detected - Path: {} - User should retry",
                correlationId, request.getRequestURI());

        return build(HttpStatus.CONFLICT, "The record was modified by another request. Please refresh and try again.",
                ErrorCategory.CONCURRENCY_CONFLICT.name(), "CONCURRENT_MODIFICATION", request, correlationId);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(
            Exception ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.error("[{}] Unexpected error occurred - Path: {} - Exception: {}",
                correlationId,
                request.getRequestURI(),
                ex.getMessage(),
                ex);

        return build(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please contact support if the problem persists.",
                null, "INTERNAL_SERVER_ERROR", request, correlationId);
    }

    static HttpStatus statusFor(ErrorCategory category) {
        return switch (category) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case STATE_CONFLICT -> HttpStatus.UNPROCESSABLE_ENTITY;
            case CONCURRENCY_CONFLICT -> HttpStatus.CONFLICT;
            case RESOURCE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case DEPENDENCY_FAILURE -> HttpStatus.BAD_GATEWAY;
        };
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, String category,
            String errorCode, HttpServletRequest request, String correlationId) {
        ErrorResponse errorResponse = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .category(category)
                .errorCode(errorCode)
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, status);
    }
}
