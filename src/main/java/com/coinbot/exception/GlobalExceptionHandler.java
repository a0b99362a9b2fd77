package com.coinbot.exception;

import com.coinbot.dto.ApiResponse;
import com.coinbot.service.RateLimiterService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * Global exception handler for all REST controllers.
 * Maps engine exceptions onto the {@link ApiResponse} envelope with a fitting status code.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String MALFORMED_JSON_MESSAGE = "Malformed JSON request. Please check your request body format.";

    /**
     * Invalid risk or strategy configuration. The session did not start, or the reload was
     * rejected and the previous snapshot is still in force.
     */
    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConfigurationException(ConfigurationException e) {
        log.warn("Configuration rejected: {}", e.getMessage());
        return createErrorResponse(HttpStatus.BAD_REQUEST, "Configuration error: " + e.getMessage());
    }

    @ExceptionHandler(PositionNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handlePositionNotFound(PositionNotFoundException e) {
        log.warn(e.getMessage());
        return createErrorResponse(HttpStatus.NOT_FOUND, e.getMessage());
    }

    /**
     * Exchange failures that reach a controller, e.g. a manual call made outside the engine loops.
     */
    @ExceptionHandler(ExchangeException.class)
    public ResponseEntity<ApiResponse<Void>> handleExchangeException(ExchangeException e) {
        log.error("Exchange error: {}", e.getMessage(), e);
        return createErrorResponse(HttpStatus.BAD_GATEWAY, "Exchange error: " + e.getMessage());
    }

    @ExceptionHandler(RateLimiterService.RateLimitExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleRateLimitExceededException(
            RateLimiterService.RateLimitExceededException e) {
        log.warn("Rate limit exceeded: {}", e.getMessage());
        return createErrorResponse(HttpStatus.TOO_MANY_REQUESTS, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleHttpMessageNotReadable(HttpMessageNotReadableException e) {
        log.warn("Malformed JSON request: {}", e.getMessage());
        return createErrorResponse(HttpStatus.BAD_REQUEST, MALFORMED_JSON_MESSAGE);
    }

    /**
     * Bean validation failures on request bodies, e.g. a reload with an out-of-range field.
     * Every rejected field is reported.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(MethodArgumentNotValidException e) {
        List<String> violations = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        String message = violations.isEmpty() ? "Request validation failed" : String.join("; ", violations);
        log.warn("Rejected request body: {}", message);
        return createErrorResponse(HttpStatus.BAD_REQUEST, "Validation error: " + message);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return createErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /**
     * Operation not allowed in the current session or position state.
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalStateException(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return createErrorResponse(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatchException(MethodArgumentTypeMismatchException e) {
        String message = String.format("Invalid value '%s' for parameter '%s'", e.getValue(), e.getName());
        log.warn("Type mismatch: {}", message);
        return createErrorResponse(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return createErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error: " + e.getMessage());
    }

    private static ResponseEntity<ApiResponse<Void>> createErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiResponse.error(message));
    }
}
