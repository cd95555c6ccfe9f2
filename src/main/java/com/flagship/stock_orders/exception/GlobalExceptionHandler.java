package com.flagship.stock_orders.exception;

import com.flagship.stock_orders.observability.CorrelationContext;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the service's exception taxonomy onto HTTP statuses and a single
 * {@link ApiError} body shape.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ValidationException e, HttpServletRequest request) {
        log.warn("Validation failed: code={}, message={}", e.getCode(), e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e.getCode(), e.getMessage(), null, request);
    }

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<ApiError> handleInsufficientStock(InsufficientStockException e, HttpServletRequest request) {
        log.warn("Insufficient stock: {}", e.getMessage());
        Map<String, String> details = Map.of(
            "stockItemId", String.valueOf(e.getStockItemId()),
            "stockItemName", String.valueOf(e.getStockItemName()),
            "requested", String.valueOf(e.getRequestedQuantity()),
            "available", String.valueOf(e.getAvailableQuantity())
        );
        return build(HttpStatus.BAD_REQUEST, ValidationException.INSUFFICIENT_STOCK, e.getMessage(), details, request);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ApiError> handleInvalidTransition(InvalidTransitionException e, HttpServletRequest request) {
        log.warn("Invalid transition: orderId={}, message={}", e.getOrderId(), e.getMessage());
        return build(HttpStatus.CONFLICT, "invalid_transition", e.getMessage(), null, request);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException e, HttpServletRequest request) {
        log.info("Not found: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, "not_found", e.getMessage(), null, request);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiError> handleConflict(ConflictException e, HttpServletRequest request) {
        log.warn("Conflict: code={}, message={}", e.getCode(), e.getMessage());
        return build(HttpStatus.CONFLICT, e.getCode(), e.getMessage(), null, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleBeanValidation(MethodArgumentNotValidException e, HttpServletRequest request) {
        log.warn("Request validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return build(HttpStatus.BAD_REQUEST, "validation_failed", "Request validation failed", errors, request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception e, HttpServletRequest request) {
        log.warn("Malformed request: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "malformed_request", "Request could not be read", null, request);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ApiError> handleAuthentication(AuthenticationException e, HttpServletRequest request) {
        log.warn("Authentication failed: {}", e.getMessage());
        return build(HttpStatus.UNAUTHORIZED, "unauthorized", "Invalid credentials", null, request);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ApiError> handleAccessDenied(AccessDeniedException e, HttpServletRequest request) {
        log.warn("Access denied: {}", e.getMessage());
        return build(HttpStatus.FORBIDDEN, "forbidden", "Access denied", null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e, HttpServletRequest request) {
        log.error("Unexpected error", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
            "An unexpected error occurred", null, request);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String code, String message,
                                           Map<String, String> details, HttpServletRequest request) {
        ApiError error = ApiError.builder()
            .error(code)
            .message(message)
            .details(details)
            .path(request.getRequestURI())
            .correlationId(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY))
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(error);
    }
}
