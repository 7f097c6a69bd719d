package com.comanda.orderservice.exception;

import com.comanda.common.dto.ErrorResponse;
import com.comanda.common.dto.ValidationErrorResponse;
import com.comanda.common.exception.InsufficientStockException;
import com.comanda.common.exception.ResourceNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Maps every typed failure of the order and stock operations to an
 * {@link ErrorResponse} with a stable error code.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatus status, String message, String errorCode,
            String correlationId, HttpServletRequest request) {
        ErrorResponse errorResponse = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .errorCode(errorCode)
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, status);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request) {

        return buildResponse(HttpStatus.NOT_FOUND, ex.getMessage(), "RESOURCE_NOT_FOUND",
                generateCorrelationId(), request);
    }

    @ExceptionHandler(ItemsUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleItemsUnavailableException(
            ItemsUnavailableException ex,
            HttpServletRequest request) {

        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), "ITEMS_NOT_AVAILABLE",
                generateCorrelationId(), request);
    }

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientStockException(
            InsufficientStockException ex,
            HttpServletRequest request) {

        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), "INSUFFICIENT_STOCK",
                generateCorrelationId(), request);
    }

    @ExceptionHandler(InvalidStatusTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidStatusTransitionException(
            InvalidStatusTransitionException ex,
            HttpServletRequest request) {

        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), "INVALID_STATUS_TRANSITION",
                generateCorrelationId(), request);
    }

    @ExceptionHandler(CannotCancelDeliveredException.class)
    public ResponseEntity<ErrorResponse> handleCannotCancelDeliveredException(
            CannotCancelDeliveredException ex,
            HttpServletRequest request) {

        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), "CANNOT_CANCEL_DELIVERED_ORDER",
                generateCorrelationId(), request);
    }

    @ExceptionHandler(AlreadyCancelledException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyCancelledException(
            AlreadyCancelledException ex,
            HttpServletRequest request) {

        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), "ORDER_ALREADY_CANCELLED",
                generateCorrelationId(), request);
    }

    @ExceptionHandler(InvalidInventoryOperationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInventoryOperationException(
            InvalidInventoryOperationException ex,
            HttpServletRequest request) {

        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), "INVALID_INVENTORY_OPERATION",
                generateCorrelationId(), request);
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
        log.debug("[{}] Validation failed - Path: {} - Errors: {}", correlationId, request.getRequestURI(),
                validationErrors);

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

    @ExceptionHandler({ IllegalArgumentException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class })
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            Exception ex,
            HttpServletRequest request) {

        String message = ex instanceof IllegalArgumentException
                ? ex.getMessage()
                : "Malformed request parameter or body";
        return buildResponse(HttpStatus.BAD_REQUEST, message, "INVALID_ARGUMENT",
                generateCorrelationId(), request);
    }

    /**
     * Two writers raced on the same order version. Nothing was written by the
     * losing request, so the caller can reload and retry.
     */
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLockingFailureException(
            OptimisticLockingFailureException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.warn("[{}] Optimistic locking conflict detected - Path: {}", correlationId, request.getRequestURI());

        return buildResponse(HttpStatus.CONFLICT,
                "The order was modified by another request. Please refresh and try again.",
                "CONCURRENT_MODIFICATION", correlationId, request);
    }

    // Lock timeouts, deadlocks, connection loss. The whole unit was rolled back.
    @ExceptionHandler({ DataAccessException.class, TransactionException.class })
    public ResponseEntity<ErrorResponse> handleTransactionFailure(
            Exception ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.error("[{}] Transaction failed - Path: {} - Exception: {}",
                correlationId, request.getRequestURI(), ex.getMessage(), ex);

        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR,
                "The operation could not be completed and was rolled back. Please try again.",
                "TRANSACTION_FAILED", correlationId, request);
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

        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please contact support if the problem persists.",
                "INTERNAL_SERVER_ERROR", correlationId, request);
    }
}
