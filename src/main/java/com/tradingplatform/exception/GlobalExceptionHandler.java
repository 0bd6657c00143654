package com.tradingplatform.exception;

import com.tradingplatform.api.dto.response.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to {@link ApiErrorResponse} envelopes. The HTTP status always comes from
 * the {@link ErrorCode}.
 *
 * <p>Network and system failures are reported with a generic message; their detail is
 * logged only.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String GENERIC_EXECUTION_MESSAGE = "execution failed";

    // ========================
    // REQUEST ERRORS
    // ========================

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidBody(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> fieldErrors = new TreeMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(error -> fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage()));
        return respond(ErrorCode.VALIDATION_ERROR, "Validation failed", fieldErrors, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.debug("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(ErrorCode.BAD_REQUEST, "Malformed request body", null, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        return respond(
                ErrorCode.INVALID_PARAMETER,
                String.format("Invalid value '%s' for parameter %s", ex.getValue(), ex.getName()),
                null,
                request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
        return respond(ErrorCode.NOT_FOUND, ex.getMessage(), null, request);
    }

    // ========================
    // ENGINE ERRORS
    // ========================

    @ExceptionHandler(OrderExecutionException.class)
    public ResponseEntity<ApiErrorResponse> handleExecution(OrderExecutionException ex, HttpServletRequest request) {
        if (ex.isTransient()) {
            log.error("{} failure from {} [code={}, orderId={}]",
                    ex.getType(), ex.getSource(), ex.getErrorCode(), ex.getOrderId(), ex);
            return respond(ex.getErrorCode(), GENERIC_EXECUTION_MESSAGE, ex.getDetails(), request);
        }
        log.warn("{} error from {}: {} [code={}, orderId={}]",
                ex.getType(), ex.getSource(), ex.getMessage(), ex.getErrorCode(), ex.getOrderId());
        return respond(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), request);
    }

    /** Venue exceptions that escaped the router unclassified. */
    @ExceptionHandler(BrokerException.class)
    public ResponseEntity<ApiErrorResponse> handleBroker(BrokerException ex, HttpServletRequest request) {
        log.error("Unclassified broker failure [code={}]", ex.getErrorCode(), ex);
        return respond(ex.getErrorCode(), GENERIC_EXECUTION_MESSAGE, null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, request);
    }

    private static ResponseEntity<ApiErrorResponse> respond(
            ErrorCode errorCode, String message, Map<String, Object> details, HttpServletRequest request) {
        return ResponseEntity.status(errorCode.getHttpStatus())
                .body(ApiErrorResponse.of(errorCode, message, details, request.getRequestURI()));
    }
}
