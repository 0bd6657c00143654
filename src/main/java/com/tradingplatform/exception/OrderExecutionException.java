package com.tradingplatform.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Uniform failure reported by every component of the execution engine.
 *
 * <p>Carries a {@link ErrorType} and {@link ErrorSeverity} in addition to the
 * {@link ErrorCode}, the component that raised it ({@code source}) and, when known,
 * the order it relates to. The underlying failure is held as the direct cause and
 * is never searched transitively: classification uses the explicit checks below.
 *
 * <p>Instances are immutable. {@link #withOrderId(String)} returns a copy.
 */
@Getter
public class OrderExecutionException extends BaseException {

    private final ErrorType type;
    private final ErrorSeverity severity;
    private final String source;
    private final String orderId;

    public OrderExecutionException(
            ErrorType type,
            ErrorSeverity severity,
            ErrorCode errorCode,
            String message,
            Throwable cause,
            String source,
            String orderId) {
        super(errorCode, message, detailsOf(type, source, orderId), cause);
        this.type = type;
        this.severity = severity;
        this.source = source;
        this.orderId = orderId;
    }

    public static OrderExecutionException validation(ErrorCode errorCode, String message, String source) {
        return new OrderExecutionException(
                ErrorType.VALIDATION, ErrorSeverity.WARNING, errorCode, message, null, source, null);
    }

    public static OrderExecutionException execution(
            ErrorCode errorCode, String message, Throwable cause, String source) {
        return new OrderExecutionException(
                ErrorType.EXECUTION, ErrorSeverity.ERROR, errorCode, message, cause, source, null);
    }

    public static OrderExecutionException network(ErrorCode errorCode, String message, Throwable cause, String source) {
        return new OrderExecutionException(
                ErrorType.NETWORK, ErrorSeverity.ERROR, errorCode, message, cause, source, null);
    }

    public static OrderExecutionException system(String message, Throwable cause, String source) {
        return new OrderExecutionException(
                ErrorType.SYSTEM, ErrorSeverity.CRITICAL, ErrorCode.INTERNAL_ERROR, message, cause, source, null);
    }

    public OrderExecutionException withOrderId(String orderId) {
        return new OrderExecutionException(type, severity, getErrorCode(), getMessage(), getCause(), source, orderId);
    }

    public boolean isValidation() {
        return type == ErrorType.VALIDATION;
    }

    /** Network and System failures whose detail must be generalized for external consumers. */
    public boolean isTransient() {
        return type == ErrorType.NETWORK || type == ErrorType.SYSTEM;
    }

    public boolean hasCode(ErrorCode code) {
        return getErrorCode() == code;
    }

    public boolean hasCause() {
        return getCause() != null;
    }

    /** True when the direct cause is an instance of {@code causeType}. */
    public boolean causedBy(Class<? extends Throwable> causeType) {
        return causeType.isInstance(getCause());
    }

    private static Map<String, Object> detailsOf(ErrorType type, String source, String orderId) {
        if (orderId == null) {
            return Map.of("type", type.name(), "source", source == null ? "" : source);
        }
        return Map.of("type", type.name(), "source", source == null ? "" : source, "orderId", orderId);
    }
}
