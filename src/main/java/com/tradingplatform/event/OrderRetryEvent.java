package com.tradingplatform.event;

import com.tradingplatform.exception.ErrorCode;
import org.springframework.context.ApplicationEvent;

/** Published each time the execution engine resubmits an order after a retryable failure. */
public class OrderRetryEvent extends ApplicationEvent {

    private final String orderId;
    private final int attempt;
    private final ErrorCode errorCode;

    public OrderRetryEvent(Object source, String orderId, int attempt, ErrorCode errorCode) {
        super(source);
        this.orderId = orderId;
        this.attempt = attempt;
        this.errorCode = errorCode;
    }

    public String getOrderId() {
        return orderId;
    }

    public int getAttempt() {
        return attempt;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
