package com.tradingplatform.broker;

import com.tradingplatform.exception.OrderExecutionException;
import lombok.Value;

/**
 * Outcome of a routed broker call: either a value, or an error with the classifier's
 * decision on whether the caller may resubmit.
 */
@Value
public class BrokerCallResult<T> {

    T value;
    boolean shouldRetry;
    OrderExecutionException error;

    public static <T> BrokerCallResult<T> success(T value) {
        return new BrokerCallResult<>(value, false, null);
    }

    public static <T> BrokerCallResult<T> failure(OrderExecutionException error, boolean shouldRetry) {
        return new BrokerCallResult<>(null, shouldRetry, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
