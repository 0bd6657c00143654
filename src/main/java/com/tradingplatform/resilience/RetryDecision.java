package com.tradingplatform.resilience;

import com.tradingplatform.exception.OrderExecutionException;
import lombok.Value;

/**
 * Outcome of {@link ErrorClassifier#handleError}: whether the caller may resubmit,
 * and the error to report upward. Components never retry on their own.
 */
@Value
public class RetryDecision {

    boolean shouldRetry;
    OrderExecutionException error;

    /** Number of retryable failures recorded for the context so far. Zero when not counted. */
    int attempt;

    public static RetryDecision retry(OrderExecutionException error, int attempt) {
        return new RetryDecision(true, error, attempt);
    }

    public static RetryDecision giveUp(OrderExecutionException error, int attempt) {
        return new RetryDecision(false, error, attempt);
    }
}
