package com.tradingplatform.resilience;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.tradingplatform.exception.BaseException;
import com.tradingplatform.exception.BrokerAuthenticationException;
import com.tradingplatform.exception.BrokerConnectionException;
import com.tradingplatform.exception.BrokerException;
import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.exception.ErrorSeverity;
import com.tradingplatform.exception.ErrorType;
import com.tradingplatform.exception.OrderExecutionException;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Categorizes failures and decides whether the caller may resubmit.
 *
 * <p>Retry budgets are tracked per caller-supplied context (typically one per order
 * submission). Each retryable failure increments the context's counter; the caller
 * may retry while the counter is below {@code maxRetries}. Once the budget is spent
 * the context stays exhausted, so a new submission must use a new context.
 *
 * <p>Rules by {@link ErrorType}:
 * <ul>
 *   <li>VALIDATION: never retried, reported verbatim</li>
 *   <li>EXECUTION: retried within budget, except margin, position, rate-limit,
 *       authentication, circuit-open and cancellation failures</li>
 *   <li>NETWORK: retried within budget, message generalized</li>
 *   <li>SYSTEM: retried within budget, logged at error level, message generalized</li>
 * </ul>
 *
 * <p>Counters are held in a Caffeine cache that evicts contexts idle for longer than
 * the configured retention. Exhausted contexts move to a second, size-bounded cache
 * that expires on write only, so a spent budget is not restored by idling; it is
 * forgotten only after {@code exhaustedRetention} or under size pressure.
 */
public class ErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(ErrorClassifier.class);

    static final String RETRYING_MESSAGE = "execution failed, retrying";
    static final String FAILED_MESSAGE = "execution failed";

    private static final Set<ErrorCode> NON_RETRYABLE_EXECUTION_CODES = EnumSet.of(
            ErrorCode.INSUFFICIENT_MARGIN,
            ErrorCode.POSITION_LIMIT_EXCEEDED,
            ErrorCode.RATE_LIMIT_EXCEEDED,
            ErrorCode.AUTHENTICATION_FAILED,
            ErrorCode.CIRCUIT_OPEN,
            ErrorCode.CANCELLED);

    public static final Duration DEFAULT_EXHAUSTED_RETENTION = Duration.ofHours(24);
    public static final long DEFAULT_EXHAUSTED_MAX_SIZE = 100_000;

    private final int maxRetries;
    private final Cache<String, AtomicInteger> retryCounters;
    private final Cache<String, Boolean> exhaustedContexts;

    public ErrorClassifier(int maxRetries, Duration contextRetention) {
        this(maxRetries, contextRetention, DEFAULT_EXHAUSTED_RETENTION, DEFAULT_EXHAUSTED_MAX_SIZE, Ticker.systemTicker());
    }

    public ErrorClassifier(
            int maxRetries,
            Duration contextRetention,
            Duration exhaustedRetention,
            long exhaustedMaxSize,
            Ticker ticker) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        if (exhaustedRetention.compareTo(contextRetention) < 0) {
            throw new IllegalArgumentException("exhaustedRetention must not be shorter than contextRetention");
        }
        this.maxRetries = maxRetries;
        this.retryCounters = Caffeine.newBuilder()
                .expireAfterAccess(contextRetention)
                .ticker(ticker)
                .build();
        this.exhaustedContexts = Caffeine.newBuilder()
                .expireAfterWrite(exhaustedRetention)
                .maximumSize(exhaustedMaxSize)
                .ticker(ticker)
                .build();
    }

    /**
     * Classifies {@code error} for the given context and records it against the context's budget.
     *
     * @param context caller-chosen identity of the operation being retried, e.g. {@code submit:ORD-1}
     * @param error the failure to classify
     * @return the retry decision and the error to surface
     */
    public RetryDecision handleError(String context, OrderExecutionException error) {
        if (context == null || context.isBlank()) {
            throw new IllegalArgumentException("context is required");
        }
        if (error == null) {
            throw new IllegalArgumentException("error is required");
        }

        if (error.isValidation()) {
            log.warn("Validation error [context={}, code={}]: {}", context, error.getErrorCode(), error.getMessage());
            return RetryDecision.giveUp(error, 0);
        }

        if (error.getType() == ErrorType.EXECUTION && NON_RETRYABLE_EXECUTION_CODES.contains(error.getErrorCode())) {
            log.warn(
                    "Non-retryable execution error [context={}, code={}]: {}",
                    context,
                    error.getErrorCode(),
                    error.getMessage());
            return RetryDecision.giveUp(error, 0);
        }

        if (exhaustedContexts.getIfPresent(context) != null) {
            log.warn("Retry budget already exhausted [context={}, code={}]", context, error.getErrorCode());
            OrderExecutionException reported = error.isTransient() ? generalize(error, false) : error;
            return RetryDecision.giveUp(reported, maxRetries);
        }

        int attempt = retryCounters.get(context, key -> new AtomicInteger()).incrementAndGet();
        boolean shouldRetry = attempt < maxRetries;
        if (!shouldRetry) {
            exhaustedContexts.put(context, Boolean.TRUE);
            retryCounters.invalidate(context);
        }
        logRetryable(context, error, attempt, shouldRetry);

        OrderExecutionException reported = error.isTransient() ? generalize(error, shouldRetry) : error;
        return shouldRetry ? RetryDecision.retry(reported, attempt) : RetryDecision.giveUp(reported, attempt);
    }

    /**
     * Converts an arbitrary failure into an {@link OrderExecutionException}.
     * Connectivity and timeouts become NETWORK, venue failures EXECUTION, and anything
     * unrecognised SYSTEM.
     */
    public OrderExecutionException classify(Throwable failure, String source) {
        if (failure instanceof OrderExecutionException) {
            return (OrderExecutionException) failure;
        }
        if (failure instanceof BrokerConnectionException) {
            return OrderExecutionException.network(
                    ErrorCode.CONNECTION_FAILED, failure.getMessage(), failure, source);
        }
        if (failure instanceof BrokerAuthenticationException) {
            return OrderExecutionException.execution(
                    ErrorCode.AUTHENTICATION_FAILED, failure.getMessage(), failure, source);
        }
        if (failure instanceof BrokerException) {
            return OrderExecutionException.execution(
                    ((BaseException) failure).getErrorCode(), failure.getMessage(), failure, source);
        }
        if (failure instanceof TimeoutException) {
            return OrderExecutionException.network(ErrorCode.TIMEOUT, "operation timed out", failure, source);
        }
        if (failure instanceof IllegalArgumentException) {
            return OrderExecutionException.validation(ErrorCode.INVALID_PARAMETER, failure.getMessage(), source);
        }
        return OrderExecutionException.system("unexpected failure", failure, source);
    }

    /** Retryable failures recorded so far for {@code context}. */
    public int getRetryCount(String context) {
        if (exhaustedContexts.getIfPresent(context) != null) {
            return maxRetries;
        }
        AtomicInteger counter = retryCounters.getIfPresent(context);
        return counter == null ? 0 : counter.get();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private void logRetryable(String context, OrderExecutionException error, int attempt, boolean shouldRetry) {
        switch (error.getType()) {
            case SYSTEM:
                log.error(
                        "System error [context={}, source={}, attempt={}/{}, retry={}]",
                        context,
                        error.getSource(),
                        attempt,
                        maxRetries,
                        shouldRetry,
                        error);
                break;
            case NETWORK:
                // Transport detail is not logged
                log.warn(
                        "Network error [context={}, code={}, source={}, attempt={}/{}, retry={}]",
                        context,
                        error.getErrorCode(),
                        error.getSource(),
                        attempt,
                        maxRetries,
                        shouldRetry);
                break;
            default:
                log.warn(
                        "Execution error [context={}, code={}, attempt={}/{}, retry={}]: {}",
                        context,
                        error.getErrorCode(),
                        attempt,
                        maxRetries,
                        shouldRetry,
                        error.getMessage());
        }
    }

    private OrderExecutionException generalize(OrderExecutionException error, boolean retrying) {
        ErrorSeverity severity = retrying ? error.getSeverity() : ErrorSeverity.CRITICAL;
        return new OrderExecutionException(
                error.getType(),
                severity,
                error.getErrorCode(),
                retrying ? RETRYING_MESSAGE : FAILED_MESSAGE,
                error,
                error.getSource(),
                error.getOrderId());
    }
}
