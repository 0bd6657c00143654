package com.tradingplatform.resilience;

import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.exception.ErrorSeverity;
import com.tradingplatform.exception.ErrorType;
import com.tradingplatform.exception.OrderExecutionException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.circuitbreaker.IllegalStateTransitionException;
import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the resilience4j circuit breakers of one engine instance, one per destination name.
 *
 * <p>Breakers are created on first use from {@link CircuitBreakerSettings}:
 * <ul>
 *   <li>CLOSED: a count-based window of {@code failureThreshold} calls at a 100% failure
 *       rate, i.e. {@code failureThreshold} consecutive failures open the breaker</li>
 *   <li>OPEN: calls are refused until {@code resetTimeout} has passed on the injected clock;
 *       the next call is a trial call and moves the breaker to HALF_OPEN</li>
 *   <li>HALF_OPEN: at most {@code halfOpenMaxCalls} permits; any failed trial call reopens the
 *       breaker, {@code halfOpenMaxCalls} successes close it</li>
 * </ul>
 *
 * <p>Callers drive the permit protocol directly: {@link CircuitBreaker#tryAcquirePermission()}
 * followed by exactly one of {@link #recordSuccess}, {@link #recordFailure} or
 * {@link CircuitBreaker#releasePermission()}.
 */
public class CircuitBreakerManager {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerManager.class);

    private final CircuitBreakerSettings settings;
    private final CircuitBreakerRegistry registry;
    private final List<CircuitBreakerStateListener> listeners;

    public CircuitBreakerManager(
            CircuitBreakerSettings settings, Clock clock, Collection<CircuitBreakerStateListener> listeners) {
        this.settings = settings.validate();
        this.listeners = List.copyOf(listeners);
        this.registry = CircuitBreakerRegistry.of(toConfig(this.settings, clock));
        registry.getEventPublisher().onEntryAdded(event -> attach(event.getAddedEntry()));
    }

    static CircuitBreakerConfig toConfig(CircuitBreakerSettings settings, Clock clock) {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.getFailureThreshold())
                .minimumNumberOfCalls(settings.getFailureThreshold())
                .failureRateThreshold(100)
                .waitDurationInOpenState(settings.getResetTimeout())
                .permittedNumberOfCallsInHalfOpenState(settings.getHalfOpenMaxCalls())
                .clock(clock)
                .currentTimestampFunction(Clock::millis, TimeUnit.MILLISECONDS)
                .build();
    }

    /** Returns the breaker for {@code name}, creating it if absent. */
    public CircuitBreaker circuitBreaker(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("circuit breaker name is required");
        }
        return registry.circuitBreaker(name);
    }

    /** Looks a breaker up without creating it. */
    public Optional<CircuitBreaker> find(String name) {
        return registry.getAllCircuitBreakers().stream()
                .filter(breaker -> breaker.getName().equals(name))
                .findFirst();
    }

    public void recordSuccess(CircuitBreaker breaker, long startedAt) {
        breaker.onSuccess(breaker.getCurrentTimestamp() - startedAt, breaker.getTimestampUnit());
    }

    /**
     * Records a failed call. resilience4j only evaluates a half-open window once every trial call
     * has reported, so a failed trial call reopens the breaker explicitly.
     */
    public void recordFailure(CircuitBreaker breaker, long startedAt, Throwable error) {
        boolean probing = breaker.getState() == CircuitBreaker.State.HALF_OPEN;
        breaker.onError(breaker.getCurrentTimestamp() - startedAt, breaker.getTimestampUnit(), error);
        if (probing && breaker.getState() == CircuitBreaker.State.HALF_OPEN) {
            try {
                breaker.transitionToOpenState();
            } catch (IllegalStateTransitionException e) {
                // another caller already moved the breaker on
                log.debug("Circuit breaker {} left HALF_OPEN concurrently: {}", breaker.getName(), e.getMessage());
            }
        }
    }

    /** Forces the breaker back to CLOSED with an empty window. */
    public CircuitBreakerSnapshot reset(CircuitBreaker breaker) {
        breaker.reset();
        return snapshot(breaker);
    }

    public CircuitBreakerSnapshot snapshot(CircuitBreaker breaker) {
        CircuitBreaker.Metrics metrics = breaker.getMetrics();
        return new CircuitBreakerSnapshot(
                breaker.getName(),
                breaker.getState(),
                metrics.getNumberOfBufferedCalls(),
                metrics.getNumberOfFailedCalls(),
                metrics.getNumberOfNotPermittedCalls(),
                settings.getFailureThreshold(),
                settings.getResetTimeout().toMillis(),
                settings.getHalfOpenMaxCalls());
    }

    public List<CircuitBreakerSnapshot> snapshots() {
        return registry.getAllCircuitBreakers().stream()
                .map(this::snapshot)
                .sorted(Comparator.comparing(CircuitBreakerSnapshot::getName))
                .collect(Collectors.toList());
    }

    public CircuitBreakerSettings getSettings() {
        return settings;
    }

    public OrderExecutionException openCircuitError(String name) {
        return new OrderExecutionException(
                ErrorType.EXECUTION,
                ErrorSeverity.WARNING,
                ErrorCode.CIRCUIT_OPEN,
                "service unavailable: circuit breaker '" + name + "' is open",
                null,
                "circuit-breaker",
                null);
    }

    private void attach(CircuitBreaker breaker) {
        breaker.getEventPublisher().onStateTransition(event -> {
            CircuitBreaker.State from = event.getStateTransition().getFromState();
            CircuitBreaker.State to = event.getStateTransition().getToState();
            if (to == CircuitBreaker.State.OPEN) {
                log.warn("Circuit breaker {} opened (from {})", breaker.getName(), from);
            } else {
                log.info("Circuit breaker {} transitioned {} -> {}", breaker.getName(), from, to);
            }
            for (CircuitBreakerStateListener listener : listeners) {
                try {
                    listener.onStateTransition(breaker.getName(), from, to);
                } catch (RuntimeException e) {
                    log.error("Circuit breaker listener failed for {}: {}", breaker.getName(), e.getMessage(), e);
                }
            }
        });
    }
}
