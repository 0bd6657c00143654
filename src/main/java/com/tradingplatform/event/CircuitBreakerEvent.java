package com.tradingplatform.event;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.springframework.context.ApplicationEvent;

/** Published when a circuit breaker changes state. */
public class CircuitBreakerEvent extends ApplicationEvent {

    private final String breakerName;
    private final CircuitBreaker.State fromState;
    private final CircuitBreaker.State toState;

    public CircuitBreakerEvent(
            Object source, String breakerName, CircuitBreaker.State fromState, CircuitBreaker.State toState) {
        super(source);
        this.breakerName = breakerName;
        this.fromState = fromState;
        this.toState = toState;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public CircuitBreaker.State getFromState() {
        return fromState;
    }

    public CircuitBreaker.State getToState() {
        return toState;
    }
}
