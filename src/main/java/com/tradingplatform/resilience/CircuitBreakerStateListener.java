package com.tradingplatform.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

/** Notified after a breaker changes state. */
@FunctionalInterface
public interface CircuitBreakerStateListener {

    void onStateTransition(String breakerName, CircuitBreaker.State from, CircuitBreaker.State to);
}
