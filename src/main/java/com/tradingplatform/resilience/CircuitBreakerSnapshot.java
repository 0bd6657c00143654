package com.tradingplatform.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.Value;

@Value
public class CircuitBreakerSnapshot {

    String name;
    CircuitBreaker.State state;
    int bufferedCalls;
    int failedCalls;
    long notPermittedCalls;
    int failureThreshold;
    long resetTimeoutMillis;
    int halfOpenMaxCalls;
}
