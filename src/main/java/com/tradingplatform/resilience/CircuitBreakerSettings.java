package com.tradingplatform.resilience;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Per-destination breaker thresholds, shared by every breaker of one engine instance. */
@Value
@Builder
public class CircuitBreakerSettings {

    /** Consecutive failures in CLOSED that open the breaker. */
    @Builder.Default
    int failureThreshold = 5;

    /** Time an OPEN breaker refuses calls before it admits a trial call. */
    @Builder.Default
    Duration resetTimeout = Duration.ofSeconds(30);

    /** Trial calls admitted in HALF_OPEN; this many successes close the breaker. */
    @Builder.Default
    int halfOpenMaxCalls = 1;

    public static CircuitBreakerSettings ofDefaults() {
        return builder().build();
    }

    public CircuitBreakerSettings validate() {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        if (resetTimeout == null || resetTimeout.toMillis() < 1) {
            throw new IllegalArgumentException("resetTimeout must be at least 1 ms");
        }
        if (halfOpenMaxCalls < 1) {
            throw new IllegalArgumentException("halfOpenMaxCalls must be at least 1");
        }
        return this;
    }
}
