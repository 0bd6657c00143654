package com.tradingplatform.api.controller;

import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.exception.OrderExecutionException;
import com.tradingplatform.resilience.CircuitBreakerManager;
import com.tradingplatform.resilience.CircuitBreakerSnapshot;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Inspection and manual reset of the per-broker circuit breakers. */
@RestController
@RequestMapping("/api/circuit-breakers")
public class CircuitBreakerController {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerController.class);

    private final CircuitBreakerManager circuitBreakerManager;

    public CircuitBreakerController(CircuitBreakerManager circuitBreakerManager) {
        this.circuitBreakerManager = circuitBreakerManager;
    }

    @GetMapping
    public ResponseEntity<List<CircuitBreakerSnapshot>> listBreakers() {
        return ResponseEntity.ok(circuitBreakerManager.snapshots());
    }

    /** Forces a breaker back to CLOSED. Names contain a colon, e.g. {@code broker:CLIENT1}. */
    @PostMapping("/{name}/reset")
    public ResponseEntity<CircuitBreakerSnapshot> resetBreaker(@PathVariable String name) {
        CircuitBreaker breaker = circuitBreakerManager
                .find(name)
                .orElseThrow(() -> OrderExecutionException.validation(
                        ErrorCode.NOT_FOUND, "Circuit breaker not found: " + name, "circuit-breaker-api"));
        log.warn("Manual reset of circuit breaker {} (was {})", name, breaker.getState());
        return ResponseEntity.ok(circuitBreakerManager.reset(breaker));
    }
}
