package com.tradingplatform.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradingplatform.api.controller.CircuitBreakerController;
import com.tradingplatform.config.ApiResponseAdvice;
import com.tradingplatform.exception.GlobalExceptionHandler;
import com.tradingplatform.resilience.CircuitBreakerManager;
import com.tradingplatform.resilience.CircuitBreakerSettings;
import com.tradingplatform.unit.MutableClock;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for CircuitBreakerController, with the response envelope advice applied.
 */
class CircuitBreakerControllerTest {

    private MockMvc mockMvc;
    private CircuitBreakerManager circuitBreakerManager;

    @BeforeEach
    void setUp() {
        circuitBreakerManager = new CircuitBreakerManager(
                CircuitBreakerSettings.builder()
                        .failureThreshold(1)
                        .resetTimeout(Duration.ofSeconds(30))
                        .build(),
                MutableClock.startingAt("2024-03-01T09:15:00Z"),
                List.of());
        mockMvc = MockMvcBuilders.standaloneSetup(new CircuitBreakerController(circuitBreakerManager))
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    private void trip(CircuitBreaker breaker) {
        circuitBreakerManager.recordFailure(breaker, breaker.getCurrentTimestamp(), new IllegalStateException("venue down"));
    }

    @Test
    void listBreakers_returnsSnapshotsByName() throws Exception {
        circuitBreakerManager.circuitBreaker("broker:C-2");
        trip(circuitBreakerManager.circuitBreaker("broker:C-1"));

        mockMvc.perform(get("/api/circuit-breakers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].name").value("broker:C-1"))
                .andExpect(jsonPath("$.data[0].state").value("OPEN"))
                .andExpect(jsonPath("$.data[0].failureThreshold").value(1))
                .andExpect(jsonPath("$.data[1].state").value("CLOSED"));
    }

    @Test
    void resetBreaker_closesOpenBreaker() throws Exception {
        CircuitBreaker breaker = circuitBreakerManager.circuitBreaker("broker:C-1");
        trip(breaker);

        mockMvc.perform(post("/api/circuit-breakers/broker:C-1/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.state").value("CLOSED"))
                .andExpect(jsonPath("$.data.failedCalls").value(0));

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    void resetBreaker_unknownNameIs404AndCreatesNothing() throws Exception {
        mockMvc.perform(post("/api/circuit-breakers/broker:NOPE/reset"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.message").value("Circuit breaker not found: broker:NOPE"));

        assertThat(circuitBreakerManager.snapshots()).isEmpty();
    }
}
