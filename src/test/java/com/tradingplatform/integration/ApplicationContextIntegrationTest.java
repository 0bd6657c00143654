package com.tradingplatform.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradingplatform.broker.BrokerRouter;
import com.tradingplatform.observability.ExecutionMetrics;
import com.tradingplatform.resilience.CircuitBreakerManager;
import com.tradingplatform.resilience.ErrorClassifier;
import com.tradingplatform.risk.LoggingRiskManager;
import com.tradingplatform.risk.RiskManager;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Boots the full application context and checks the engine wiring and property binding,
 * then drives the REST surface through the response envelope.
 */
@SpringBootTest(properties = {
    "tradingplatform.errors.max-retries=5",
    "tradingplatform.circuit-breaker.failure-threshold=7"
})
@AutoConfigureMockMvc
class ApplicationContextIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RiskManager riskManager;

    @Autowired
    private ErrorClassifier errorClassifier;

    @Autowired
    private CircuitBreakerManager circuitBreakerManager;

    @Autowired
    private BrokerRouter brokerRouter;

    @Autowired
    private ExecutionMetrics executionMetrics;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    @DisplayName("Engine components are wired from properties")
    void wiring() {
        assertThat(riskManager).isInstanceOf(LoggingRiskManager.class);
        assertThat(errorClassifier.getMaxRetries()).isEqualTo(5);
        assertThat(circuitBreakerManager.getSettings().getFailureThreshold()).isEqualTo(7);
        assertThat(brokerRouter.registeredClientIds()).isEmpty();
        assertThat(executionMetrics).isNotNull();
        assertThat(meterRegistry.find("orders.submitted").counter()).isNotNull();
    }

    @Test
    @DisplayName("Risk profiles round-trip through the REST API inside the envelope")
    void riskProfileApi() throws Exception {
        mockMvc.perform(post("/api/risk/profiles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"ctx-profile\",\"name\":\"Context\","
                                + "\"limits\":{\"ORDER_RATE\":{\"value\":30}}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.version").value(1));

        mockMvc.perform(get("/api/risk/profiles/ctx-profile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.limits.ORDER_RATE.value").value(30))
                .andExpect(jsonPath("$.path").value("/api/risk/profiles/ctx-profile"));
    }

    @Test
    @DisplayName("Unknown orders map to the error envelope")
    void unknownOrder() throws Exception {
        mockMvc.perform(get("/api/orders/NOPE/lifecycle"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("ERR_ORDER_NOT_FOUND"))
                .andExpect(jsonPath("$.error.status").value(404));
    }
}
