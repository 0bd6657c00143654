package com.tradingplatform.config;

import com.tradingplatform.observability.ExecutionMetrics;
import com.tradingplatform.oms.DeadLetterQueue;
import com.tradingplatform.oms.OrderLifecycleManager;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer configuration: common tags on every meter plus the engine's own metrics
 * ({@link ExecutionMetrics}).
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    public MetricsConfig(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "trading-platform");
    }

    @Bean
    public ExecutionMetrics executionMetrics(OrderLifecycleManager lifecycleManager, DeadLetterQueue deadLetterQueue) {
        return new ExecutionMetrics(meterRegistry, lifecycleManager, deadLetterQueue);
    }
}
