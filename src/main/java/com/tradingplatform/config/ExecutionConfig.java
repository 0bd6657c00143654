package com.tradingplatform.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.tradingplatform.broker.BrokerConnectorFactory;
import com.tradingplatform.broker.BrokerRouter;
import com.tradingplatform.broker.DefaultBrokerConnectorFactory;
import com.tradingplatform.event.EventPublisherHelper;
import com.tradingplatform.oms.DeadLetterQueue;
import com.tradingplatform.oms.ExecutionSettings;
import com.tradingplatform.oms.OrderDependencyManager;
import com.tradingplatform.oms.OrderExecutionService;
import com.tradingplatform.oms.OrderLifecycleManager;
import com.tradingplatform.resilience.CircuitBreakerManager;
import com.tradingplatform.resilience.CircuitBreakerSettings;
import com.tradingplatform.resilience.ErrorClassifier;
import com.tradingplatform.risk.RiskManager;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the execution engine. Every manager is a plain instance owned by this context;
 * nothing in the engine is static.
 *
 * <p>Properties prefix: {@code tradingplatform.*}
 */
@Configuration
public class ExecutionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ErrorClassifier errorClassifier(
            @Value("${tradingplatform.errors.max-retries:3}") int maxRetries,
            @Value("${tradingplatform.errors.context-ttl:1h}") Duration contextTtl,
            @Value("${tradingplatform.errors.exhausted-ttl:24h}") Duration exhaustedTtl,
            @Value("${tradingplatform.errors.exhausted-max-size:100000}") long exhaustedMaxSize) {
        return new ErrorClassifier(maxRetries, contextTtl, exhaustedTtl, exhaustedMaxSize, Ticker.systemTicker());
    }

    @Bean
    public CircuitBreakerManager circuitBreakerManager(
            @Value("${tradingplatform.circuit-breaker.failure-threshold:5}") int failureThreshold,
            @Value("${tradingplatform.circuit-breaker.reset-timeout:30s}") Duration resetTimeout,
            @Value("${tradingplatform.circuit-breaker.half-open-max-calls:1}") int halfOpenMaxCalls,
            Clock clock,
            EventPublisherHelper eventPublisherHelper) {
        CircuitBreakerSettings settings = CircuitBreakerSettings.builder()
                .failureThreshold(failureThreshold)
                .resetTimeout(resetTimeout)
                .halfOpenMaxCalls(halfOpenMaxCalls)
                .build();
        return new CircuitBreakerManager(settings, clock, List.of(eventPublisherHelper));
    }

    @Bean
    public OrderLifecycleManager orderLifecycleManager(Clock clock) {
        return new OrderLifecycleManager(clock);
    }

    @Bean
    public OrderDependencyManager orderDependencyManager(
            OrderLifecycleManager lifecycleManager,
            ErrorClassifier errorClassifier,
            @Qualifier("orderExecutor") ThreadPoolTaskExecutor orderExecutor,
            Clock clock) {
        return new OrderDependencyManager(lifecycleManager, errorClassifier, orderExecutor, clock);
    }

    @Bean
    public BrokerConnectorFactory brokerConnectorFactory(Clock clock) {
        return new DefaultBrokerConnectorFactory(clock);
    }

    @Bean
    public BrokerRouter brokerRouter(
            BrokerConnectorFactory brokerConnectorFactory,
            CircuitBreakerManager circuitBreakerManager,
            ErrorClassifier errorClassifier,
            @Qualifier("brokerCallExecutor") ThreadPoolTaskExecutor brokerCallExecutor,
            @Value("${tradingplatform.broker.call-timeout:5s}") Duration callTimeout) {
        return new BrokerRouter(
                brokerConnectorFactory,
                circuitBreakerManager,
                errorClassifier,
                brokerCallExecutor.getThreadPoolExecutor(),
                callTimeout);
    }

    @Bean
    public DeadLetterQueue deadLetterQueue() {
        return new DeadLetterQueue();
    }

    @Bean
    public ExecutionSettings executionSettings(
            @Value("${tradingplatform.execution.max-submit-attempts:4}") int maxSubmitAttempts,
            @Value("${tradingplatform.execution.backoff-initial:200ms}") Duration backoffInitial,
            @Value("${tradingplatform.execution.backoff-multiplier:2.0}") double backoffMultiplier) {
        return ExecutionSettings.builder()
                .maxSubmitAttempts(maxSubmitAttempts)
                .backoffInitial(backoffInitial)
                .backoffMultiplier(backoffMultiplier)
                .build();
    }

    @Bean
    public OrderExecutionService orderExecutionService(
            OrderLifecycleManager lifecycleManager,
            OrderDependencyManager dependencyManager,
            RiskManager riskManager,
            BrokerRouter brokerRouter,
            DeadLetterQueue deadLetterQueue,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier("orderExecutor") ThreadPoolTaskExecutor orderExecutor,
            ExecutionSettings executionSettings,
            Clock clock) {
        return new OrderExecutionService(
                lifecycleManager,
                dependencyManager,
                riskManager,
                brokerRouter,
                deadLetterQueue,
                eventPublisherHelper,
                orderExecutor,
                executionSettings,
                clock);
    }
}
