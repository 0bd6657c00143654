package com.tradingplatform.event;

import com.tradingplatform.domain.model.OrderEvent;
import com.tradingplatform.domain.model.OrderLifecycle;
import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.resilience.CircuitBreakerStateListener;
import com.tradingplatform.risk.RiskLevel;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed wrapper around Spring's {@link ApplicationEventPublisher} for engine events.
 *
 * <p>Also acts as the circuit breaker state listener, so resilience4j breaker
 * transitions reach Spring listeners (metrics, alerting).
 */
@Component
public class EventPublisherHelper implements CircuitBreakerStateListener {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Lifecycle ----

    public void publishLifecycleTransition(Object source, OrderLifecycle lifecycle, OrderEvent transition) {
        applicationEventPublisher.publishEvent(new OrderLifecycleEvent(source, lifecycle, transition));
    }

    public void publishOrderRetry(Object source, String orderId, int attempt, ErrorCode errorCode) {
        applicationEventPublisher.publishEvent(new OrderRetryEvent(source, orderId, attempt, errorCode));
    }

    // ---- Risk ----

    public void publishRiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, eventType, level, message, details));
    }

    // ---- Circuit breaker ----

    @Override
    public void onStateTransition(String breakerName, CircuitBreaker.State from, CircuitBreaker.State to) {
        applicationEventPublisher.publishEvent(new CircuitBreakerEvent(this, breakerName, from, to));
    }
}
