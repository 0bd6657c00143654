package com.tradingplatform.observability;

import com.tradingplatform.domain.enums.LifecycleState;
import com.tradingplatform.event.CircuitBreakerEvent;
import com.tradingplatform.event.OrderLifecycleEvent;
import com.tradingplatform.event.OrderRetryEvent;
import com.tradingplatform.event.RiskEvent;
import com.tradingplatform.oms.DeadLetterQueue;
import com.tradingplatform.oms.OrderLifecycleManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

/**
 * Micrometer metrics for the execution engine.
 * <ul>
 *   <li><b>orders.submitted</b> (counter): transitions into SUBMITTED</li>
 *   <li><b>orders.acknowledged</b> (counter): transitions into ACKNOWLEDGED</li>
 *   <li><b>orders.rejected</b> (counter): transitions into REJECTED</li>
 *   <li><b>orders.failed</b> (counter): transitions into FAILED</li>
 *   <li><b>broker.retries</b> (counter): resubmissions after retryable failures</li>
 *   <li><b>risk.breaches</b> (counter, tag type): published risk events</li>
 *   <li><b>circuit.transitions</b> (counter, tags breaker and state)</li>
 *   <li><b>orders.active</b> (gauge): lifecycles not yet terminal</li>
 *   <li><b>orders.dead_letter</b> (gauge): dead letter queue size</li>
 * </ul>
 */
public class ExecutionMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter ordersSubmitted;
    private final Counter ordersAcknowledged;
    private final Counter ordersRejected;
    private final Counter ordersFailed;
    private final Counter brokerRetries;

    public ExecutionMetrics(
            MeterRegistry meterRegistry, OrderLifecycleManager lifecycleManager, DeadLetterQueue deadLetterQueue) {
        this.meterRegistry = meterRegistry;
        this.ordersSubmitted = Counter.builder("orders.submitted")
                .description("Orders handed to a broker")
                .register(meterRegistry);
        this.ordersAcknowledged = Counter.builder("orders.acknowledged")
                .description("Orders accepted by a broker")
                .register(meterRegistry);
        this.ordersRejected = Counter.builder("orders.rejected")
                .description("Orders rejected before submission")
                .register(meterRegistry);
        this.ordersFailed = Counter.builder("orders.failed")
                .description("Orders that failed after submission")
                .register(meterRegistry);
        this.brokerRetries = Counter.builder("broker.retries")
                .description("Order resubmissions after retryable broker failures")
                .register(meterRegistry);

        meterRegistry.gauge("orders.active", lifecycleManager, OrderLifecycleManager::getActiveLifecycleCount);
        meterRegistry.gauge("orders.dead_letter", deadLetterQueue, DeadLetterQueue::size);
    }

    @EventListener
    @Order(20)
    public void onLifecycleEvent(OrderLifecycleEvent event) {
        LifecycleState state = event.getTransition().getState();
        if (state == LifecycleState.SUBMITTED) {
            ordersSubmitted.increment();
        } else if (state == LifecycleState.ACKNOWLEDGED) {
            ordersAcknowledged.increment();
        } else if (state == LifecycleState.REJECTED) {
            ordersRejected.increment();
        } else if (state == LifecycleState.FAILED) {
            ordersFailed.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRetry(OrderRetryEvent event) {
        brokerRetries.increment();
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        meterRegistry.counter("risk.breaches", "type", event.getEventType().name()).increment();
    }

    @EventListener
    @Order(20)
    public void onCircuitBreakerEvent(CircuitBreakerEvent event) {
        meterRegistry
                .counter("circuit.transitions", "breaker", event.getBreakerName(), "state", event.getToState().name())
                .increment();
    }
}
