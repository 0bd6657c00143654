package com.tradingplatform.domain.model;

import com.tradingplatform.domain.enums.LifecycleState;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only snapshot of an order's lifecycle: the order as the engine last saw it,
 * its current state and the full event history, oldest first.
 */
@Value
@Builder
public class OrderLifecycle {

    Order order;
    LifecycleState currentState;
    List<OrderEvent> events;
    Instant createdAt;
    Instant updatedAt;

    public String getOrderId() {
        return order.getId();
    }

    public OrderEvent lastEvent() {
        return events.get(events.size() - 1);
    }

    public boolean isTerminal() {
        return currentState.isTerminal();
    }
}
