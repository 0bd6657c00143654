package com.tradingplatform.api.controller;

import com.tradingplatform.domain.model.OrderEvent;
import com.tradingplatform.domain.model.OrderLifecycle;
import com.tradingplatform.oms.DeadLetterQueue;
import com.tradingplatform.oms.FailedOrder;
import com.tradingplatform.oms.OrderDependency;
import com.tradingplatform.oms.OrderDependencyManager;
import com.tradingplatform.oms.OrderLifecycleManager;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of order lifecycles, their audit trail and dependencies.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/orders/active -- lifecycles not yet in a terminal state</li>
 *   <li>GET /api/orders/dead-letter -- orders the engine gave up on</li>
 *   <li>GET /api/orders/{orderId}/lifecycle -- current lifecycle snapshot</li>
 *   <li>GET /api/orders/{orderId}/events -- transition history, oldest first</li>
 *   <li>GET /api/orders/{orderId}/dependencies -- dependencies where the order is the parent</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/orders")
public class OrderLifecycleController {

    private final OrderLifecycleManager orderLifecycleManager;
    private final OrderDependencyManager orderDependencyManager;
    private final DeadLetterQueue deadLetterQueue;

    public OrderLifecycleController(
            OrderLifecycleManager orderLifecycleManager,
            OrderDependencyManager orderDependencyManager,
            DeadLetterQueue deadLetterQueue) {
        this.orderLifecycleManager = orderLifecycleManager;
        this.orderDependencyManager = orderDependencyManager;
        this.deadLetterQueue = deadLetterQueue;
    }

    @GetMapping("/active")
    public ResponseEntity<List<OrderLifecycle>> getActiveLifecycles() {
        return ResponseEntity.ok(orderLifecycleManager.getActiveLifecycles());
    }

    @GetMapping("/dead-letter")
    public ResponseEntity<List<FailedOrder>> getDeadLetters() {
        return ResponseEntity.ok(deadLetterQueue.list());
    }

    @GetMapping("/{orderId}/lifecycle")
    public ResponseEntity<OrderLifecycle> getLifecycle(@PathVariable String orderId) {
        return ResponseEntity.ok(orderLifecycleManager.getLifecycle(orderId));
    }

    @GetMapping("/{orderId}/events")
    public ResponseEntity<List<OrderEvent>> getEvents(@PathVariable String orderId) {
        return ResponseEntity.ok(orderLifecycleManager.getOrderEvents(orderId));
    }

    /**
     * Returns the dependencies hanging off an order. Unknown orders yield an empty list,
     * not a 404, since dependencies are looked up by parent id only.
     */
    @GetMapping("/{orderId}/dependencies")
    public ResponseEntity<List<OrderDependency>> getDependencies(@PathVariable String orderId) {
        return ResponseEntity.ok(orderDependencyManager.getDependencies(orderId));
    }
}
