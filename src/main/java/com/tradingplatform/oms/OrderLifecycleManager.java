package com.tradingplatform.oms;

import com.tradingplatform.domain.enums.LifecycleState;
import com.tradingplatform.domain.model.Order;
import com.tradingplatform.domain.model.OrderEvent;
import com.tradingplatform.domain.model.OrderLifecycle;
import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.exception.OrderExecutionException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the state machine and event history of every order in the engine.
 *
 * <p>Each order has its own lock, so transitions on different orders never contend.
 * A transition validates the (current, target) pair against {@link LifecycleState},
 * updates the state and appends exactly one event atomically, then releases the lock
 * and only afterwards invokes the callbacks registered for the target state with a
 * snapshot. Callbacks may therefore re-enter the manager, including for the same order.
 *
 * <p>Callbacks for a state run in registration order. A callback that throws is logged
 * and does not affect the transition or the remaining callbacks.
 *
 * <p>Lifecycles are kept until the manager is discarded; retention beyond that is
 * the concern of a persistence collaborator.
 */
public class OrderLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleManager.class);

    static final String SOURCE = "order-lifecycle-manager";
    public static final String EVENT_ORDER_CREATED = "ORDER_CREATED";

    private final Clock clock;
    private final Map<String, LifecycleRecord> lifecycles = new ConcurrentHashMap<>();
    private final Map<LifecycleState, List<LifecycleCallback>> callbacks = new EnumMap<>(LifecycleState.class);

    public OrderLifecycleManager(Clock clock) {
        this.clock = clock;
        for (LifecycleState state : LifecycleState.values()) {
            callbacks.put(state, new CopyOnWriteArrayList<>());
        }
    }

    // ========================
    // LIFECYCLE OPERATIONS
    // ========================

    /**
     * Starts tracking {@code order} in state CREATED with a single {@code ORDER_CREATED} event.
     *
     * @throws OrderExecutionException DUPLICATE_ORDER if the order is already tracked
     */
    public OrderLifecycle createLifecycle(Order order) {
        if (order == null || order.getId() == null || order.getId().isBlank()) {
            throw OrderExecutionException.validation(ErrorCode.INVALID_PARAMETER, "Order ID is required", SOURCE);
        }

        Instant now = clock.instant();
        Order owned = order.copy();
        owned.setStatus(LifecycleState.CREATED.toOrderStatus());
        if (owned.getCreatedAt() == null) {
            owned.setCreatedAt(now);
        }
        owned.setUpdatedAt(now);

        OrderEvent created = newEvent(owned.getId(), LifecycleState.CREATED, null, EVENT_ORDER_CREATED, null, now);
        LifecycleRecord record = new LifecycleRecord(owned, created, now);

        if (lifecycles.putIfAbsent(owned.getId(), record) != null) {
            throw OrderExecutionException.validation(
                            ErrorCode.DUPLICATE_ORDER,
                            String.format("Order lifecycle already exists for order ID %s", owned.getId()),
                            SOURCE)
                    .withOrderId(owned.getId());
        }

        OrderLifecycle snapshot = record.snapshot();
        log.info("Order lifecycle created: {} [symbol={}, side={}, qty={}]",
                owned.getId(), owned.getSymbol(), owned.getSide(), owned.getQuantity());
        dispatch(snapshot, created);
        return snapshot;
    }

    /**
     * @throws OrderExecutionException ORDER_NOT_FOUND if the order is not tracked
     */
    public OrderLifecycle getLifecycle(String orderId) {
        return requireRecord(orderId).snapshot();
    }

    /**
     * Moves the order to {@code newState} if the transition table allows it.
     *
     * @param eventType cause tag recorded on the event, e.g. {@code VALIDATION_PASSED}
     * @param metadata optional event metadata, copied
     * @return the post-transition snapshot
     * @throws OrderExecutionException INVALID_ORDER for a disallowed transition (state unchanged),
     *     ORDER_NOT_FOUND if the order is not tracked
     */
    public OrderLifecycle transitionState(
            String orderId, LifecycleState newState, String eventType, Map<String, Object> metadata) {
        if (newState == null) {
            throw OrderExecutionException.validation(ErrorCode.INVALID_PARAMETER, "Target state is required", SOURCE);
        }
        LifecycleRecord record = requireRecord(orderId);

        OrderLifecycle snapshot;
        OrderEvent event;
        record.lock.lock();
        try {
            LifecycleState current = record.state;
            if (!current.canTransitionTo(newState)) {
                throw OrderExecutionException.validation(
                                ErrorCode.INVALID_ORDER,
                                String.format("Invalid state transition from %s to %s", current, newState),
                                SOURCE)
                        .withOrderId(orderId);
            }
            Instant now = clock.instant();
            String cause = eventType == null || eventType.isBlank() ? newState.name() : eventType;
            event = newEvent(orderId, newState, current, cause, metadata, now);
            record.apply(event, now);
            snapshot = record.snapshotLocked();
        } finally {
            record.lock.unlock();
        }

        log.debug("Order {} transitioned {} -> {} [{}]", orderId, event.getPreviousState(), newState, event.getEventType());
        dispatch(snapshot, event);
        return snapshot;
    }

    /** Subscribes {@code callback} to every transition into {@code state}. */
    public void registerCallback(LifecycleState state, LifecycleCallback callback) {
        if (state == null || callback == null) {
            throw new IllegalArgumentException("state and callback are required");
        }
        callbacks.get(state).add(callback);
    }

    /** Full event history of the order, oldest first. */
    public List<OrderEvent> getOrderEvents(String orderId) {
        return getLifecycle(orderId).getEvents();
    }

    /** Snapshots of every lifecycle not yet in a terminal state. */
    public List<OrderLifecycle> getActiveLifecycles() {
        return lifecycles.values().stream()
                .map(LifecycleRecord::snapshot)
                .filter(lifecycle -> !lifecycle.isTerminal())
                .collect(Collectors.toList());
    }

    public int getActiveLifecycleCount() {
        return (int) lifecycles.values().stream()
                .filter(record -> !record.currentState().isTerminal())
                .count();
    }

    public int getLifecycleCount() {
        return lifecycles.size();
    }

    public boolean hasLifecycle(String orderId) {
        return orderId != null && lifecycles.containsKey(orderId);
    }

    // ========================
    // INTERNALS
    // ========================

    private LifecycleRecord requireRecord(String orderId) {
        LifecycleRecord record = orderId == null ? null : lifecycles.get(orderId);
        if (record == null) {
            throw OrderExecutionException.validation(
                            ErrorCode.ORDER_NOT_FOUND,
                            String.format("Order lifecycle not found for order ID %s", orderId),
                            SOURCE)
                    .withOrderId(orderId);
        }
        return record;
    }

    private void dispatch(OrderLifecycle snapshot, OrderEvent event) {
        for (LifecycleCallback callback : callbacks.get(event.getState())) {
            try {
                callback.onTransition(snapshot, event);
            } catch (RuntimeException e) {
                log.error(
                        "Lifecycle callback failed for order {} on {}: {}",
                        snapshot.getOrderId(),
                        event.getState(),
                        e.getMessage(),
                        e);
            }
        }
    }

    private static OrderEvent newEvent(
            String orderId,
            LifecycleState state,
            LifecycleState previousState,
            String eventType,
            Map<String, Object> metadata,
            Instant timestamp) {
        Map<String, Object> copy = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        return OrderEvent.builder()
                .id("evt_" + UUID.randomUUID())
                .orderId(orderId)
                .state(state)
                .previousState(previousState)
                .eventType(eventType)
                .timestamp(timestamp)
                .metadata(copy)
                .build();
    }

    /** Mutable per-order state. Fields are guarded by {@code lock}. */
    private static final class LifecycleRecord {

        private final ReentrantLock lock = new ReentrantLock();
        private final Order order;
        private final List<OrderEvent> events = new ArrayList<>();
        private final Instant createdAt;
        private LifecycleState state;
        private Instant updatedAt;

        private LifecycleRecord(Order order, OrderEvent created, Instant now) {
            this.order = order;
            this.state = LifecycleState.CREATED;
            this.events.add(created);
            this.createdAt = now;
            this.updatedAt = now;
        }

        private void apply(OrderEvent event, Instant now) {
            state = event.getState();
            events.add(event);
            updatedAt = now;
            order.setStatus(state.toOrderStatus());
            order.setUpdatedAt(now);
        }

        private LifecycleState currentState() {
            lock.lock();
            try {
                return state;
            } finally {
                lock.unlock();
            }
        }

        private OrderLifecycle snapshot() {
            lock.lock();
            try {
                return snapshotLocked();
            } finally {
                lock.unlock();
            }
        }

        private OrderLifecycle snapshotLocked() {
            return OrderLifecycle.builder()
                    .order(order.copy())
                    .currentState(state)
                    .events(List.copyOf(events))
                    .createdAt(createdAt)
                    .updatedAt(updatedAt)
                    .build();
        }
    }
}
