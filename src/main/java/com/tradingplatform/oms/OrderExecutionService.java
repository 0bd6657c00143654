package com.tradingplatform.oms;

import com.tradingplatform.broker.BrokerCallContext;
import com.tradingplatform.broker.BrokerCallResult;
import com.tradingplatform.broker.BrokerRouter;
import com.tradingplatform.domain.enums.DependencyType;
import com.tradingplatform.domain.enums.LifecycleState;
import com.tradingplatform.domain.model.Order;
import com.tradingplatform.domain.model.OrderEvent;
import com.tradingplatform.domain.model.OrderLifecycle;
import com.tradingplatform.domain.model.Portfolio;
import com.tradingplatform.domain.model.Strategy;
import com.tradingplatform.event.EventPublisherHelper;
import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.exception.OrderExecutionException;
import com.tradingplatform.risk.RiskManager;
import io.github.resilience4j.core.IntervalFunction;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives an order through the engine: risk validation, lifecycle transitions, broker
 * submission with bounded resubmission, fills, cancellation and modification.
 *
 * <p>Submission pipeline:
 * <ol>
 *   <li>Create the lifecycle (CREATED)</li>
 *   <li>Risk validation: breach → REJECTED, pass → VALIDATED and counted for rate limits</li>
 *   <li>Orders with a parent are held behind a ONE_TRIGGERS_OTHER dependency; the dependency
 *       manager submits them when the parent completes and this service places them</li>
 *   <li>SUBMITTED, then placement through the {@link BrokerRouter}. While the router reports
 *       {@code shouldRetry} the order is resubmitted after an exponential, jittered backoff,
 *       up to {@link ExecutionSettings#getMaxSubmitAttempts()} attempts</li>
 *   <li>Accepted → ACKNOWLEDGED; otherwise FAILED and parked in the {@link DeadLetterQueue}</li>
 * </ol>
 */
public class OrderExecutionService {

    private static final Logger log = LoggerFactory.getLogger(OrderExecutionService.class);

    public static final String EVENT_VALIDATION_PASSED = "VALIDATION_PASSED";
    public static final String EVENT_RISK_REJECTED = "RISK_REJECTED";
    public static final String EVENT_DEPENDENCY_REJECTED = "DEPENDENCY_REJECTED";
    public static final String EVENT_SUBMITTED = "SUBMITTED_TO_BROKER";
    public static final String EVENT_BROKER_ACCEPTED = "BROKER_ACCEPTED";
    public static final String EVENT_BROKER_FAILED = "BROKER_FAILED";
    public static final String EVENT_PARTIAL_FILL = "PARTIAL_FILL";
    public static final String EVENT_ORDER_FILLED = "ORDER_FILLED";
    public static final String EVENT_CANCELLED_BY_USER = "CANCELLED_BY_USER";

    private final OrderLifecycleManager lifecycleManager;
    private final OrderDependencyManager dependencyManager;
    private final RiskManager riskManager;
    private final BrokerRouter brokerRouter;
    private final DeadLetterQueue deadLetterQueue;
    private final EventPublisherHelper eventPublisherHelper;
    private final Executor placementExecutor;
    private final ExecutionSettings settings;
    private final IntervalFunction backoff;
    private final Clock clock;

    private final Map<String, String> userByOrder = new ConcurrentHashMap<>();
    private final Map<String, String> brokerOrderIds = new ConcurrentHashMap<>();
    private final Map<String, Integer> filledQuantities = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> fillLocks = new ConcurrentHashMap<>();

    public OrderExecutionService(
            OrderLifecycleManager lifecycleManager,
            OrderDependencyManager dependencyManager,
            RiskManager riskManager,
            BrokerRouter brokerRouter,
            DeadLetterQueue deadLetterQueue,
            EventPublisherHelper eventPublisherHelper,
            Executor placementExecutor,
            ExecutionSettings settings,
            Clock clock) {
        this.lifecycleManager = lifecycleManager;
        this.dependencyManager = dependencyManager;
        this.riskManager = riskManager;
        this.brokerRouter = brokerRouter;
        this.deadLetterQueue = deadLetterQueue;
        this.eventPublisherHelper = eventPublisherHelper;
        this.placementExecutor = placementExecutor;
        this.settings = settings;
        this.backoff = IntervalFunction.ofExponentialRandomBackoff(
                settings.getBackoffInitial(), settings.getBackoffMultiplier(), settings.getBackoffRandomization());
        this.clock = clock;

        for (LifecycleState state : LifecycleState.values()) {
            lifecycleManager.registerCallback(state, this::publishTransition);
        }
        lifecycleManager.registerCallback(LifecycleState.SUBMITTED, this::onSubmitted);
        lifecycleManager.registerCallback(LifecycleState.CANCELLED, this::onCancelled);
    }

    // ========================
    // SUBMISSION
    // ========================

    /**
     * Submits {@code order} on behalf of {@code userId}.
     *
     * @return the lifecycle after the pipeline ran: REJECTED, VALIDATED (held behind its parent),
     *     ACKNOWLEDGED or FAILED
     * @throws OrderExecutionException DUPLICATE_ORDER if the order id is already tracked
     */
    public OrderLifecycle submitOrder(String userId, Order order, Portfolio portfolio, Strategy strategy) {
        lifecycleManager.createLifecycle(order);
        String orderId = order.getId();
        userByOrder.put(orderId, userId);

        try {
            riskManager.validateOrder(order, portfolio, strategy);
        } catch (OrderExecutionException e) {
            log.warn("Order rejected: {} [orderId={}, code={}]", e.getMessage(), orderId, e.getErrorCode());
            return lifecycleManager.transitionState(
                    orderId, LifecycleState.REJECTED, EVENT_RISK_REJECTED, failureMetadata(e));
        }

        lifecycleManager.transitionState(orderId, LifecycleState.VALIDATED, EVENT_VALIDATION_PASSED, null);
        riskManager.recordOrder(order);

        if (order.getParentOrderId() != null && !order.getParentOrderId().isBlank()) {
            try {
                dependencyManager.createDependency(
                        order.getParentOrderId(), orderId, DependencyType.ONE_TRIGGERS_OTHER, "PARENT_COMPLETED");
            } catch (OrderExecutionException e) {
                log.warn("Order rejected: {} [orderId={}, parent={}]", e.getMessage(), orderId, order.getParentOrderId());
                return lifecycleManager.transitionState(
                        orderId, LifecycleState.REJECTED, EVENT_DEPENDENCY_REJECTED, failureMetadata(e));
            }
            log.info("Order {} held until parent {} completes", orderId, order.getParentOrderId());
            return lifecycleManager.getLifecycle(orderId);
        }

        lifecycleManager.transitionState(orderId, LifecycleState.SUBMITTED, EVENT_SUBMITTED, null);
        return sendToBroker(orderId);
    }

    /**
     * Places an order that is already SUBMITTED, resubmitting while the router allows it.
     */
    OrderLifecycle sendToBroker(String orderId) {
        Order order = lifecycleManager.getLifecycle(orderId).getOrder();
        String userId = userByOrder.get(orderId);
        BrokerCallContext context = BrokerCallContext.of("submit:" + orderId);

        BrokerCallResult<String> result = null;
        int attempt = 0;
        while (attempt < settings.getMaxSubmitAttempts()) {
            attempt++;
            result = brokerRouter.placeOrder(userId, order, context);
            if (result.isSuccess() || !result.isShouldRetry() || attempt >= settings.getMaxSubmitAttempts()) {
                break;
            }
            eventPublisherHelper.publishOrderRetry(this, orderId, attempt, result.getError().getErrorCode());
            long waitMillis = backoff.apply(attempt);
            log.info("Resubmitting order {} in {} ms (attempt {} failed: {})",
                    orderId, waitMillis, attempt, result.getError().getMessage());
            if (!pause(waitMillis)) {
                break;
            }
        }

        if (result.isSuccess()) {
            String brokerOrderId = result.getValue();
            brokerOrderIds.put(orderId, brokerOrderId);
            log.info("Order {} accepted by broker as {} after {} attempt(s)", orderId, brokerOrderId, attempt);
            OrderLifecycle acknowledged = transitionQuietly(
                    orderId, LifecycleState.ACKNOWLEDGED, EVENT_BROKER_ACCEPTED, Map.of("brokerOrderId", brokerOrderId));
            if (acknowledged.getCurrentState() == LifecycleState.CANCELLED) {
                // cancelled while the placement was in flight; the venue copy is still live
                log.warn("Order {} was cancelled during placement, cancelling {} at the venue", orderId, brokerOrderId);
                cancelAtVenue(orderId, brokerOrderId);
            }
            return acknowledged;
        }

        OrderExecutionException error = result.getError().withOrderId(orderId);
        log.error("Order {} failed after {} attempt(s): {} [code={}]", orderId, attempt, error.getMessage(), error.getErrorCode());
        Map<String, Object> metadata = failureMetadata(error);
        metadata.put("attempts", attempt);
        OrderLifecycle failed = transitionQuietly(orderId, LifecycleState.FAILED, EVENT_BROKER_FAILED, metadata);
        if (failed.getCurrentState() != LifecycleState.FAILED) {
            return failed;
        }
        deadLetterQueue.add(FailedOrder.builder()
                .order(failed.getOrder())
                .errorType(error.getType())
                .errorCode(error.getErrorCode())
                .message(error.getMessage())
                .attempts(attempt)
                .failedAt(clock.instant())
                .build());
        return failed;
    }

    // ========================
    // FILLS, CANCEL, MODIFY
    // ========================

    /**
     * Records a fill of {@code quantity} at {@code price}. The order moves to PARTIALLY_FILLED
     * until the cumulative fill reaches the order quantity, then to COMPLETED.
     */
    public OrderLifecycle applyFill(String orderId, int quantity, BigDecimal price) {
        OrderLifecycle lifecycle = lifecycleManager.getLifecycle(orderId);
        Order order = lifecycle.getOrder();
        if (quantity <= 0) {
            throw OrderExecutionException.validation(
                    ErrorCode.INVALID_PARAMETER, "Fill quantity must be positive", "order-execution-service");
        }

        // Check, transition and running total move together per order
        ReentrantLock lock = fillLocks.computeIfAbsent(orderId, key -> new ReentrantLock());
        lock.lock();
        try {
            int total = filledQuantities.getOrDefault(orderId, 0) + quantity;
            if (total > order.getQuantity()) {
                throw OrderExecutionException.validation(
                                ErrorCode.INVALID_PARAMETER,
                                String.format("Fill of %d exceeds remaining quantity of order %s", quantity, orderId),
                                "order-execution-service")
                        .withOrderId(orderId);
            }

            boolean complete = total == order.getQuantity();
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("fillQuantity", quantity);
            metadata.put("fillPrice", price);
            metadata.put("filledQuantity", total);
            OrderLifecycle updated = lifecycleManager.transitionState(
                    orderId,
                    complete ? LifecycleState.COMPLETED : LifecycleState.PARTIALLY_FILLED,
                    complete ? EVENT_ORDER_FILLED : EVENT_PARTIAL_FILL,
                    metadata);
            filledQuantities.put(orderId, total);
            riskManager.recordFill(order, quantity, price);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    public int getFilledQuantity(String orderId) {
        return filledQuantities.getOrDefault(orderId, 0);
    }

    /** Cancels the order at the venue when it was placed there, then moves it to CANCELLED. */
    public OrderLifecycle cancelOrder(String orderId) {
        OrderLifecycle lifecycle = lifecycleManager.getLifecycle(orderId);
        if (lifecycle.isTerminal()) {
            throw OrderExecutionException.validation(
                            ErrorCode.INVALID_ORDER,
                            String.format("Order %s is already %s", orderId, lifecycle.getCurrentState()),
                            "order-execution-service")
                    .withOrderId(orderId);
        }
        String brokerOrderId = brokerOrderIds.get(orderId);
        if (brokerOrderId != null) {
            BrokerCallResult<Void> result =
                    brokerRouter.cancelOrder(userByOrder.get(orderId), brokerOrderId, BrokerCallContext.oneOff("cancel:" + orderId));
            if (!result.isSuccess()) {
                throw result.getError().withOrderId(orderId);
            }
        }
        return lifecycleManager.transitionState(orderId, LifecycleState.CANCELLED, EVENT_CANCELLED_BY_USER, null);
    }

    /** Modifies an order resting at the venue. The lifecycle state is unchanged. */
    public OrderLifecycle modifyOrder(String orderId, BigDecimal price, int quantity, BigDecimal triggerPrice) {
        OrderLifecycle lifecycle = lifecycleManager.getLifecycle(orderId);
        String brokerOrderId = brokerOrderIds.get(orderId);
        if (brokerOrderId == null || lifecycle.isTerminal()) {
            throw OrderExecutionException.validation(
                            ErrorCode.INVALID_ORDER,
                            String.format("Order %s cannot be modified in state %s", orderId, lifecycle.getCurrentState()),
                            "order-execution-service")
                    .withOrderId(orderId);
        }
        BrokerCallResult<Void> result = brokerRouter.modifyOrder(
                userByOrder.get(orderId), brokerOrderId, price, quantity, triggerPrice,
                BrokerCallContext.oneOff("modify:" + orderId));
        if (!result.isSuccess()) {
            throw result.getError().withOrderId(orderId);
        }
        log.info("Order {} modified [price={}, qty={}, trigger={}]", orderId, price, quantity, triggerPrice);
        return lifecycleManager.getLifecycle(orderId);
    }

    public String getBrokerOrderId(String orderId) {
        return brokerOrderIds.get(orderId);
    }

    // ========================
    // CALLBACKS
    // ========================

    private void publishTransition(OrderLifecycle lifecycle, OrderEvent event) {
        eventPublisherHelper.publishLifecycleTransition(this, lifecycle, event);
    }

    private void onSubmitted(OrderLifecycle lifecycle, OrderEvent event) {
        if (!OrderDependencyManager.EVENT_DEPENDENCY_TRIGGERED.equals(event.getEventType())) {
            return;
        }
        String orderId = lifecycle.getOrderId();
        if (!userByOrder.containsKey(orderId)) {
            log.warn("Triggered order {} has no submitting user, left in SUBMITTED", orderId);
            return;
        }
        dispatch(() -> sendToBroker(orderId), orderId);
    }

    private void onCancelled(OrderLifecycle lifecycle, OrderEvent event) {
        String type = event.getEventType();
        if (!OrderDependencyManager.EVENT_PARENT_COMPLETED.equals(type)
                && !OrderDependencyManager.EVENT_PARENT_TERMINATED.equals(type)) {
            return;
        }
        String orderId = lifecycle.getOrderId();
        String brokerOrderId = brokerOrderIds.get(orderId);
        if (brokerOrderId == null) {
            return;
        }
        cancelAtVenue(orderId, brokerOrderId);
    }

    private void cancelAtVenue(String orderId, String brokerOrderId) {
        dispatch(() -> {
            BrokerCallResult<Void> result = brokerRouter.cancelOrder(
                    userByOrder.get(orderId), brokerOrderId, BrokerCallContext.oneOff("cancel:" + orderId));
            if (!result.isSuccess()) {
                log.error("Venue cancel of order {} ({}) failed: {}", orderId, brokerOrderId, result.getError().getMessage());
            }
        }, orderId);
    }

    private void dispatch(Runnable work, String orderId) {
        try {
            placementExecutor.execute(work);
        } catch (RejectedExecutionException e) {
            log.error("Could not schedule broker work for order {}", orderId, e);
            transitionQuietly(orderId, LifecycleState.FAILED, EVENT_BROKER_FAILED, Map.of("reason", "scheduling rejected"));
        }
    }

    // ========================
    // HELPERS
    // ========================

    private OrderLifecycle transitionQuietly(
            String orderId, LifecycleState state, String eventType, Map<String, Object> metadata) {
        try {
            return lifecycleManager.transitionState(orderId, state, eventType, metadata);
        } catch (OrderExecutionException e) {
            // Order moved on concurrently, e.g. cancelled while the placement was in flight
            log.warn("Order {} not moved to {}: {}", orderId, state, e.getMessage());
            return lifecycleManager.getLifecycle(orderId);
        }
    }

    private boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static Map<String, Object> failureMetadata(OrderExecutionException e) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("reason", e.getMessage());
        metadata.put("code", e.getErrorCode().getCode());
        metadata.put("errorType", e.getType().name());
        return metadata;
    }
}
