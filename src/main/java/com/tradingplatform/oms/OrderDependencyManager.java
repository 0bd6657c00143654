package com.tradingplatform.oms;

import com.tradingplatform.domain.enums.DependencyType;
import com.tradingplatform.domain.enums.LifecycleState;
import com.tradingplatform.domain.model.OrderEvent;
import com.tradingplatform.domain.model.OrderLifecycle;
import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.exception.OrderExecutionException;
import com.tradingplatform.resilience.ErrorClassifier;
import com.tradingplatform.resilience.RetryDecision;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Models parent → child relationships between orders and advances children when
 * their parent reaches a terminal state.
 *
 * <p>Behaviour on parent transitions:
 * <ul>
 *   <li>Parent COMPLETED, ONE_TRIGGERS_OTHER: the child is moved through its own chain
 *       up to SUBMITTED (event type {@code DEPENDENCY_TRIGGERED}).</li>
 *   <li>Parent COMPLETED, ONE_CANCELS_OTHER: a non-terminal child is cancelled.</li>
 *   <li>Parent CANCELLED, REJECTED or FAILED: ONE_TRIGGERS_OTHER children that never
 *       reached SUBMITTED are cancelled.</li>
 * </ul>
 *
 * <p>Trigger work is handed to the supplied executor so the parent's transition never
 * waits on it. Triggering is idempotent: each dependency fires once, and a child already
 * at or past SUBMITTED is left alone. A child that cannot be submitted is reported through
 * the {@link ErrorClassifier}.
 *
 * <p>A child has at most one parent. Self-dependencies and ONE_TRIGGERS_OTHER cycles are
 * rejected at creation; ONE_CANCELS_OTHER pairs may point at each other.
 */
public class OrderDependencyManager {

    private static final Logger log = LoggerFactory.getLogger(OrderDependencyManager.class);

    static final String SOURCE = "order-dependency-manager";
    public static final String EVENT_DEPENDENCY_TRIGGERED = "DEPENDENCY_TRIGGERED";
    public static final String EVENT_PARENT_COMPLETED = "PARENT_COMPLETED";
    public static final String EVENT_PARENT_TERMINATED = "PARENT_TERMINATED";

    private final OrderLifecycleManager lifecycleManager;
    private final ErrorClassifier errorClassifier;
    private final Executor executor;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, OrderDependency> dependencies = new LinkedHashMap<>();
    private final Map<String, List<String>> dependenciesByParent = new HashMap<>();
    private final Map<String, String> dependencyByChild = new HashMap<>();
    private final Set<String> firedDependencies = ConcurrentHashMap.newKeySet();

    public OrderDependencyManager(
            OrderLifecycleManager lifecycleManager, ErrorClassifier errorClassifier, Executor executor, Clock clock) {
        this.lifecycleManager = lifecycleManager;
        this.errorClassifier = errorClassifier;
        this.executor = executor;
        this.clock = clock;

        lifecycleManager.registerCallback(LifecycleState.COMPLETED, this::onParentTerminal);
        lifecycleManager.registerCallback(LifecycleState.CANCELLED, this::onParentTerminal);
        lifecycleManager.registerCallback(LifecycleState.REJECTED, this::onParentTerminal);
        lifecycleManager.registerCallback(LifecycleState.FAILED, this::onParentTerminal);
    }

    // ========================
    // DEPENDENCY CRUD
    // ========================

    /**
     * Creates a dependency from {@code parentOrderId} to {@code childOrderId}. Both orders must
     * already have a lifecycle. If the parent is already terminal, the dependency fires at once.
     */
    public OrderDependency createDependency(
            String parentOrderId, String childOrderId, DependencyType type, String condition) {
        if (isBlank(parentOrderId) || isBlank(childOrderId)) {
            throw invalidParameter("Parent and child order IDs are required");
        }
        if (type == null) {
            throw invalidParameter("Dependency type is required");
        }
        if (parentOrderId.equals(childOrderId)) {
            throw invalidParameter(String.format("Order %s cannot depend on itself", parentOrderId));
        }
        if (!lifecycleManager.hasLifecycle(parentOrderId)) {
            throw notFound(String.format("Parent order not found: %s", parentOrderId));
        }
        if (!lifecycleManager.hasLifecycle(childOrderId)) {
            throw notFound(String.format("Child order not found: %s", childOrderId));
        }

        OrderDependency dependency;
        lock.writeLock().lock();
        try {
            String existing = dependencyByChild.get(childOrderId);
            if (existing != null) {
                throw invalidParameter(String.format(
                        "Order %s already depends on order %s",
                        childOrderId, dependencies.get(existing).getParentOrderId()));
            }
            if (type == DependencyType.ONE_TRIGGERS_OTHER && closesTriggerCycle(parentOrderId, childOrderId)) {
                throw invalidParameter(String.format(
                        "Dependency %s -> %s would create a cycle", parentOrderId, childOrderId));
            }

            dependency = OrderDependency.builder()
                    .id("dep_" + UUID.randomUUID())
                    .parentOrderId(parentOrderId)
                    .childOrderId(childOrderId)
                    .type(type)
                    .condition(condition)
                    .createdAt(clock.instant())
                    .build();
            dependencies.put(dependency.getId(), dependency);
            dependenciesByParent
                    .computeIfAbsent(parentOrderId, key -> new ArrayList<>())
                    .add(dependency.getId());
            dependencyByChild.put(childOrderId, dependency.getId());
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Order dependency created: {} {} -> {} [{}]", dependency.getId(), parentOrderId, childOrderId, type);

        // Parent may have finished before the dependency existed
        LifecycleState parentState = lifecycleManager.getLifecycle(parentOrderId).getCurrentState();
        if (parentState.isTerminal()) {
            submitParentWork(parentOrderId, parentState);
        }
        return dependency;
    }

    /** Dependencies whose parent is {@code parentOrderId}, in creation order. */
    public List<OrderDependency> getDependencies(String parentOrderId) {
        lock.readLock().lock();
        try {
            List<String> ids = dependenciesByParent.getOrDefault(parentOrderId, Collections.emptyList());
            return ids.stream().map(dependencies::get).collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @throws OrderExecutionException ORDER_NOT_FOUND when the order has no parent
     */
    public String getParentOrder(String childOrderId) {
        lock.readLock().lock();
        try {
            String dependencyId = dependencyByChild.get(childOrderId);
            if (dependencyId == null) {
                throw notFound(String.format("No parent order found for order %s", childOrderId));
            }
            return dependencies.get(dependencyId).getParentOrderId();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> getChildOrders(String parentOrderId) {
        return getDependencies(parentOrderId).stream()
                .map(OrderDependency::getChildOrderId)
                .collect(Collectors.toList());
    }

    public Optional<OrderDependency> getDependency(String dependencyId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(dependencies.get(dependencyId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public void deleteDependency(String dependencyId) {
        OrderDependency removed;
        lock.writeLock().lock();
        try {
            removed = dependencies.remove(dependencyId);
            if (removed == null) {
                throw notFound(String.format("Dependency not found: %s", dependencyId));
            }
            List<String> siblings = dependenciesByParent.get(removed.getParentOrderId());
            if (siblings != null) {
                siblings.remove(dependencyId);
                if (siblings.isEmpty()) {
                    dependenciesByParent.remove(removed.getParentOrderId());
                }
            }
            dependencyByChild.remove(removed.getChildOrderId());
        } finally {
            lock.writeLock().unlock();
        }
        firedDependencies.remove(dependencyId);
        log.info("Order dependency deleted: {}", dependencyId);
    }

    // ========================
    // TRIGGERING
    // ========================

    private void onParentTerminal(OrderLifecycle parent, OrderEvent event) {
        if (getDependencies(parent.getOrderId()).isEmpty()) {
            return;
        }
        submitParentWork(parent.getOrderId(), event.getState());
    }

    private void submitParentWork(String parentOrderId, LifecycleState parentState) {
        try {
            executor.execute(() -> processParent(parentOrderId, parentState));
        } catch (RejectedExecutionException e) {
            report("dependency:" + parentOrderId, OrderExecutionException.system(
                            "dependency trigger could not be scheduled", e, SOURCE)
                    .withOrderId(parentOrderId));
        }
    }

    void processParent(String parentOrderId, LifecycleState parentState) {
        for (OrderDependency dependency : getDependencies(parentOrderId)) {
            try {
                if (parentState == LifecycleState.COMPLETED) {
                    if (dependency.getType() == DependencyType.ONE_TRIGGERS_OTHER) {
                        triggerChild(dependency);
                    } else {
                        cancelChild(dependency, EVENT_PARENT_COMPLETED);
                    }
                } else if (dependency.getType() == DependencyType.ONE_TRIGGERS_OTHER) {
                    cancelChild(dependency, EVENT_PARENT_TERMINATED);
                }
            } catch (OrderExecutionException e) {
                report("dependency:" + dependency.getId(), e);
            } catch (RuntimeException e) {
                report("dependency:" + dependency.getId(), errorClassifier.classify(e, SOURCE));
            }
        }
    }

    private void triggerChild(OrderDependency dependency) {
        if (!firedDependencies.add(dependency.getId())) {
            log.debug("Dependency {} already fired, skipping", dependency.getId());
            return;
        }

        String childId = dependency.getChildOrderId();
        LifecycleState state = lifecycleManager.getLifecycle(childId).getCurrentState();
        if (state.isAtOrPastSubmission()) {
            log.debug("Child order {} already at {}, not re-triggered", childId, state);
            return;
        }
        if (state.isTerminal()) {
            throw OrderExecutionException.validation(
                            ErrorCode.INVALID_ORDER,
                            String.format("Child order %s cannot be submitted from state %s", childId, state),
                            SOURCE)
                    .withOrderId(childId);
        }

        Map<String, Object> metadata = Map.of(
                "parentOrderId", dependency.getParentOrderId(),
                "dependencyId", dependency.getId());
        if (state == LifecycleState.CREATED) {
            lifecycleManager.transitionState(childId, LifecycleState.VALIDATED, EVENT_DEPENDENCY_TRIGGERED, metadata);
        }
        lifecycleManager.transitionState(childId, LifecycleState.SUBMITTED, EVENT_DEPENDENCY_TRIGGERED, metadata);
        log.info("Dependency {} triggered: child {} submitted after parent {} completed",
                dependency.getId(), childId, dependency.getParentOrderId());
    }

    private void cancelChild(OrderDependency dependency, String eventType) {
        String childId = dependency.getChildOrderId();
        LifecycleState state = lifecycleManager.getLifecycle(childId).getCurrentState();
        if (state.isTerminal()) {
            return;
        }
        if (dependency.getType() == DependencyType.ONE_TRIGGERS_OTHER && state.isAtOrPastSubmission()) {
            return;
        }
        if (!firedDependencies.add(dependency.getId())) {
            return;
        }
        lifecycleManager.transitionState(
                childId,
                LifecycleState.CANCELLED,
                eventType,
                Map.of("parentOrderId", dependency.getParentOrderId(), "dependencyId", dependency.getId()));
        log.info("Dependency {} cancelled child {} ({})", dependency.getId(), childId, eventType);
    }

    private void report(String context, OrderExecutionException error) {
        RetryDecision decision = errorClassifier.handleError(context, error);
        log.warn("Dependency processing failed [{}]: {}", context, decision.getError().getMessage());
    }

    // ========================
    // HELPERS
    // ========================

    // Caller holds the write lock. Walks the trigger ancestors of the new parent.
    private boolean closesTriggerCycle(String parentOrderId, String childOrderId) {
        String current = parentOrderId;
        while (current != null) {
            if (current.equals(childOrderId)) {
                return true;
            }
            String dependencyId = dependencyByChild.get(current);
            if (dependencyId == null) {
                return false;
            }
            OrderDependency upstream = dependencies.get(dependencyId);
            if (upstream.getType() != DependencyType.ONE_TRIGGERS_OTHER) {
                return false;
            }
            current = upstream.getParentOrderId();
        }
        return false;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static OrderExecutionException invalidParameter(String message) {
        return OrderExecutionException.validation(ErrorCode.INVALID_PARAMETER, message, SOURCE);
    }

    private static OrderExecutionException notFound(String message) {
        return OrderExecutionException.validation(ErrorCode.ORDER_NOT_FOUND, message, SOURCE);
    }
}
