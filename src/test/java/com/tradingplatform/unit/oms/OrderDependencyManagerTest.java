package com.tradingplatform.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradingplatform.domain.enums.DependencyType;
import com.tradingplatform.domain.enums.LifecycleState;
import com.tradingplatform.domain.enums.OrderSide;
import com.tradingplatform.domain.enums.OrderType;
import com.tradingplatform.domain.model.Order;
import com.tradingplatform.domain.model.OrderEvent;
import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.exception.OrderExecutionException;
import com.tradingplatform.oms.OrderDependency;
import com.tradingplatform.oms.OrderDependencyManager;
import com.tradingplatform.oms.OrderLifecycleManager;
import com.tradingplatform.resilience.ErrorClassifier;
import com.tradingplatform.unit.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for OrderDependencyManager. Dependency work runs on a direct executor so
 * triggers complete before each assertion.
 */
class OrderDependencyManagerTest {

    private OrderLifecycleManager lifecycleManager;
    private ErrorClassifier errorClassifier;
    private OrderDependencyManager dependencyManager;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2024-03-01T09:15:00Z");
        lifecycleManager = new OrderLifecycleManager(clock);
        errorClassifier = new ErrorClassifier(3, Duration.ofHours(1));
        Executor direct = Runnable::run;
        dependencyManager = new OrderDependencyManager(lifecycleManager, errorClassifier, direct, clock);
    }

    private void create(String... orderIds) {
        for (String orderId : orderIds) {
            lifecycleManager.createLifecycle(Order.builder()
                    .id(orderId)
                    .symbol("INFY")
                    .side(OrderSide.SELL)
                    .orderType(OrderType.LIMIT)
                    .quantity(5)
                    .price(new BigDecimal("1500"))
                    .build());
        }
    }

    private void complete(String orderId) {
        for (LifecycleState state : List.of(
                LifecycleState.VALIDATED,
                LifecycleState.SUBMITTED,
                LifecycleState.ACKNOWLEDGED,
                LifecycleState.COMPLETED)) {
            lifecycleManager.transitionState(orderId, state, null, null);
        }
    }

    private LifecycleState stateOf(String orderId) {
        return lifecycleManager.getLifecycle(orderId).getCurrentState();
    }

    @Nested
    @DisplayName("Creating dependencies")
    class Creating {

        @Test
        @DisplayName("Records the edge and exposes it by parent and child")
        void recordsEdge() {
            create("P", "C1", "C2");

            OrderDependency first =
                    dependencyManager.createDependency("P", "C1", DependencyType.ONE_TRIGGERS_OTHER, "PARENT_COMPLETED");
            dependencyManager.createDependency("P", "C2", DependencyType.ONE_CANCELS_OTHER, null);

            assertThat(first.getId()).startsWith("dep_");
            assertThat(first.getCondition()).isEqualTo("PARENT_COMPLETED");
            assertThat(dependencyManager.getChildOrders("P")).containsExactly("C1", "C2");
            assertThat(dependencyManager.getParentOrder("C1")).isEqualTo("P");
            assertThat(dependencyManager.getDependency(first.getId())).contains(first);
        }

        @Test
        @DisplayName("Self dependency is rejected")
        void selfDependencyRejected() {
            create("P");

            assertThatThrownBy(() -> dependencyManager.createDependency("P", "P", DependencyType.ONE_TRIGGERS_OTHER, null))
                    .isInstanceOf(OrderExecutionException.class)
                    .hasMessage("Order P cannot depend on itself");
        }

        @Test
        @DisplayName("Unknown parent or child reports ORDER_NOT_FOUND")
        void unknownOrdersRejected() {
            create("P");

            assertThatThrownBy(() -> dependencyManager.createDependency("X", "P", DependencyType.ONE_TRIGGERS_OTHER, null))
                    .hasMessage("Parent order not found: X");
            assertThatThrownBy(() -> dependencyManager.createDependency("P", "X", DependencyType.ONE_TRIGGERS_OTHER, null))
                    .hasMessage("Child order not found: X")
                    .extracting(e -> ((OrderExecutionException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ORDER_NOT_FOUND);
        }

        @Test
        @DisplayName("A child can have only one parent")
        void singleParent() {
            create("P1", "P2", "C");
            dependencyManager.createDependency("P1", "C", DependencyType.ONE_TRIGGERS_OTHER, null);

            assertThatThrownBy(() -> dependencyManager.createDependency("P2", "C", DependencyType.ONE_TRIGGERS_OTHER, null))
                    .hasMessage("Order C already depends on order P1");
        }

        @Test
        @DisplayName("Trigger cycles are rejected")
        void cycleRejected() {
            create("A", "B", "C");
            dependencyManager.createDependency("A", "B", DependencyType.ONE_TRIGGERS_OTHER, null);
            dependencyManager.createDependency("B", "C", DependencyType.ONE_TRIGGERS_OTHER, null);

            assertThatThrownBy(() -> dependencyManager.createDependency("C", "A", DependencyType.ONE_TRIGGERS_OTHER, null))
                    .isInstanceOf(OrderExecutionException.class)
                    .hasMessage("Dependency C -> A would create a cycle");
        }

        @Test
        @DisplayName("Deleting a dependency frees the child")
        void deleteFreesChild() {
            create("P", "C");
            OrderDependency dependency =
                    dependencyManager.createDependency("P", "C", DependencyType.ONE_TRIGGERS_OTHER, null);

            dependencyManager.deleteDependency(dependency.getId());

            assertThat(dependencyManager.getDependencies("P")).isEmpty();
            assertThatThrownBy(() -> dependencyManager.getParentOrder("C"))
                    .hasMessage("No parent order found for order C");
            assertThatThrownBy(() -> dependencyManager.deleteDependency(dependency.getId()))
                    .hasMessage("Dependency not found: " + dependency.getId());
        }
    }

    @Nested
    @DisplayName("One-triggers-other")
    class OneTriggersOther {

        @Test
        @DisplayName("Parent completion submits a CREATED child via VALIDATED")
        void completionSubmitsChild() {
            create("P", "C");
            OrderDependency dependency =
                    dependencyManager.createDependency("P", "C", DependencyType.ONE_TRIGGERS_OTHER, null);

            complete("P");

            assertThat(stateOf("C")).isEqualTo(LifecycleState.SUBMITTED);
            OrderEvent last = lifecycleManager.getLifecycle("C").lastEvent();
            assertThat(last.getEventType()).isEqualTo(OrderDependencyManager.EVENT_DEPENDENCY_TRIGGERED);
            assertThat(last.getMetadata())
                    .containsEntry("parentOrderId", "P")
                    .containsEntry("dependencyId", dependency.getId());
        }

        @Test
        @DisplayName("Parent completion submits a VALIDATED child directly")
        void completionSubmitsValidatedChild() {
            create("P", "C");
            lifecycleManager.transitionState("C", LifecycleState.VALIDATED, null, null);
            dependencyManager.createDependency("P", "C", DependencyType.ONE_TRIGGERS_OTHER, null);

            complete("P");

            assertThat(lifecycleManager.getOrderEvents("C"))
                    .extracting(OrderEvent::getState)
                    .containsExactly(LifecycleState.CREATED, LifecycleState.VALIDATED, LifecycleState.SUBMITTED);
        }

        @Test
        @DisplayName("A child already submitted is left alone")
        void submittedChildNotRetriggered() {
            create("P", "C");
            lifecycleManager.transitionState("C", LifecycleState.VALIDATED, null, null);
            lifecycleManager.transitionState("C", LifecycleState.SUBMITTED, "MANUAL", null);
            dependencyManager.createDependency("P", "C", DependencyType.ONE_TRIGGERS_OTHER, null);

            complete("P");

            assertThat(lifecycleManager.getOrderEvents("C")).hasSize(3);
        }

        @Test
        @DisplayName("Parent rejection cancels the unsubmitted child")
        void rejectionCancelsChild() {
            create("P", "C");
            dependencyManager.createDependency("P", "C", DependencyType.ONE_TRIGGERS_OTHER, null);

            lifecycleManager.transitionState("P", LifecycleState.REJECTED, null, null);

            assertThat(stateOf("C")).isEqualTo(LifecycleState.CANCELLED);
            assertThat(lifecycleManager.getLifecycle("C").lastEvent().getEventType())
                    .isEqualTo(OrderDependencyManager.EVENT_PARENT_TERMINATED);
        }

        @Test
        @DisplayName("A dependency on an already completed parent fires at once")
        void alreadyCompletedParentFires() {
            create("P", "C");
            complete("P");

            dependencyManager.createDependency("P", "C", DependencyType.ONE_TRIGGERS_OTHER, null);

            assertThat(stateOf("C")).isEqualTo(LifecycleState.SUBMITTED);
        }

        @Test
        @DisplayName("A terminal child is reported, not transitioned")
        void terminalChildReported() {
            create("P", "C");
            OrderDependency dependency =
                    dependencyManager.createDependency("P", "C", DependencyType.ONE_TRIGGERS_OTHER, null);
            lifecycleManager.transitionState("C", LifecycleState.CANCELLED, "CANCELLED_BY_USER", null);

            complete("P");

            assertThat(stateOf("C")).isEqualTo(LifecycleState.CANCELLED);
            // Validation failures are never counted against a retry budget
            assertThat(errorClassifier.getRetryCount("dependency:" + dependency.getId())).isZero();
        }

        @Test
        @DisplayName("A chain of triggers cascades")
        void chainCascades() {
            create("A", "B", "C");
            dependencyManager.createDependency("A", "B", DependencyType.ONE_TRIGGERS_OTHER, null);
            dependencyManager.createDependency("B", "C", DependencyType.ONE_TRIGGERS_OTHER, null);

            complete("A");
            lifecycleManager.transitionState("B", LifecycleState.ACKNOWLEDGED, null, null);
            lifecycleManager.transitionState("B", LifecycleState.COMPLETED, null, null);

            assertThat(stateOf("C")).isEqualTo(LifecycleState.SUBMITTED);
        }
    }

    @Nested
    @DisplayName("One-cancels-other")
    class OneCancelsOther {

        @Test
        @DisplayName("Parent completion cancels a working child")
        void completionCancelsChild() {
            create("P", "C");
            lifecycleManager.transitionState("C", LifecycleState.VALIDATED, null, null);
            lifecycleManager.transitionState("C", LifecycleState.SUBMITTED, null, null);
            lifecycleManager.transitionState("C", LifecycleState.ACKNOWLEDGED, null, null);
            dependencyManager.createDependency("P", "C", DependencyType.ONE_CANCELS_OTHER, null);

            complete("P");

            assertThat(stateOf("C")).isEqualTo(LifecycleState.CANCELLED);
            assertThat(lifecycleManager.getLifecycle("C").lastEvent().getEventType())
                    .isEqualTo(OrderDependencyManager.EVENT_PARENT_COMPLETED);
        }

        @Test
        @DisplayName("Mutual cancel pairs are allowed and only one side is cancelled")
        void mutualPair() {
            create("A", "B");
            dependencyManager.createDependency("A", "B", DependencyType.ONE_CANCELS_OTHER, null);
            dependencyManager.createDependency("B", "A", DependencyType.ONE_CANCELS_OTHER, null);

            complete("A");

            assertThat(stateOf("A")).isEqualTo(LifecycleState.COMPLETED);
            assertThat(stateOf("B")).isEqualTo(LifecycleState.CANCELLED);
        }

        @Test
        @DisplayName("Parent cancellation leaves the cancel-linked child untouched")
        void parentCancellationIgnored() {
            create("P", "C");
            dependencyManager.createDependency("P", "C", DependencyType.ONE_CANCELS_OTHER, null);

            lifecycleManager.transitionState("P", LifecycleState.CANCELLED, null, null);

            assertThat(stateOf("C")).isEqualTo(LifecycleState.CREATED);
        }
    }
}
