package com.tradingplatform.unit.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradingplatform.api.controller.OrderLifecycleController;
import com.tradingplatform.domain.enums.DependencyType;
import com.tradingplatform.domain.enums.LifecycleState;
import com.tradingplatform.domain.model.Order;
import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.exception.ErrorType;
import com.tradingplatform.exception.GlobalExceptionHandler;
import com.tradingplatform.oms.DeadLetterQueue;
import com.tradingplatform.oms.FailedOrder;
import com.tradingplatform.oms.OrderDependencyManager;
import com.tradingplatform.oms.OrderLifecycleManager;
import com.tradingplatform.resilience.ErrorClassifier;
import com.tradingplatform.unit.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for OrderLifecycleController over real lifecycle and dependency managers.
 */
class OrderLifecycleControllerTest {

    private MockMvc mockMvc;
    private OrderLifecycleManager lifecycleManager;
    private OrderDependencyManager dependencyManager;
    private DeadLetterQueue deadLetterQueue;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2024-03-01T09:15:00Z");
        lifecycleManager = new OrderLifecycleManager(clock);
        dependencyManager = new OrderDependencyManager(
                lifecycleManager, new ErrorClassifier(3, Duration.ofHours(1)), Runnable::run, clock);
        deadLetterQueue = new DeadLetterQueue();
        OrderLifecycleController controller =
                new OrderLifecycleController(lifecycleManager, dependencyManager, deadLetterQueue);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private void track(String orderId) {
        lifecycleManager.createLifecycle(Order.builder().id(orderId).symbol("RELIANCE").quantity(5).build());
    }

    @Test
    void getLifecycle_returnsCurrentState() throws Exception {
        track("ORD-1");
        lifecycleManager.transitionState("ORD-1", LifecycleState.VALIDATED, "VALIDATION_PASSED", null);

        mockMvc.perform(get("/api/orders/ORD-1/lifecycle"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentState").value("VALIDATED"))
                .andExpect(jsonPath("$.order.symbol").value("RELIANCE"))
                .andExpect(jsonPath("$.events.length()").value(2));
    }

    @Test
    void getLifecycle_unknownOrderIs404() throws Exception {
        mockMvc.perform(get("/api/orders/ORD-404/lifecycle"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("ERR_ORDER_NOT_FOUND"))
                .andExpect(jsonPath("$.error.message").value("Order lifecycle not found for order ID ORD-404"));
    }

    @Test
    void getEvents_returnsHistoryOldestFirst() throws Exception {
        track("ORD-1");
        lifecycleManager.transitionState("ORD-1", LifecycleState.CANCELLED, "CANCELLED_BY_USER", null);

        mockMvc.perform(get("/api/orders/ORD-1/events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].eventType").value("ORDER_CREATED"))
                .andExpect(jsonPath("$[1].state").value("CANCELLED"))
                .andExpect(jsonPath("$[1].previousState").value("CREATED"));
    }

    @Test
    void getActive_excludesTerminalOrders() throws Exception {
        track("ORD-1");
        track("ORD-2");
        lifecycleManager.transitionState("ORD-2", LifecycleState.REJECTED, null, null);

        mockMvc.perform(get("/api/orders/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].order.id").value("ORD-1"));
    }

    @Test
    void getDependencies_listsChildrenOfParent() throws Exception {
        track("ENTRY");
        track("STOP");
        dependencyManager.createDependency("ENTRY", "STOP", DependencyType.ONE_TRIGGERS_OTHER, "on-fill");

        mockMvc.perform(get("/api/orders/ENTRY/dependencies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].childOrderId").value("STOP"))
                .andExpect(jsonPath("$[0].type").value("ONE_TRIGGERS_OTHER"));

        mockMvc.perform(get("/api/orders/UNKNOWN/dependencies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void getDeadLetters_listsFailedOrders() throws Exception {
        deadLetterQueue.add(FailedOrder.builder()
                .order(Order.builder().id("ORD-9").symbol("SBIN").quantity(1).build())
                .errorType(ErrorType.NETWORK)
                .errorCode(ErrorCode.TIMEOUT)
                .message("execution failed")
                .attempts(4)
                .failedAt(Instant.parse("2024-03-01T09:20:00Z"))
                .build());

        mockMvc.perform(get("/api/orders/dead-letter"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].orderId").value("ORD-9"))
                .andExpect(jsonPath("$[0].errorCode").value("TIMEOUT"))
                .andExpect(jsonPath("$[0].attempts").value(4));
    }
}
