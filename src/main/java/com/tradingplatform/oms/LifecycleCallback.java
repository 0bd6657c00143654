package com.tradingplatform.oms;

import com.tradingplatform.domain.model.OrderEvent;
import com.tradingplatform.domain.model.OrderLifecycle;

/**
 * Subscriber to lifecycle transitions into one state.
 *
 * <p>Invoked on the transitioning thread after the lifecycle lock is released, with a
 * read-only snapshot. Implementations may call back into {@link OrderLifecycleManager}.
 * Long-running work should be handed to an executor.
 */
@FunctionalInterface
public interface LifecycleCallback {

    void onTransition(OrderLifecycle lifecycle, OrderEvent event);
}
