package com.tradingplatform.event;

import com.tradingplatform.domain.model.OrderEvent;
import com.tradingplatform.domain.model.OrderLifecycle;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every successful lifecycle transition, including creation.
 *
 * <p>Carries the post-transition snapshot and the event that was appended, so
 * listeners never need to call back into the lifecycle manager.
 */
public class OrderLifecycleEvent extends ApplicationEvent {

    private final OrderLifecycle lifecycle;
    private final OrderEvent transition;

    public OrderLifecycleEvent(Object source, OrderLifecycle lifecycle, OrderEvent transition) {
        super(source);
        this.lifecycle = lifecycle;
        this.transition = transition;
    }

    public OrderLifecycle getLifecycle() {
        return lifecycle;
    }

    public OrderEvent getTransition() {
        return transition;
    }
}
