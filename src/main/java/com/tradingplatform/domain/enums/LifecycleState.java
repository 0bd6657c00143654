package com.tradingplatform.domain.enums;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State of an order inside the execution engine.
 *
 * <p>Forward chain: CREATED → VALIDATED → SUBMITTED → ACKNOWLEDGED → PARTIALLY_FILLED → COMPLETED.
 * ACKNOWLEDGED may complete directly, and PARTIALLY_FILLED may repeat for each further partial fill.
 * CANCELLED, REJECTED and FAILED are absorbing and reachable from every non-terminal state.
 * COMPLETED is terminal as well.
 */
public enum LifecycleState {
    CREATED,
    VALIDATED,
    SUBMITTED,
    ACKNOWLEDGED,
    PARTIALLY_FILLED,
    COMPLETED,
    CANCELLED,
    REJECTED,
    FAILED;

    private static final Map<LifecycleState, Set<LifecycleState>> TRANSITIONS = new EnumMap<>(LifecycleState.class);

    static {
        Set<LifecycleState> absorbing = EnumSet.of(CANCELLED, REJECTED, FAILED);

        TRANSITIONS.put(CREATED, with(absorbing, VALIDATED));
        TRANSITIONS.put(VALIDATED, with(absorbing, SUBMITTED));
        TRANSITIONS.put(SUBMITTED, with(absorbing, ACKNOWLEDGED));
        TRANSITIONS.put(ACKNOWLEDGED, with(absorbing, PARTIALLY_FILLED, COMPLETED));
        TRANSITIONS.put(PARTIALLY_FILLED, with(absorbing, PARTIALLY_FILLED, COMPLETED));
        for (LifecycleState terminal : EnumSet.of(COMPLETED, CANCELLED, REJECTED, FAILED)) {
            TRANSITIONS.put(terminal, Collections.unmodifiableSet(EnumSet.noneOf(LifecycleState.class)));
        }
    }

    private static Set<LifecycleState> with(Set<LifecycleState> base, LifecycleState first, LifecycleState... rest) {
        EnumSet<LifecycleState> allowed = EnumSet.of(first, rest);
        allowed.addAll(base);
        return Collections.unmodifiableSet(allowed);
    }

    public boolean canTransitionTo(LifecycleState target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<LifecycleState> allowedTransitions() {
        return TRANSITIONS.get(this);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /** True for states the order reaches once it has been handed to the venue. */
    public boolean isAtOrPastSubmission() {
        return this == SUBMITTED || this == ACKNOWLEDGED || this == PARTIALLY_FILLED || this == COMPLETED;
    }

    public OrderStatus toOrderStatus() {
        switch (this) {
            case CREATED:
            case VALIDATED:
                return OrderStatus.PENDING;
            case SUBMITTED:
                return OrderStatus.SUBMITTED;
            case ACKNOWLEDGED:
                return OrderStatus.OPEN;
            case PARTIALLY_FILLED:
                return OrderStatus.PARTIAL;
            case COMPLETED:
                return OrderStatus.COMPLETED;
            case CANCELLED:
                return OrderStatus.CANCELLED;
            case REJECTED:
                return OrderStatus.REJECTED;
            default:
                return OrderStatus.FAILED;
        }
    }
}
