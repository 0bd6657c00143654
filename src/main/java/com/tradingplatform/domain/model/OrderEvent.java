package com.tradingplatform.domain.model;

import com.tradingplatform.domain.enums.LifecycleState;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable record of one lifecycle transition. The first event of every lifecycle
 * records the CREATED state and has no previous state.
 */
@Value
@Builder
public class OrderEvent {

    String id;
    String orderId;
    LifecycleState state;
    LifecycleState previousState;

    /** Cause tag, e.g. {@code VALIDATION_PASSED}. */
    String eventType;

    Instant timestamp;

    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
