package com.tradingplatform.oms;

import com.tradingplatform.domain.enums.DependencyType;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Directed edge from a parent order to a child order. */
@Value
@Builder
public class OrderDependency {

    String id;
    String parentOrderId;
    String childOrderId;
    DependencyType type;

    /** Free-form condition tag supplied by the caller. Recorded, not interpreted. */
    String condition;

    Instant createdAt;
}
