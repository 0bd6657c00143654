package com.tradingplatform.risk;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Named set of risk limits referenced by strategies. Replaced as a whole on update;
 * {@code version} starts at 1 and increases with every update.
 */
@Value
@Builder(toBuilder = true)
public class RiskProfile {

    String id;
    String name;
    String description;

    @Builder.Default
    Map<RiskLimitType, RiskLimit> limits = Map.of();

    long version;
    Instant createdAt;
    Instant updatedAt;

    public RiskLimit getLimit(RiskLimitType type) {
        return limits.get(type);
    }
}
