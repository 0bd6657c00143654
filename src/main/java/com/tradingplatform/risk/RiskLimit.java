package com.tradingplatform.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class RiskLimit {

    RiskLimitType type;
    BigDecimal value;

    @Builder.Default
    RiskLevel level = RiskLevel.MEDIUM;

    /** Human-readable name used as the breach message prefix. */
    String description;

    @Builder.Default
    boolean enabled = true;
}
