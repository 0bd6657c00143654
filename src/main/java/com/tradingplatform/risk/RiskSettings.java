package com.tradingplatform.risk;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Engine-wide parameters of the pre-trade risk checks. */
@Value
@Builder
public class RiskSettings {

    /** Fraction of order value blocked as margin for intraday (MIS) orders. */
    @Builder.Default
    BigDecimal intradayMarginRate = new BigDecimal("0.20");

    /** Fraction of order value blocked as margin for NRML and CNC orders. */
    @Builder.Default
    BigDecimal deliveryMarginRate = BigDecimal.ONE;

    /** Sliding window for ORDER_RATE limits. */
    @Builder.Default
    Duration rateWindow = Duration.ofMinutes(1);

    public static RiskSettings defaults() {
        return builder().build();
    }
}
