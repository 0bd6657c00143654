package com.tradingplatform.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** Capital and margin view of a trading account used by pre-trade risk checks. */
@Data
@Builder
public class Portfolio {

    private String id;
    private String userId;
    private String name;

    /** Total capital allocated to the portfolio. */
    private BigDecimal capital;

    /** Margin still free for new orders. */
    private BigDecimal availableMargin;

    /** Margin already blocked by open positions and orders. */
    private BigDecimal usedMargin;

    /** Current mark-to-market value. */
    private BigDecimal currentValue;

    /** Highest value reached, the reference for drawdown. */
    private BigDecimal peakValue;
}
