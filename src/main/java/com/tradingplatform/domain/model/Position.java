package com.tradingplatform.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** Net position of a portfolio in one symbol. Positive quantity is long, negative is short. */
@Data
@Builder(toBuilder = true)
public class Position {

    private String portfolioId;
    private String symbol;
    private String exchange;
    private int quantity;
    private BigDecimal averagePrice;

    /** Absolute notional of the position at its average price. */
    public BigDecimal notional() {
        if (averagePrice == null) {
            return BigDecimal.ZERO;
        }
        return averagePrice.multiply(BigDecimal.valueOf(Math.abs(quantity)));
    }
}
