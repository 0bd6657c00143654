package com.tradingplatform.domain.enums;

/** Buy or sell side of an order. */
public enum OrderSide {
    BUY,
    SELL;

    /** Signed direction applied to a position: +1 for BUY, -1 for SELL. */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
