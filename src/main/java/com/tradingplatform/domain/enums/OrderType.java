package com.tradingplatform.domain.enums;

/**
 * Order execution type.
 * SL = stop-loss limit (requires both price and trigger price).
 * SL_M = stop-loss market (requires only trigger price).
 */
public enum OrderType {
    MARKET,
    LIMIT,
    SL,
    SL_M;

    public boolean requiresPrice() {
        return this == LIMIT || this == SL;
    }
}
