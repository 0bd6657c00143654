package com.tradingplatform.risk;

/**
 * Kinds of limit a {@link RiskProfile} may carry. Enabled limits are checked in
 * declaration order, so cheap per-order checks come first.
 *
 * <p>Fractions are expressed as decimals (0.7 = 70%).
 */
public enum RiskLimitType {

    /** Maximum order value (price × quantity). */
    ORDER_VALUE,

    /** Maximum absolute net position in the order's symbol after the order. */
    POSITION_SIZE,

    /** Maximum fraction of capital blocked as margin after the order. */
    MARGIN_UTILIZATION,

    /** Maximum gross exposure divided by capital after the order. */
    LEVERAGE,

    /** Maximum fraction of gross exposure held in the order's symbol after the order. */
    CONCENTRATION,

    /** Maximum absolute gross exposure after the order. */
    EXPOSURE,

    /** Maximum drawdown from peak value at which exposure-increasing orders are still accepted. */
    DRAWDOWN,

    /** Maximum orders per portfolio within the rate window. */
    ORDER_RATE
}
