package com.tradingplatform.event;

/** Classifies the risk condition that produced a {@link RiskEvent}. */
public enum RiskEventType {

    /** An order breached an enabled limit of its risk profile. */
    LIMIT_BREACH,

    /** The portfolio does not have enough free margin for the order. */
    INSUFFICIENT_MARGIN,

    /** A strategy-level parameter (max order quantity, max position) was exceeded. */
    STRATEGY_PARAMETER_BREACH,

    /** The order rate window is full. */
    RATE_LIMIT_BREACH,

    /** Risk validation itself failed unexpectedly. */
    VALIDATION_FAILURE
}
