package com.tradingplatform.risk;

/** Severity attached to a risk limit, reported with breaches. */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    EXTREME
}
