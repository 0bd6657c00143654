package com.tradingplatform.domain.enums;

/**
 * Externally visible status of an order, derived from its lifecycle state.
 * PENDING covers the pre-submission states (created, validated).
 */
public enum OrderStatus {
    PENDING,
    SUBMITTED,
    OPEN,
    PARTIAL,
    COMPLETED,
    CANCELLED,
    REJECTED,
    FAILED
}
