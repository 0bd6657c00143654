package com.tradingplatform.domain.enums;

/**
 * Margin product of an order. MIS is intraday (leveraged), NRML carries overnight
 * derivatives, CNC is cash delivery.
 */
public enum ProductType {
    MIS,
    NRML,
    CNC
}
