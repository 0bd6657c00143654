package com.tradingplatform.domain.enums;

/** Venue family a connector is built for. PAPER is the in-memory simulated venue. */
public enum BrokerType {
    PAPER,
    XTS_PRO,
    XTS_CLIENT,
    ZERODHA
}
