package com.tradingplatform.exception;

/**
 * Failure category of an {@link OrderExecutionException}. Drives retry eligibility
 * and how much detail is exposed to callers and logs.
 */
public enum ErrorType {

    /** Bad input. Never retried, surfaced verbatim. */
    VALIDATION,

    /** Operation failed at the venue. Retried up to the policy limit, detail preserved. */
    EXECUTION,

    /** Timeouts and connectivity. Retried, detail generalized before logging. */
    NETWORK,

    /** Unexpected internal failure. Retried conservatively, logged at elevated severity. */
    SYSTEM
}
