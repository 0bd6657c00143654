package com.tradingplatform.exception;

public enum ErrorSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
