package com.tradingplatform.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    INVALID_ORDER("ERR_INVALID_ORDER", 400),
    INVALID_PARAMETER("ERR_INVALID_PARAMETER", 400),
    NOT_FOUND("NOT_FOUND", 404),
    ORDER_NOT_FOUND("ERR_ORDER_NOT_FOUND", 404),
    DUPLICATE_ORDER("ERR_DUPLICATE_ORDER", 409),
    INSUFFICIENT_MARGIN("ERR_INSUFFICIENT_MARGIN", 422),
    POSITION_LIMIT_EXCEEDED("ERR_POSITION_LIMIT_EXCEEDED", 422),
    RATE_LIMIT_EXCEEDED("ERR_RATE_LIMIT_EXCEEDED", 429),
    NO_ACTIVE_SESSION("ERR_NO_ACTIVE_SESSION", 401),
    AUTHENTICATION_FAILED("ERR_AUTHENTICATION_FAILED", 401),
    UNSUPPORTED_OPERATION("ERR_UNSUPPORTED_OPERATION", 501),
    EXECUTION_FAILED("ERR_EXECUTION_FAILED", 502),
    CONNECTION_FAILED("ERR_CONNECTION_FAILED", 503),
    CIRCUIT_OPEN("ERR_CIRCUIT_OPEN", 503),
    TIMEOUT("ERR_TIMEOUT", 504),
    CANCELLED("ERR_CANCELLED", 499),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
