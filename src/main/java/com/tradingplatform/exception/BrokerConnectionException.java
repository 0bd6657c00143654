package com.tradingplatform.exception;

/** Connectivity failure talking to a venue. Classified as a Network failure. */
public class BrokerConnectionException extends BrokerException {

    public BrokerConnectionException(String message) {
        super(ErrorCode.CONNECTION_FAILED, message, null);
    }

    public BrokerConnectionException(String message, Throwable cause) {
        super(ErrorCode.CONNECTION_FAILED, message, cause);
    }
}
