package com.tradingplatform.exception;

public class BrokerAuthenticationException extends BrokerException {

    public BrokerAuthenticationException(String message) {
        super(ErrorCode.AUTHENTICATION_FAILED, message, null);
    }
}
