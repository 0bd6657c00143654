package com.tradingplatform.exception;

/**
 * Raised by a broker connector when the venue rejects or fails an operation.
 * Classified as an Execution failure.
 */
public class BrokerException extends BaseException {

    public BrokerException(String message) {
        super(ErrorCode.EXECUTION_FAILED, message);
    }

    public BrokerException(String message, Throwable cause) {
        super(ErrorCode.EXECUTION_FAILED, message, cause);
    }

    protected BrokerException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
