package com.tradingplatform.broker;

import java.time.Duration;
import java.util.UUID;
import lombok.Value;

/**
 * Per-call parameters supplied by the caller of the {@link BrokerRouter}.
 *
 * <p>{@code operationId} is the retry context handed to the error classifier, so every
 * resubmission of the same logical operation must reuse it. A null {@code timeout}
 * uses the router's default deadline.
 */
@Value
public class BrokerCallContext {

    String operationId;
    Duration timeout;

    public static BrokerCallContext of(String operationId) {
        return new BrokerCallContext(operationId, null);
    }

    public static BrokerCallContext of(String operationId, Duration timeout) {
        return new BrokerCallContext(operationId, timeout);
    }

    /** A one-off context for operations that are never resubmitted. */
    public static BrokerCallContext oneOff(String operation) {
        return new BrokerCallContext(operation + ":" + UUID.randomUUID(), null);
    }
}
