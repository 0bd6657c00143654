package com.tradingplatform.oms;

import com.tradingplatform.domain.model.Order;
import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.exception.ErrorType;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** An order the engine gave up on, with the final error it surfaced. */
@Value
@Builder
public class FailedOrder {

    Order order;
    ErrorType errorType;
    ErrorCode errorCode;
    String message;
    int attempts;
    Instant failedAt;

    public String getOrderId() {
        return order.getId();
    }
}
