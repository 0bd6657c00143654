package com.tradingplatform.broker;

import com.tradingplatform.domain.enums.OrderSide;
import com.tradingplatform.domain.enums.OrderStatus;
import com.tradingplatform.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Venue view of an order, as returned by order book queries. */
@Value
@Builder(toBuilder = true)
public class BrokerOrder {

    String brokerOrderId;
    String clientId;
    String symbol;
    String exchange;
    OrderSide side;
    OrderType orderType;
    int quantity;
    int filledQuantity;
    BigDecimal price;
    BigDecimal triggerPrice;
    BigDecimal averagePrice;
    OrderStatus status;

    /** Venue rejection or status message. */
    String message;

    Instant updatedAt;
}
