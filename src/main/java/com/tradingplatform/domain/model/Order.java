package com.tradingplatform.domain.model;

import com.tradingplatform.domain.enums.OrderSide;
import com.tradingplatform.domain.enums.OrderStatus;
import com.tradingplatform.domain.enums.OrderType;
import com.tradingplatform.domain.enums.ProductType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * A client order as it enters the execution engine.
 *
 * <p>The caller owns the instance. The lifecycle manager keeps its own copy
 * ({@link #copy()}) so later caller mutations never leak into lifecycle snapshots.
 * {@code status} and {@code updatedAt} on the engine's copy are maintained from the
 * lifecycle state.
 */
@Data
@Builder(toBuilder = true)
public class Order {

    private String id;

    private String portfolioId;

    /** Strategy this order belongs to. Null for manually placed orders. */
    private String strategyId;

    private String symbol;
    private String exchange;
    private OrderType orderType;
    private ProductType productType;
    private OrderSide side;

    private int quantity;

    /** Limit price. Required for LIMIT and SL orders; used as the reference price for MARKET orders. */
    private BigDecimal price;

    /** Trigger price for SL and SL_M orders. */
    private BigDecimal triggerPrice;

    /** Set when this order must wait for another order to complete. */
    private String parentOrderId;

    /** Dealer orders: the client account the order is placed on behalf of. */
    private String clientId;

    /** Venue order id, assigned once the venue acknowledges the order. */
    private String brokerOrderId;

    private OrderStatus status;

    private int filledQuantity;
    private BigDecimal averagePrice;

    private Instant createdAt;
    private Instant updatedAt;

    /** Order value = price × quantity. Zero when no price is known. */
    public BigDecimal value() {
        if (price == null) {
            return BigDecimal.ZERO;
        }
        return price.multiply(BigDecimal.valueOf(quantity));
    }

    public Order copy() {
        return toBuilder().build();
    }
}
