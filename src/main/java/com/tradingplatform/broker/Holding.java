package com.tradingplatform.broker;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Holding {

    String symbol;
    String exchange;
    int quantity;
    BigDecimal averagePrice;
}
