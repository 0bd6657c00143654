package com.tradingplatform.broker;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Quote {

    String symbol;
    BigDecimal lastPrice;
    BigDecimal bid;
    BigDecimal ask;
    Instant timestamp;
}
