package com.tradingplatform.broker;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Session returned by a successful connector login. */
@Value
@Builder
public class BrokerSession {

    String userId;
    String clientId;
    String token;
    Instant loginTime;
}
