package com.tradingplatform.broker;

import com.tradingplatform.domain.enums.BrokerType;
import java.time.Duration;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Connection settings for one broker client. The factory selects the connector by {@code brokerType}. */
@Value
@Builder
public class BrokerConfig {

    BrokerType brokerType;
    String baseUrl;
    String apiKey;
    String secretKey;

    /** Dealer or client account type as understood by the venue. */
    String source;

    /** Overrides the router's default call deadline for this client. Null = default. */
    Duration callTimeout;

    @Builder.Default
    Map<String, String> properties = Map.of();
}
