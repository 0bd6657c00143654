package com.tradingplatform.broker;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BrokerCredentials {

    String userId;
    String password;
    String totp;
}
