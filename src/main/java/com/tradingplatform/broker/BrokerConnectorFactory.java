package com.tradingplatform.broker;

/** Builds the connector for a configured broker client. */
@FunctionalInterface
public interface BrokerConnectorFactory {

    /**
     * @throws IllegalArgumentException if the configuration's broker type is not supported
     */
    BrokerConnector create(String clientId, BrokerConfig config);
}
