package com.tradingplatform.broker;

import com.tradingplatform.domain.enums.BrokerType;
import com.tradingplatform.simulator.PaperBrokerConnector;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connector factory keyed by {@link BrokerType}. The paper venue is always available;
 * venue-specific connectors are added with {@link #register}.
 */
public class DefaultBrokerConnectorFactory implements BrokerConnectorFactory {

    private static final Logger log = LoggerFactory.getLogger(DefaultBrokerConnectorFactory.class);

    private final Map<BrokerType, BiFunction<String, BrokerConfig, BrokerConnector>> builders =
            new EnumMap<>(BrokerType.class);

    public DefaultBrokerConnectorFactory(Clock clock) {
        register(BrokerType.PAPER, (clientId, config) -> new PaperBrokerConnector(clientId, clock));
    }

    public final void register(BrokerType type, BiFunction<String, BrokerConfig, BrokerConnector> builder) {
        synchronized (builders) {
            builders.put(type, builder);
        }
    }

    @Override
    public BrokerConnector create(String clientId, BrokerConfig config) {
        BiFunction<String, BrokerConfig, BrokerConnector> builder;
        synchronized (builders) {
            builder = config.getBrokerType() == null ? null : builders.get(config.getBrokerType());
        }
        if (builder == null) {
            throw new IllegalArgumentException("unsupported broker type: " + config.getBrokerType());
        }
        log.info("Creating {} connector for client {}", config.getBrokerType(), clientId);
        return builder.apply(clientId, config);
    }
}
