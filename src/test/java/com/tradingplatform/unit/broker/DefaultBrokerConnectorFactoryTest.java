package com.tradingplatform.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.tradingplatform.broker.BrokerConfig;
import com.tradingplatform.broker.BrokerConnector;
import com.tradingplatform.broker.DefaultBrokerConnectorFactory;
import com.tradingplatform.domain.enums.BrokerType;
import com.tradingplatform.simulator.PaperBrokerConnector;
import java.time.Clock;
import org.junit.jupiter.api.Test;

class DefaultBrokerConnectorFactoryTest {

    private final DefaultBrokerConnectorFactory factory = new DefaultBrokerConnectorFactory(Clock.systemUTC());

    @Test
    void paperVenueIsBuiltIn() {
        BrokerConnector connector =
                factory.create("C-1", BrokerConfig.builder().brokerType(BrokerType.PAPER).build());

        assertThat(connector).isInstanceOf(PaperBrokerConnector.class);
        assertThat(((PaperBrokerConnector) connector).getClientId()).isEqualTo("C-1");
    }

    @Test
    void unregisteredTypeIsRejected() {
        BrokerConfig config = BrokerConfig.builder().brokerType(BrokerType.ZERODHA).build();

        assertThatThrownBy(() -> factory.create("C-1", config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("unsupported broker type: ZERODHA");
    }

    @Test
    void missingTypeIsRejected() {
        assertThatThrownBy(() -> factory.create("C-1", BrokerConfig.builder().build()))
                .hasMessage("unsupported broker type: null");
    }

    @Test
    void registeredBuilderReceivesClientAndConfig() {
        BrokerConnector custom = mock(BrokerConnector.class);
        BrokerConfig config = BrokerConfig.builder()
                .brokerType(BrokerType.XTS_PRO)
                .baseUrl("https://xts.example.test")
                .build();
        String[] seenClient = new String[1];
        factory.register(BrokerType.XTS_PRO, (clientId, cfg) -> {
            seenClient[0] = clientId;
            assertThat(cfg.getBaseUrl()).isEqualTo("https://xts.example.test");
            return custom;
        });

        assertThat(factory.create("DEALER-1", config)).isSameAs(custom);
        assertThat(seenClient[0]).isEqualTo("DEALER-1");
    }
}
