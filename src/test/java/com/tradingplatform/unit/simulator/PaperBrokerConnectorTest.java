package com.tradingplatform.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradingplatform.broker.BrokerCredentials;
import com.tradingplatform.broker.BrokerOrder;
import com.tradingplatform.broker.BrokerSession;
import com.tradingplatform.broker.Quote;
import com.tradingplatform.domain.enums.OrderSide;
import com.tradingplatform.domain.enums.OrderStatus;
import com.tradingplatform.domain.enums.OrderType;
import com.tradingplatform.domain.model.Order;
import com.tradingplatform.domain.model.Position;
import com.tradingplatform.exception.BrokerAuthenticationException;
import com.tradingplatform.exception.BrokerConnectionException;
import com.tradingplatform.exception.BrokerException;
import com.tradingplatform.simulator.PaperBrokerConnector;
import com.tradingplatform.unit.MutableClock;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PaperBrokerConnectorTest {

    private PaperBrokerConnector venue;

    @BeforeEach
    void setUp() {
        venue = new PaperBrokerConnector("C-1", MutableClock.startingAt("2024-03-01T09:15:00Z"));
        venue.login(BrokerCredentials.builder().userId("U-1").password("pw").build());
    }

    private static Order order(OrderSide side, OrderType type, int quantity, String price, String trigger) {
        return Order.builder()
                .id("ORD-" + side + quantity)
                .symbol("INFY")
                .exchange("NSE")
                .side(side)
                .orderType(type)
                .quantity(quantity)
                .price(price == null ? null : new BigDecimal(price))
                .triggerPrice(trigger == null ? null : new BigDecimal(trigger))
                .build();
    }

    private Position position(String symbol) {
        return venue.getPositions().stream()
                .filter(p -> p.getSymbol().equals(symbol))
                .findFirst()
                .orElseThrow();
    }

    @Nested
    @DisplayName("Sessions")
    class Sessions {

        @Test
        @DisplayName("Login opens a session bound to the connector's client")
        void login() {
            BrokerSession session = venue.login(BrokerCredentials.builder().userId("U-2").password("pw").build());

            assertThat(session.getClientId()).isEqualTo("C-1");
            assertThat(session.getUserId()).isEqualTo("U-2");
            assertThat(session.getToken()).startsWith("PAPER-");
            assertThat(venue.isConnected()).isTrue();
        }

        @Test
        @DisplayName("Blank credentials are refused")
        void invalidCredentials() {
            assertThatThrownBy(() -> venue.login(BrokerCredentials.builder().userId("U-1").build()))
                    .isInstanceOf(BrokerAuthenticationException.class)
                    .hasMessage("invalid credentials");
        }

        @Test
        @DisplayName("Trading after logout requires a new session")
        void tradingAfterLogout() {
            venue.logout();

            assertThatThrownBy(() -> venue.placeOrder(order(OrderSide.BUY, OrderType.MARKET, 1, "100", null)))
                    .isInstanceOf(BrokerAuthenticationException.class)
                    .hasMessage("no active paper session for client C-1");
        }
    }

    @Nested
    @DisplayName("Matching")
    class Matching {

        @Test
        @DisplayName("MARKET order fills at the last price")
        void marketFillsAtLast() {
            venue.updatePrice("INFY", new BigDecimal("1500"));

            String id = venue.placeOrder(order(OrderSide.BUY, OrderType.MARKET, 10, "1490", null));

            assertThat(venue.getOrderStatus(id)).isEqualTo(OrderStatus.COMPLETED);
            assertThat(position("INFY").getQuantity()).isEqualTo(10);
            assertThat(position("INFY").getAveragePrice()).isEqualByComparingTo("1500");
        }

        @Test
        @DisplayName("MARKET order without any price is rejected")
        void marketWithoutPrice() {
            assertThatThrownBy(() -> venue.placeOrder(order(OrderSide.BUY, OrderType.MARKET, 10, null, null)))
                    .isInstanceOf(BrokerException.class)
                    .hasMessage("No price available for INFY");
            assertThat(venue.getOrderBook()).extracting(BrokerOrder::getStatus).containsExactly(OrderStatus.REJECTED);
        }

        @Test
        @DisplayName("LIMIT BUY rests until the price reaches the limit")
        void limitBuyRests() {
            venue.updatePrice("INFY", new BigDecimal("1500"));
            String id = venue.placeOrder(order(OrderSide.BUY, OrderType.LIMIT, 5, "1480", null));
            assertThat(venue.getOrderStatus(id)).isEqualTo(OrderStatus.OPEN);

            venue.updatePrice("INFY", new BigDecimal("1485"));
            assertThat(venue.getOrderStatus(id)).isEqualTo(OrderStatus.OPEN);

            venue.updatePrice("INFY", new BigDecimal("1479"));
            assertThat(venue.getOrderStatus(id)).isEqualTo(OrderStatus.COMPLETED);
            assertThat(position("INFY").getAveragePrice()).isEqualByComparingTo("1480");
        }

        @Test
        @DisplayName("SL_M SELL triggers when the price falls through the trigger")
        void stopLossSell() {
            venue.updatePrice("INFY", new BigDecimal("1500"));
            venue.placeOrder(order(OrderSide.BUY, OrderType.MARKET, 10, null, null));
            String stop = venue.placeOrder(order(OrderSide.SELL, OrderType.SL_M, 10, null, "1450"));

            venue.updatePrice("INFY", new BigDecimal("1449"));

            assertThat(venue.getOrderStatus(stop)).isEqualTo(OrderStatus.COMPLETED);
            assertThat(position("INFY").getQuantity()).isZero();
            assertThat(position("INFY").getAveragePrice()).isNull();
        }

        @Test
        @DisplayName("Adding to a position averages the entry price")
        void averaging() {
            venue.updatePrice("INFY", new BigDecimal("100"));
            venue.placeOrder(order(OrderSide.BUY, OrderType.MARKET, 10, null, null));
            venue.updatePrice("INFY", new BigDecimal("110"));
            venue.placeOrder(order(OrderSide.BUY, OrderType.MARKET, 10, null, null));

            assertThat(position("INFY").getQuantity()).isEqualTo(20);
            assertThat(position("INFY").getAveragePrice()).isEqualByComparingTo("105");
            assertThat(venue.getHoldings()).singleElement().satisfies(h -> assertThat(h.getQuantity()).isEqualTo(20));
        }
    }

    @Nested
    @DisplayName("Modify and cancel")
    class ModifyCancel {

        @Test
        @DisplayName("Modifying a resting order can make it marketable")
        void modifyToMarketable() {
            venue.updatePrice("INFY", new BigDecimal("1500"));
            String id = venue.placeOrder(order(OrderSide.BUY, OrderType.LIMIT, 5, "1400", null));

            venue.modifyOrder(id, new BigDecimal("1500"), 0, null);

            assertThat(venue.getOrderStatus(id)).isEqualTo(OrderStatus.COMPLETED);
        }

        @Test
        @DisplayName("Only open orders can be cancelled")
        void cancel() {
            venue.updatePrice("INFY", new BigDecimal("1500"));
            String resting = venue.placeOrder(order(OrderSide.BUY, OrderType.LIMIT, 5, "1400", null));
            String filled = venue.placeOrder(order(OrderSide.BUY, OrderType.MARKET, 5, null, null));

            venue.cancelOrder(resting);

            assertThat(venue.getOrderStatus(resting)).isEqualTo(OrderStatus.CANCELLED);
            assertThatThrownBy(() -> venue.cancelOrder(filled))
                    .hasMessage("Order " + filled + " cannot be cancelled in status COMPLETED");
            assertThatThrownBy(() -> venue.cancelOrder("PAPER-missing")).hasMessage("Order not found: PAPER-missing");
        }
    }

    @Test
    @DisplayName("Dealer orders are booked against the target client")
    void dealerBooking() {
        venue.updatePrice("INFY", new BigDecimal("1500"));

        venue.dealerOperations().orElseThrow()
                .placeDealerOrder("CLIENT-77", order(OrderSide.BUY, OrderType.MARKET, 3, null, null));

        assertThat(venue.getDealerOrderBook("CLIENT-77")).hasSize(1);
        assertThat(venue.getDealerPositions("CLIENT-77")).singleElement()
                .satisfies(p -> assertThat(p.getQuantity()).isEqualTo(3));
        assertThat(venue.getOrderBook()).isEmpty();
    }

    @Test
    @DisplayName("Quote subscribers see price updates")
    void quotes() {
        List<Quote> seen = new ArrayList<>();
        venue.subscribeQuotes(List.of("INFY"), seen::add);

        venue.updatePrice("INFY", new BigDecimal("1510"));
        venue.unsubscribeQuotes(List.of("INFY"));
        venue.updatePrice("INFY", new BigDecimal("1520"));

        assertThat(seen).extracting(Quote::getLastPrice).containsExactly(new BigDecimal("1510"));
        assertThat(venue.getQuote(List.of("INFY", "TCS"))).containsOnlyKeys("INFY");
    }

    @Test
    @DisplayName("Injected failures affect exactly the next calls")
    void injectedFailures() {
        venue.updatePrice("INFY", new BigDecimal("1500"));
        venue.injectFailures(2, new BrokerConnectionException("venue down"));

        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> venue.placeOrder(order(OrderSide.BUY, OrderType.MARKET, 1, null, null)))
                    .isInstanceOf(BrokerConnectionException.class);
        }
        assertThat(venue.placeOrder(order(OrderSide.BUY, OrderType.MARKET, 1, null, null))).startsWith("PAPER-");
    }
}
