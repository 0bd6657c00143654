package com.tradingplatform.broker;

import com.tradingplatform.domain.enums.OrderStatus;
import com.tradingplatform.domain.model.Order;
import com.tradingplatform.domain.model.Position;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Trading operations of a single brokerage venue, independent of its wire protocol.
 *
 * <p>Implementations report failures with {@link com.tradingplatform.exception.BrokerException}
 * (venue rejected the operation), {@link com.tradingplatform.exception.BrokerConnectionException}
 * (venue unreachable) or {@link com.tradingplatform.exception.BrokerAuthenticationException}.
 * Calls may block; the {@link BrokerRouter} enforces deadlines around them.
 */
public interface BrokerConnector {

    // ---- Connection ----

    void connect();

    void disconnect();

    boolean isConnected();

    /**
     * Authenticates against the venue.
     *
     * @return the session, whose {@code userId} the router maps to this connector's client
     * @throws com.tradingplatform.exception.BrokerAuthenticationException if credentials are rejected
     */
    BrokerSession login(BrokerCredentials credentials);

    void logout();

    // ---- Orders ----

    /**
     * Places a new order.
     *
     * @return the venue order id
     * @throws com.tradingplatform.exception.BrokerException if the order is rejected
     */
    String placeOrder(Order order);

    void modifyOrder(String brokerOrderId, BigDecimal price, int quantity, BigDecimal triggerPrice);

    void cancelOrder(String brokerOrderId);

    OrderStatus getOrderStatus(String brokerOrderId);

    List<BrokerOrder> getOrderBook();

    // ---- Portfolio ----

    List<Position> getPositions();

    List<Holding> getHoldings();

    // ---- Market data ----

    /** Latest quotes keyed by instrument. Unknown instruments are omitted. */
    Map<String, Quote> getQuote(List<String> instruments);

    void subscribeQuotes(List<String> instruments, Consumer<Quote> listener);

    void unsubscribeQuotes(List<String> instruments);

    // ---- Capabilities ----

    /** Dealer operations, when the venue supports them. */
    default Optional<DealerOperations> dealerOperations() {
        return Optional.empty();
    }
}
