package com.tradingplatform.simulator;

import com.tradingplatform.broker.BrokerConnector;
import com.tradingplatform.broker.BrokerCredentials;
import com.tradingplatform.broker.BrokerOrder;
import com.tradingplatform.broker.BrokerSession;
import com.tradingplatform.broker.DealerOperations;
import com.tradingplatform.broker.Holding;
import com.tradingplatform.broker.Quote;
import com.tradingplatform.domain.enums.OrderSide;
import com.tradingplatform.domain.enums.OrderStatus;
import com.tradingplatform.domain.enums.OrderType;
import com.tradingplatform.domain.model.Order;
import com.tradingplatform.domain.model.Position;
import com.tradingplatform.exception.BrokerAuthenticationException;
import com.tradingplatform.exception.BrokerConnectionException;
import com.tradingplatform.exception.BrokerException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory simulated venue for paper trading and tests.
 *
 * <p>MARKET orders fill immediately at the last known price (or the order's reference
 * price when none is known). LIMIT, SL and SL_M orders rest in the book and are matched
 * whenever {@link #updatePrice(String, BigDecimal)} moves the last price:
 * <ul>
 *   <li>LIMIT BUY fills when last price &lt;= limit, LIMIT SELL when last price &gt;= limit</li>
 *   <li>SL / SL_M BUY trigger when last price &gt;= trigger, SELL when last price &lt;= trigger</li>
 * </ul>
 *
 * <p>Supports dealer operations: orders placed for another client id are booked against
 * that client. Failures and latency can be injected to exercise the resilience layer.
 */
public class PaperBrokerConnector implements BrokerConnector, DealerOperations {

    private static final Logger log = LoggerFactory.getLogger(PaperBrokerConnector.class);

    private final String clientId;
    private final Clock clock;
    private final Object bookLock = new Object();

    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicReference<BrokerSession> session = new AtomicReference<>();

    /** All orders by venue order id, in placement order. Guarded by bookLock. */
    private final Map<String, BrokerOrder> orders = new LinkedHashMap<>();

    /** clientId → symbol → net position. Guarded by bookLock. */
    private final Map<String, Map<String, Position>> positions = new LinkedHashMap<>();

    private final Map<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<Quote>>> quoteListeners = new ConcurrentHashMap<>();

    private final AtomicInteger injectedFailures = new AtomicInteger();
    private final AtomicReference<RuntimeException> injectedFailure = new AtomicReference<>();
    private volatile Duration latency = Duration.ZERO;

    public PaperBrokerConnector(String clientId, Clock clock) {
        this.clientId = clientId;
        this.clock = clock;
    }

    // ---- Connection ----

    @Override
    public void connect() {
        connected.set(true);
        log.info("Paper venue connected for client {}", clientId);
    }

    @Override
    public void disconnect() {
        connected.set(false);
        session.set(null);
        log.info("Paper venue disconnected for client {}", clientId);
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public BrokerSession login(BrokerCredentials credentials) {
        simulateVenue();
        if (credentials.getUserId() == null || credentials.getUserId().isBlank()
                || credentials.getPassword() == null || credentials.getPassword().isBlank()) {
            throw new BrokerAuthenticationException("invalid credentials");
        }
        connected.set(true);
        BrokerSession opened = BrokerSession.builder()
                .userId(credentials.getUserId())
                .clientId(clientId)
                .token("PAPER-" + UUID.randomUUID())
                .loginTime(clock.instant())
                .build();
        session.set(opened);
        return opened;
    }

    @Override
    public void logout() {
        session.set(null);
    }

    // ---- Orders ----

    @Override
    public String placeOrder(Order order) {
        return book(order.getClientId() != null ? order.getClientId() : clientId, order);
    }

    @Override
    public void modifyOrder(String brokerOrderId, BigDecimal price, int quantity, BigDecimal triggerPrice) {
        simulateVenue();
        requireSession();
        synchronized (bookLock) {
            BrokerOrder existing = requireOrder(brokerOrderId);
            if (existing.getStatus() != OrderStatus.OPEN) {
                throw new BrokerException(String.format(
                        "Order %s cannot be modified in status %s", brokerOrderId, existing.getStatus()));
            }
            BrokerOrder modified = existing.toBuilder()
                    .price(price != null ? price : existing.getPrice())
                    .quantity(quantity > 0 ? quantity : existing.getQuantity())
                    .triggerPrice(triggerPrice != null ? triggerPrice : existing.getTriggerPrice())
                    .updatedAt(clock.instant())
                    .build();
            orders.put(brokerOrderId, modified);
            BigDecimal last = lastPrices.get(modified.getSymbol());
            if (last != null) {
                match(modified, last);
            }
        }
    }

    @Override
    public void cancelOrder(String brokerOrderId) {
        simulateVenue();
        requireSession();
        synchronized (bookLock) {
            BrokerOrder existing = requireOrder(brokerOrderId);
            if (existing.getStatus() != OrderStatus.OPEN) {
                throw new BrokerException(String.format(
                        "Order %s cannot be cancelled in status %s", brokerOrderId, existing.getStatus()));
            }
            orders.put(brokerOrderId, existing.toBuilder()
                    .status(OrderStatus.CANCELLED)
                    .updatedAt(clock.instant())
                    .build());
        }
    }

    @Override
    public OrderStatus getOrderStatus(String brokerOrderId) {
        simulateVenue();
        synchronized (bookLock) {
            return requireOrder(brokerOrderId).getStatus();
        }
    }

    @Override
    public List<BrokerOrder> getOrderBook() {
        return getDealerOrderBook(clientId);
    }

    // ---- Portfolio ----

    @Override
    public List<Position> getPositions() {
        return getDealerPositions(clientId);
    }

    @Override
    public List<Holding> getHoldings() {
        simulateVenue();
        return getDealerPositions(clientId).stream()
                .filter(position -> position.getQuantity() > 0)
                .map(position -> Holding.builder()
                        .symbol(position.getSymbol())
                        .exchange(position.getExchange())
                        .quantity(position.getQuantity())
                        .averagePrice(position.getAveragePrice())
                        .build())
                .collect(Collectors.toList());
    }

    // ---- Market data ----

    @Override
    public Map<String, Quote> getQuote(List<String> instruments) {
        simulateVenue();
        Map<String, Quote> quotes = new LinkedHashMap<>();
        for (String instrument : instruments) {
            BigDecimal last = lastPrices.get(instrument);
            if (last != null) {
                quotes.put(instrument, quoteOf(instrument, last));
            }
        }
        return quotes;
    }

    @Override
    public void subscribeQuotes(List<String> instruments, Consumer<Quote> listener) {
        simulateVenue();
        for (String instrument : instruments) {
            quoteListeners.computeIfAbsent(instrument, key -> new CopyOnWriteArrayList<>()).add(listener);
        }
    }

    @Override
    public void unsubscribeQuotes(List<String> instruments) {
        instruments.forEach(quoteListeners::remove);
    }

    // ---- Dealer ----

    @Override
    public Optional<DealerOperations> dealerOperations() {
        return Optional.of(this);
    }

    @Override
    public String placeDealerOrder(String targetClientId, Order order) {
        return book(targetClientId, order);
    }

    @Override
    public List<BrokerOrder> getDealerOrderBook(String targetClientId) {
        simulateVenue();
        synchronized (bookLock) {
            return orders.values().stream()
                    .filter(order -> targetClientId.equals(order.getClientId()))
                    .collect(Collectors.toList());
        }
    }

    @Override
    public List<Position> getDealerPositions(String targetClientId) {
        simulateVenue();
        synchronized (bookLock) {
            Map<String, Position> book = positions.get(targetClientId);
            return book == null ? new ArrayList<>() : new ArrayList<>(book.values());
        }
    }

    // ---- Simulation controls ----

    /** Sets the last price of {@code symbol}, matching resting orders and notifying quote subscribers. */
    public void updatePrice(String symbol, BigDecimal price) {
        lastPrices.put(symbol, price);
        synchronized (bookLock) {
            for (BrokerOrder order : new ArrayList<>(orders.values())) {
                if (order.getStatus() == OrderStatus.OPEN && symbol.equals(order.getSymbol())) {
                    match(order, price);
                }
            }
        }
        List<Consumer<Quote>> listeners = quoteListeners.get(symbol);
        if (listeners != null) {
            Quote quote = quoteOf(symbol, price);
            listeners.forEach(listener -> listener.accept(quote));
        }
    }

    /** The next {@code count} venue calls fail with {@code failure}. */
    public void injectFailures(int count, RuntimeException failure) {
        injectedFailure.set(failure);
        injectedFailures.set(count);
    }

    /** Every venue call sleeps for {@code latency} before running. */
    public void setLatency(Duration latency) {
        this.latency = latency;
    }

    public String getClientId() {
        return clientId;
    }

    // ---- Internals ----

    private String book(String accountId, Order order) {
        simulateVenue();
        requireSession();
        if (order.getQuantity() <= 0) {
            throw new BrokerException("Order quantity must be positive");
        }
        String brokerOrderId = "PAPER-" + UUID.randomUUID().toString().substring(0, 8);
        BrokerOrder booked = BrokerOrder.builder()
                .brokerOrderId(brokerOrderId)
                .clientId(accountId)
                .symbol(order.getSymbol())
                .exchange(order.getExchange())
                .side(order.getSide())
                .orderType(order.getOrderType() == null ? OrderType.MARKET : order.getOrderType())
                .quantity(order.getQuantity())
                .price(order.getPrice())
                .triggerPrice(order.getTriggerPrice())
                .status(OrderStatus.OPEN)
                .updatedAt(clock.instant())
                .build();

        synchronized (bookLock) {
            orders.put(brokerOrderId, booked);
            if (booked.getOrderType() == OrderType.MARKET) {
                BigDecimal fillPrice = lastPrices.getOrDefault(order.getSymbol(), order.getPrice());
                if (fillPrice == null) {
                    orders.put(brokerOrderId, booked.toBuilder()
                            .status(OrderStatus.REJECTED)
                            .message("No price available for " + order.getSymbol())
                            .build());
                    log.warn("Paper MARKET order rejected: no price for {}", order.getSymbol());
                    throw new BrokerException("No price available for " + order.getSymbol());
                }
                fill(booked, fillPrice);
            } else {
                BigDecimal last = lastPrices.get(order.getSymbol());
                if (last != null) {
                    match(booked, last);
                }
            }
        }
        log.debug("Paper order placed: {} {} {} qty={} @ {} [client={}]",
                brokerOrderId, order.getSide(), booked.getOrderType(), order.getQuantity(), order.getPrice(), accountId);
        return brokerOrderId;
    }

    // Caller holds bookLock
    private void match(BrokerOrder order, BigDecimal last) {
        BigDecimal fillPrice = null;
        boolean buy = order.getSide() == OrderSide.BUY;
        switch (order.getOrderType()) {
            case LIMIT:
                if (buy ? last.compareTo(order.getPrice()) <= 0 : last.compareTo(order.getPrice()) >= 0) {
                    fillPrice = order.getPrice();
                }
                break;
            case SL:
            case SL_M:
                if (order.getTriggerPrice() != null
                        && (buy ? last.compareTo(order.getTriggerPrice()) >= 0
                                : last.compareTo(order.getTriggerPrice()) <= 0)) {
                    fillPrice = order.getOrderType() == OrderType.SL && order.getPrice() != null ? order.getPrice() : last;
                }
                break;
            default:
                fillPrice = last;
        }
        if (fillPrice != null) {
            fill(order, fillPrice);
        }
    }

    // Caller holds bookLock
    private void fill(BrokerOrder order, BigDecimal price) {
        orders.put(order.getBrokerOrderId(), order.toBuilder()
                .status(OrderStatus.COMPLETED)
                .filledQuantity(order.getQuantity())
                .averagePrice(price)
                .updatedAt(clock.instant())
                .build());

        int signed = order.getSide().sign() * order.getQuantity();
        Map<String, Position> book = positions.computeIfAbsent(order.getClientId(), key -> new LinkedHashMap<>());
        Position existing = book.get(order.getSymbol());
        if (existing == null) {
            book.put(order.getSymbol(), Position.builder()
                    .portfolioId(order.getClientId())
                    .symbol(order.getSymbol())
                    .exchange(order.getExchange())
                    .quantity(signed)
                    .averagePrice(price)
                    .build());
        } else {
            int after = existing.getQuantity() + signed;
            BigDecimal average = existing.getAveragePrice();
            if (Math.abs(after) > Math.abs(existing.getQuantity()) && average != null
                    && Integer.signum(after) == Integer.signum(existing.getQuantity())) {
                average = average.multiply(BigDecimal.valueOf(Math.abs(existing.getQuantity())))
                        .add(price.multiply(BigDecimal.valueOf(order.getQuantity())))
                        .divide(BigDecimal.valueOf(Math.abs(after)), 4, RoundingMode.HALF_UP);
            } else if (Integer.signum(after) != Integer.signum(existing.getQuantity())) {
                average = after == 0 ? null : price;
            }
            book.put(order.getSymbol(), existing.toBuilder().quantity(after).averagePrice(average).build());
        }
        log.debug("Paper order filled: {} qty={} @ {}", order.getBrokerOrderId(), order.getQuantity(), price);
    }

    private BrokerOrder requireOrder(String brokerOrderId) {
        BrokerOrder order = orders.get(brokerOrderId);
        if (order == null) {
            throw new BrokerException("Order not found: " + brokerOrderId);
        }
        return order;
    }

    private void requireSession() {
        if (session.get() == null) {
            throw new BrokerAuthenticationException("no active paper session for client " + clientId);
        }
    }

    private Quote quoteOf(String symbol, BigDecimal last) {
        return Quote.builder()
                .symbol(symbol)
                .lastPrice(last)
                .bid(last)
                .ask(last)
                .timestamp(clock.instant())
                .build();
    }

    private void simulateVenue() {
        Duration delay = latency;
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BrokerConnectionException("paper venue call interrupted", e);
            }
        }
        if (injectedFailures.getAndUpdate(remaining -> Math.max(0, remaining - 1)) > 0) {
            throw injectedFailure.get();
        }
    }
}
