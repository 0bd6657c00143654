package com.tradingplatform.broker;

import com.tradingplatform.domain.enums.OrderStatus;
import com.tradingplatform.domain.model.Order;
import com.tradingplatform.domain.model.Position;
import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.exception.ErrorSeverity;
import com.tradingplatform.exception.ErrorType;
import com.tradingplatform.exception.OrderExecutionException;
import com.tradingplatform.resilience.CircuitBreakerManager;
import com.tradingplatform.resilience.ErrorClassifier;
import com.tradingplatform.resilience.RetryDecision;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves broker clients to live connectors and forwards trading operations to them.
 *
 * <p>Connectors are built lazily by the {@link BrokerConnectorFactory} from the registered
 * configuration and cached. The cache sits behind a read/write lock: lookups take the read
 * lock, and a miss re-checks under the write lock before building, so concurrent first use
 * of a client builds exactly one connector. Sessions ({@code userId → clientId}) are kept
 * behind a sibling lock and written only by login and logout.
 *
 * <p>Every connector call runs on the call executor with a deadline and is guarded by the
 * circuit breaker {@code broker:<clientId>}:
 * <ul>
 *   <li>an open breaker fails the call at once with CIRCUIT_OPEN, without a retry decision
 *       and without touching the retry budget</li>
 *   <li>a deadline overrun is a NETWORK TIMEOUT and counts as a breaker failure</li>
 *   <li>interruption of the calling thread cancels the call, returns the breaker permit and
 *       is not a breaker failure</li>
 *   <li>validation failures do not count against the breaker</li>
 *   <li>other failures count against the breaker and are classified by the
 *       {@link ErrorClassifier} under the call's operation id</li>
 * </ul>
 * The router never retries; callers receive a {@link BrokerCallResult} and decide.
 */
public class BrokerRouter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BrokerRouter.class);

    static final String SOURCE = "broker-router";
    static final String BREAKER_PREFIX = "broker:";

    private final BrokerConnectorFactory connectorFactory;
    private final CircuitBreakerManager circuitBreakerManager;
    private final ErrorClassifier errorClassifier;
    private final ExecutorService callExecutor;
    private final Duration defaultTimeout;

    private final ReentrantReadWriteLock clientLock = new ReentrantReadWriteLock();
    private final Map<String, BrokerConnector> connectors = new HashMap<>();
    private final Map<String, BrokerConfig> configs = new HashMap<>();

    private final ReentrantReadWriteLock sessionLock = new ReentrantReadWriteLock();
    private final Map<String, String> clientByUser = new HashMap<>();
    private final Map<String, BrokerSession> sessionsByUser = new HashMap<>();

    public BrokerRouter(
            BrokerConnectorFactory connectorFactory,
            CircuitBreakerManager circuitBreakerManager,
            ErrorClassifier errorClassifier,
            ExecutorService callExecutor,
            Duration defaultTimeout) {
        this.connectorFactory = connectorFactory;
        this.circuitBreakerManager = circuitBreakerManager;
        this.errorClassifier = errorClassifier;
        this.callExecutor = callExecutor;
        this.defaultTimeout = defaultTimeout;
    }

    // ========================
    // CLIENT REGISTRY
    // ========================

    /**
     * Registers (or replaces) the configuration of {@code clientId}. Replacing a configuration
     * discards the cached connector so the next use builds one from the new settings.
     */
    public void registerBroker(String clientId, BrokerConfig config) {
        if (clientId == null || clientId.isBlank()) {
            throw invalidParameter("client ID is required");
        }
        if (config == null) {
            throw invalidParameter("broker configuration is required");
        }
        BrokerConnector stale;
        clientLock.writeLock().lock();
        try {
            configs.put(clientId, config);
            stale = connectors.remove(clientId);
        } finally {
            clientLock.writeLock().unlock();
        }
        if (stale != null) {
            disconnectQuietly(clientId, stale);
        }
        log.info("Broker registered: client={} type={}", clientId, config.getBrokerType());
    }

    /** Returns the cached connector for {@code clientId}, building it on first use. */
    public BrokerConnector getBrokerClient(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            throw invalidParameter("client ID is required");
        }

        clientLock.readLock().lock();
        try {
            BrokerConnector cached = connectors.get(clientId);
            if (cached != null) {
                return cached;
            }
        } finally {
            clientLock.readLock().unlock();
        }

        clientLock.writeLock().lock();
        try {
            BrokerConnector cached = connectors.get(clientId);
            if (cached != null) {
                return cached;
            }
            BrokerConfig config = configs.get(clientId);
            if (config == null) {
                throw OrderExecutionException.validation(
                        ErrorCode.NOT_FOUND,
                        "no broker configuration found for client ID: " + clientId,
                        SOURCE);
            }
            BrokerConnector connector = connectorFactory.create(clientId, config);
            connectors.put(clientId, connector);
            log.info("Broker connector created for client {}", clientId);
            return connector;
        } finally {
            clientLock.writeLock().unlock();
        }
    }

    public String getClientIdForUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw invalidParameter("user ID is required");
        }
        sessionLock.readLock().lock();
        try {
            String clientId = clientByUser.get(userId);
            if (clientId == null) {
                throw OrderExecutionException.validation(
                        ErrorCode.NO_ACTIVE_SESSION, "no active session found for user ID: " + userId, SOURCE);
            }
            return clientId;
        } finally {
            sessionLock.readLock().unlock();
        }
    }

    public Optional<BrokerSession> getSession(String userId) {
        sessionLock.readLock().lock();
        try {
            return Optional.ofNullable(sessionsByUser.get(userId));
        } finally {
            sessionLock.readLock().unlock();
        }
    }

    public List<String> registeredClientIds() {
        clientLock.readLock().lock();
        try {
            return new ArrayList<>(configs.keySet());
        } finally {
            clientLock.readLock().unlock();
        }
    }

    public int activeSessionCount() {
        sessionLock.readLock().lock();
        try {
            return clientByUser.size();
        } finally {
            sessionLock.readLock().unlock();
        }
    }

    // ========================
    // SESSIONS
    // ========================

    /** Logs in through the client's connector and maps the session's user to the client. */
    public BrokerCallResult<BrokerSession> login(
            String clientId, BrokerCredentials credentials, BrokerCallContext context) {
        if (credentials == null) {
            return BrokerCallResult.failure(invalidParameter("credentials are required"), false);
        }
        BrokerCallResult<BrokerSession> result =
                callClient(clientId, "login", context, connector -> connector.login(credentials));
        if (result.isSuccess()) {
            BrokerSession session = result.getValue();
            String userId = session.getUserId() != null ? session.getUserId() : credentials.getUserId();
            sessionLock.writeLock().lock();
            try {
                clientByUser.put(userId, clientId);
                sessionsByUser.put(userId, session);
            } finally {
                sessionLock.writeLock().unlock();
            }
            log.info("Broker session opened: user={} client={}", userId, clientId);
        }
        return result;
    }

    /** Logs the client out and removes every session mapped to it. */
    public BrokerCallResult<Void> logout(String clientId, BrokerCallContext context) {
        BrokerCallResult<Void> result = callClient(clientId, "logout", context, connector -> {
            connector.logout();
            return null;
        });
        int removed;
        sessionLock.writeLock().lock();
        try {
            List<String> users = new ArrayList<>();
            clientByUser.forEach((user, client) -> {
                if (client.equals(clientId)) {
                    users.add(user);
                }
            });
            users.forEach(user -> {
                clientByUser.remove(user);
                sessionsByUser.remove(user);
            });
            removed = users.size();
        } finally {
            sessionLock.writeLock().unlock();
        }
        log.info("Broker sessions closed for client {} ({} users)", clientId, removed);
        return result;
    }

    // ========================
    // USER-SCOPED OPERATIONS
    // ========================

    public BrokerCallResult<String> placeOrder(String userId, Order order, BrokerCallContext context) {
        return callUser(userId, "placeOrder", context, connector -> connector.placeOrder(order));
    }

    public BrokerCallResult<Void> modifyOrder(
            String userId,
            String brokerOrderId,
            BigDecimal price,
            int quantity,
            BigDecimal triggerPrice,
            BrokerCallContext context) {
        return callUser(userId, "modifyOrder", context, connector -> {
            connector.modifyOrder(brokerOrderId, price, quantity, triggerPrice);
            return null;
        });
    }

    public BrokerCallResult<Void> cancelOrder(String userId, String brokerOrderId, BrokerCallContext context) {
        return callUser(userId, "cancelOrder", context, connector -> {
            connector.cancelOrder(brokerOrderId);
            return null;
        });
    }

    public BrokerCallResult<OrderStatus> getOrderStatus(
            String userId, String brokerOrderId, BrokerCallContext context) {
        return callUser(userId, "getOrderStatus", context, connector -> connector.getOrderStatus(brokerOrderId));
    }

    public BrokerCallResult<List<BrokerOrder>> getOrderBook(String userId, BrokerCallContext context) {
        return callUser(userId, "getOrderBook", context, BrokerConnector::getOrderBook);
    }

    public BrokerCallResult<List<Position>> getPositions(String userId, BrokerCallContext context) {
        return callUser(userId, "getPositions", context, BrokerConnector::getPositions);
    }

    public BrokerCallResult<List<Holding>> getHoldings(String userId, BrokerCallContext context) {
        return callUser(userId, "getHoldings", context, BrokerConnector::getHoldings);
    }

    public BrokerCallResult<Map<String, Quote>> getQuote(
            String userId, List<String> instruments, BrokerCallContext context) {
        return callUser(userId, "getQuote", context, connector -> connector.getQuote(instruments));
    }

    public BrokerCallResult<Void> subscribeQuotes(
            String userId, List<String> instruments, Consumer<Quote> listener, BrokerCallContext context) {
        return callUser(userId, "subscribeQuotes", context, connector -> {
            connector.subscribeQuotes(instruments, listener);
            return null;
        });
    }

    public BrokerCallResult<Void> unsubscribeQuotes(
            String userId, List<String> instruments, BrokerCallContext context) {
        return callUser(userId, "unsubscribeQuotes", context, connector -> {
            connector.unsubscribeQuotes(instruments);
            return null;
        });
    }

    // ========================
    // DEALER OPERATIONS
    // ========================

    /**
     * Places an order on behalf of {@code clientId}. Connectors without dealer support fall back
     * to a regular order on the logged-in account, stamped with the target client id. The
     * fallback is logged because it can hide a missing dealer entitlement.
     */
    public BrokerCallResult<String> placeDealerOrder(
            String userId, String clientId, Order order, BrokerCallContext context) {
        return callUser(userId, "placeDealerOrder", context, connector -> {
            Optional<DealerOperations> dealer = connector.dealerOperations();
            if (dealer.isPresent()) {
                return dealer.get().placeDealerOrder(clientId, order);
            }
            log.warn("Dealer operations unsupported by {}, placing order {} as a regular order for client {}",
                    connector.getClass().getSimpleName(), order.getId(), clientId);
            Order fallback = order.copy();
            fallback.setClientId(clientId);
            return connector.placeOrder(fallback);
        });
    }

    public BrokerCallResult<List<BrokerOrder>> getDealerOrderBook(
            String userId, String clientId, BrokerCallContext context) {
        return callUser(userId, "getDealerOrderBook", context,
                connector -> requireDealer(connector).getDealerOrderBook(clientId));
    }

    public BrokerCallResult<List<Position>> getDealerPositions(
            String userId, String clientId, BrokerCallContext context) {
        return callUser(userId, "getDealerPositions", context,
                connector -> requireDealer(connector).getDealerPositions(clientId));
    }

    // ========================
    // CALL PIPELINE
    // ========================

    private <T> BrokerCallResult<T> callUser(
            String userId, String operation, BrokerCallContext context, Function<BrokerConnector, T> call) {
        String clientId;
        try {
            clientId = getClientIdForUser(userId);
        } catch (OrderExecutionException e) {
            log.warn("Broker {} refused: {}", operation, e.getMessage());
            return BrokerCallResult.failure(e, false);
        }
        return callClient(clientId, operation, context, call);
    }

    private <T> BrokerCallResult<T> callClient(
            String clientId, String operation, BrokerCallContext context, Function<BrokerConnector, T> call) {
        BrokerCallContext ctx = context != null ? context : BrokerCallContext.oneOff(operation);

        BrokerConnector connector;
        try {
            connector = getBrokerClient(clientId);
        } catch (RuntimeException e) {
            return classifyFailure(ctx, errorClassifier.classify(e, SOURCE));
        }

        String breakerName = BREAKER_PREFIX + clientId;
        CircuitBreaker breaker = circuitBreakerManager.circuitBreaker(breakerName);
        if (!breaker.tryAcquirePermission()) {
            log.warn("Broker {} for client {} rejected: circuit open", operation, clientId);
            return BrokerCallResult.failure(circuitBreakerManager.openCircuitError(breakerName), false);
        }

        Duration timeout = resolveTimeout(clientId, ctx);
        long startedAt = breaker.getCurrentTimestamp();
        Future<T> future;
        try {
            future = callExecutor.submit(() -> call.apply(connector));
        } catch (RejectedExecutionException e) {
            breaker.releasePermission();
            return classifyFailure(ctx, OrderExecutionException.system("broker call executor saturated", e, SOURCE));
        }

        try {
            T value = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            circuitBreakerManager.recordSuccess(breaker, startedAt);
            return BrokerCallResult.success(value);
        } catch (TimeoutException e) {
            future.cancel(true);
            OrderExecutionException timedOut = OrderExecutionException.network(
                    ErrorCode.TIMEOUT,
                    String.format("broker %s timed out after %d ms", operation, timeout.toMillis()),
                    e,
                    SOURCE);
            circuitBreakerManager.recordFailure(breaker, startedAt, timedOut);
            return classifyFailure(ctx, timedOut);
        } catch (InterruptedException e) {
            future.cancel(true);
            breaker.releasePermission();
            Thread.currentThread().interrupt();
            return BrokerCallResult.failure(cancelled(operation, e), false);
        } catch (CancellationException e) {
            breaker.releasePermission();
            return BrokerCallResult.failure(cancelled(operation, e), false);
        } catch (ExecutionException e) {
            OrderExecutionException classified = errorClassifier.classify(e.getCause(), SOURCE);
            if (classified.isValidation()) {
                breaker.releasePermission();
            } else {
                circuitBreakerManager.recordFailure(breaker, startedAt, classified);
            }
            return classifyFailure(ctx, classified);
        }
    }

    private <T> BrokerCallResult<T> classifyFailure(BrokerCallContext context, OrderExecutionException error) {
        RetryDecision decision = errorClassifier.handleError(context.getOperationId(), error);
        return BrokerCallResult.failure(decision.getError(), decision.isShouldRetry());
    }

    private Duration resolveTimeout(String clientId, BrokerCallContext context) {
        if (context.getTimeout() != null) {
            return context.getTimeout();
        }
        clientLock.readLock().lock();
        try {
            BrokerConfig config = configs.get(clientId);
            if (config != null && config.getCallTimeout() != null) {
                return config.getCallTimeout();
            }
        } finally {
            clientLock.readLock().unlock();
        }
        return defaultTimeout;
    }

    private static DealerOperations requireDealer(BrokerConnector connector) {
        return connector.dealerOperations().orElseThrow(() -> OrderExecutionException.validation(
                ErrorCode.UNSUPPORTED_OPERATION, "dealer operations not supported by this broker", SOURCE));
    }

    private static OrderExecutionException cancelled(String operation, Throwable cause) {
        return new OrderExecutionException(
                ErrorType.EXECUTION,
                ErrorSeverity.INFO,
                ErrorCode.CANCELLED,
                "broker " + operation + " cancelled",
                cause,
                SOURCE,
                null);
    }

    private static OrderExecutionException invalidParameter(String message) {
        return OrderExecutionException.validation(ErrorCode.INVALID_PARAMETER, message, SOURCE);
    }

    private static void disconnectQuietly(String clientId, BrokerConnector connector) {
        try {
            connector.disconnect();
        } catch (RuntimeException e) {
            log.warn("Failed to disconnect connector for client {}: {}", clientId, e.getMessage());
        }
    }

    /** Disconnects every cached connector and forgets all sessions. */
    @Override
    public void close() {
        Map<String, BrokerConnector> snapshot;
        clientLock.writeLock().lock();
        try {
            snapshot = new HashMap<>(connectors);
            connectors.clear();
        } finally {
            clientLock.writeLock().unlock();
        }
        snapshot.forEach(BrokerRouter::disconnectQuietly);
        sessionLock.writeLock().lock();
        try {
            clientByUser.clear();
            sessionsByUser.clear();
        } finally {
            sessionLock.writeLock().unlock();
        }
    }
}
