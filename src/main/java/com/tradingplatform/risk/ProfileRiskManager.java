package com.tradingplatform.risk;

import com.tradingplatform.domain.enums.OrderSide;
import com.tradingplatform.domain.enums.ProductType;
import com.tradingplatform.domain.model.Order;
import com.tradingplatform.domain.model.Portfolio;
import com.tradingplatform.domain.model.Position;
import com.tradingplatform.domain.model.Strategy;
import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.exception.OrderExecutionException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Risk manager that validates orders against the {@link RiskProfile} referenced by the
 * order's strategy.
 *
 * <p>Derived quantities per order:
 * <ul>
 *   <li>order value = price × quantity</li>
 *   <li>projected position = current net position ± quantity</li>
 *   <li>margin estimate = order value × product margin rate, zero for orders that only
 *       reduce an existing position</li>
 *   <li>projected gross exposure = portfolio gross exposure with the symbol's notional
 *       replaced by its projected notional</li>
 * </ul>
 *
 * <p>Limits are evaluated in {@link RiskLimitType} order; disabled limits are skipped and the
 * first breach ends validation. A strategy without a risk profile reference is validated
 * against its own parameters and margin only.
 */
public class ProfileRiskManager implements RiskManager {

    private static final Logger log = LoggerFactory.getLogger(ProfileRiskManager.class);

    static final String SOURCE = "risk-manager";

    private final RiskProfileStore profileStore;
    private final RiskSettings settings;
    private final Clock clock;

    /** portfolioId → symbol → position */
    private final Map<String, Map<String, Position>> positions = new ConcurrentHashMap<>();

    /** portfolioId → order timestamps inside the rate window, oldest first */
    private final Map<String, Deque<Instant>> orderHistory = new ConcurrentHashMap<>();

    public ProfileRiskManager(RiskProfileStore profileStore, RiskSettings settings, Clock clock) {
        this.profileStore = profileStore;
        this.settings = settings;
        this.clock = clock;
    }

    // ========================
    // VALIDATION
    // ========================

    @Override
    public void validateOrder(Order order, Portfolio portfolio, Strategy strategy) {
        checkOrderSanity(order);

        RiskProfile profile = resolveProfile(strategy, order);
        if (profile != null) {
            OrderMetrics metrics = computeMetrics(order, portfolio);
            for (RiskLimitType type : RiskLimitType.values()) {
                RiskLimit limit = profile.getLimit(type);
                if (limit != null && limit.isEnabled()) {
                    evaluate(limit, order, portfolio, metrics);
                }
            }
        }

        checkRiskParameters(order, strategy);
        checkMarginRequirements(order, portfolio);
        log.debug("Order {} passed risk validation [profile={}]", order.getId(), profile == null ? "none" : profile.getId());
    }

    @Override
    public void checkPositionLimits(Order order, Portfolio portfolio, Strategy strategy) {
        checkOrderSanity(order);
        RiskProfile profile = resolveProfile(strategy, order);
        if (profile != null) {
            RiskLimit limit = profile.getLimit(RiskLimitType.POSITION_SIZE);
            if (limit != null && limit.isEnabled()) {
                evaluate(limit, order, portfolio, computeMetrics(order, portfolio));
            }
        }
        checkStrategyPosition(order, strategy);
    }

    @Override
    public void checkMarginRequirements(Order order, Portfolio portfolio) {
        checkOrderSanity(order);
        if (portfolio == null || portfolio.getAvailableMargin() == null) {
            return;
        }
        BigDecimal required = computeMetrics(order, portfolio).marginRequired;
        if (required.compareTo(portfolio.getAvailableMargin()) > 0) {
            throw OrderExecutionException.validation(
                            ErrorCode.INSUFFICIENT_MARGIN,
                            String.format(
                                    "Insufficient margin: required %s exceeds available %s",
                                    money(required), money(portfolio.getAvailableMargin())),
                            SOURCE)
                    .withOrderId(order.getId());
        }
    }

    @Override
    public void checkRiskParameters(Order order, Strategy strategy) {
        checkOrderSanity(order);
        if (strategy == null) {
            return;
        }
        Integer maxOrderQuantity = strategy.getMaxOrderQuantity();
        if (maxOrderQuantity != null && order.getQuantity() > maxOrderQuantity) {
            throw OrderExecutionException.validation(
                            ErrorCode.POSITION_LIMIT_EXCEEDED,
                            String.format(
                                    "Order quantity %d exceeds strategy %s maximum of %d",
                                    order.getQuantity(), strategy.getId(), maxOrderQuantity),
                            SOURCE)
                    .withOrderId(order.getId());
        }
        checkStrategyPosition(order, strategy);
    }

    @Override
    public void checkRateLimits(Order order, Strategy strategy) {
        checkOrderSanity(order);
        RiskProfile profile = resolveProfile(strategy, order);
        if (profile == null) {
            return;
        }
        RiskLimit limit = profile.getLimit(RiskLimitType.ORDER_RATE);
        if (limit != null && limit.isEnabled()) {
            evaluate(limit, order, null, null);
        }
    }

    // ========================
    // PROFILES
    // ========================

    @Override
    public RiskProfile createRiskProfile(RiskProfile profile) {
        return profileStore.create(profile);
    }

    @Override
    public RiskProfile getRiskProfile(String profileId) {
        return profileStore.get(profileId);
    }

    @Override
    public RiskProfile updateRiskProfile(RiskProfile profile) {
        return profileStore.update(profile);
    }

    @Override
    public void deleteRiskProfile(String profileId) {
        profileStore.delete(profileId);
    }

    @Override
    public List<RiskProfile> listRiskProfiles() {
        return profileStore.list();
    }

    // ========================
    // POSITIONS & HISTORY
    // ========================

    @Override
    public void updatePosition(Position position) {
        if (position == null || position.getPortfolioId() == null || position.getSymbol() == null) {
            throw OrderExecutionException.validation(
                    ErrorCode.INVALID_PARAMETER, "Position requires portfolio ID and symbol", SOURCE);
        }
        positions
                .computeIfAbsent(position.getPortfolioId(), key -> new ConcurrentHashMap<>())
                .put(position.getSymbol(), position.toBuilder().build());
    }

    @Override
    public Optional<Position> getPosition(String portfolioId, String symbol) {
        if (portfolioId == null || symbol == null) {
            return Optional.empty();
        }
        Map<String, Position> book = positions.get(portfolioId);
        if (book == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(book.get(symbol)).map(position -> position.toBuilder().build());
    }

    @Override
    public List<Position> getPortfolioPositions(String portfolioId) {
        Map<String, Position> book = portfolioId == null ? null : positions.get(portfolioId);
        List<Position> result = new ArrayList<>();
        if (book != null) {
            book.values().forEach(position -> result.add(position.toBuilder().build()));
        }
        return result;
    }

    @Override
    public void recordFill(Order order, int quantity, BigDecimal price) {
        if (order.getPortfolioId() == null || quantity <= 0) {
            return;
        }
        int signed = order.getSide().sign() * quantity;
        positions
                .computeIfAbsent(order.getPortfolioId(), key -> new ConcurrentHashMap<>())
                .compute(order.getSymbol(), (symbol, existing) -> applyFill(order, existing, signed, price));
    }

    @Override
    public void recordOrder(Order order) {
        if (order.getPortfolioId() == null) {
            return;
        }
        Deque<Instant> history = orderHistory.computeIfAbsent(order.getPortfolioId(), key -> new ArrayDeque<>());
        synchronized (history) {
            Instant now = clock.instant();
            evictExpired(history, now);
            history.addLast(now);
        }
    }

    // ========================
    // LIMIT EVALUATION
    // ========================

    private void evaluate(RiskLimit limit, Order order, Portfolio portfolio, OrderMetrics metrics) {
        BigDecimal threshold = limit.getValue();
        String breach = null;

        switch (limit.getType()) {
            case ORDER_VALUE:
                if (metrics.orderValue.compareTo(threshold) > 0) {
                    breach = String.format(
                            "order value %s exceeds limit of %s", money(metrics.orderValue), money(threshold));
                }
                break;
            case POSITION_SIZE:
                if (BigDecimal.valueOf(Math.abs(metrics.projectedPosition)).compareTo(threshold) > 0) {
                    breach = String.format(
                            "position size %d exceeds limit of %s",
                            Math.abs(metrics.projectedPosition), threshold.stripTrailingZeros().toPlainString());
                }
                break;
            case MARGIN_UTILIZATION:
                BigDecimal capital = capitalOf(portfolio);
                if (capital != null) {
                    BigDecimal used = portfolio.getUsedMargin() == null ? BigDecimal.ZERO : portfolio.getUsedMargin();
                    BigDecimal utilization = ratio(used.add(metrics.marginRequired), capital);
                    if (utilization.compareTo(threshold) > 0) {
                        breach = String.format(
                                "margin utilization %s exceeds limit of %s", percent(utilization), percent(threshold));
                    }
                }
                break;
            case LEVERAGE:
                BigDecimal base = capitalOf(portfolio);
                if (base != null && metrics.increasesExposure) {
                    BigDecimal leverage = ratio(metrics.projectedGrossExposure, base);
                    if (leverage.compareTo(threshold) > 0) {
                        breach = String.format("leverage %s exceeds limit of %s", leverage, threshold);
                    }
                }
                break;
            case CONCENTRATION:
                if (metrics.increasesExposure && metrics.projectedGrossExposure.signum() > 0) {
                    BigDecimal share = ratio(metrics.projectedSymbolNotional, metrics.projectedGrossExposure);
                    if (share.compareTo(threshold) > 0) {
                        breach = String.format(
                                "concentration in %s of %s exceeds limit of %s",
                                order.getSymbol(), percent(share), percent(threshold));
                    }
                }
                break;
            case EXPOSURE:
                if (metrics.increasesExposure && metrics.projectedGrossExposure.compareTo(threshold) > 0) {
                    breach = String.format(
                            "gross exposure %s exceeds limit of %s",
                            money(metrics.projectedGrossExposure), money(threshold));
                }
                break;
            case DRAWDOWN:
                if (metrics.increasesExposure && portfolio != null) {
                    BigDecimal drawdown = drawdownOf(portfolio);
                    if (drawdown != null && drawdown.compareTo(threshold) > 0) {
                        breach = String.format(
                                "portfolio drawdown %s exceeds limit of %s", percent(drawdown), percent(threshold));
                    }
                }
                break;
            case ORDER_RATE:
                int recent = recentOrderCount(order.getPortfolioId());
                if (BigDecimal.valueOf(recent + 1L).compareTo(threshold) > 0) {
                    breach = String.format(
                            "order rate %d per %ds exceeds limit of %s",
                            recent + 1,
                            settings.getRateWindow().getSeconds(),
                            threshold.stripTrailingZeros().toPlainString());
                }
                break;
            default:
                log.warn("Unsupported risk limit type {} ignored", limit.getType());
        }

        if (breach != null) {
            String message = limit.getDescription() == null || limit.getDescription().isBlank()
                    ? breach
                    : limit.getDescription() + ": " + breach;
            throw new RiskLimitBreachException(limit.getType(), limit.getLevel(), message, order.getId());
        }
    }

    private void checkStrategyPosition(Order order, Strategy strategy) {
        if (strategy == null || strategy.getMaxPositionSize() == null) {
            return;
        }
        int projected = currentPosition(order) + order.getSide().sign() * order.getQuantity();
        if (Math.abs(projected) > strategy.getMaxPositionSize()) {
            throw OrderExecutionException.validation(
                            ErrorCode.POSITION_LIMIT_EXCEEDED,
                            String.format(
                                    "Position size %d exceeds strategy %s maximum of %d",
                                    Math.abs(projected), strategy.getId(), strategy.getMaxPositionSize()),
                            SOURCE)
                    .withOrderId(order.getId());
        }
    }

    private void checkOrderSanity(Order order) {
        if (order == null) {
            throw OrderExecutionException.validation(ErrorCode.INVALID_PARAMETER, "Order is required", SOURCE);
        }
        if (order.getSide() == null || order.getSymbol() == null || order.getSymbol().isBlank()) {
            throw invalidOrder(order, "Order requires symbol and side");
        }
        if (order.getQuantity() <= 0) {
            throw invalidOrder(order, String.format("Order quantity must be positive, got %d", order.getQuantity()));
        }
        if (order.getPrice() != null && order.getPrice().signum() < 0) {
            throw invalidOrder(order, "Order price cannot be negative");
        }
        if (order.getOrderType() != null && order.getOrderType().requiresPrice()
                && (order.getPrice() == null || order.getPrice().signum() == 0)) {
            throw invalidOrder(order, String.format("Price is required for %s orders", order.getOrderType()));
        }
    }

    private RiskProfile resolveProfile(Strategy strategy, Order order) {
        if (strategy == null || strategy.getRiskProfileId() == null || strategy.getRiskProfileId().isBlank()) {
            log.warn("No risk profile configured for order {} [strategy={}], profile limits skipped",
                    order.getId(), strategy == null ? null : strategy.getId());
            return null;
        }
        return profileStore.get(strategy.getRiskProfileId());
    }

    // ========================
    // DERIVED QUANTITIES
    // ========================

    private OrderMetrics computeMetrics(Order order, Portfolio portfolio) {
        int current = currentPosition(order);
        int projected = current + order.getSide().sign() * order.getQuantity();
        boolean increases = Math.abs(projected) > Math.abs(current);

        BigDecimal orderValue = order.value();
        BigDecimal marginRequired = increases
                ? orderValue.multiply(marginRate(order.getProductType())).setScale(2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;

        BigDecimal referencePrice = order.getPrice();
        Position position = getPosition(order.getPortfolioId(), order.getSymbol()).orElse(null);
        if (referencePrice == null && position != null) {
            referencePrice = position.getAveragePrice();
        }
        BigDecimal currentSymbolNotional = position == null ? BigDecimal.ZERO : position.notional();
        BigDecimal projectedSymbolNotional = referencePrice == null
                ? BigDecimal.ZERO
                : referencePrice.multiply(BigDecimal.valueOf(Math.abs(projected)));
        BigDecimal gross = grossExposure(order.getPortfolioId());
        BigDecimal projectedGross = gross.subtract(currentSymbolNotional).add(projectedSymbolNotional);

        return new OrderMetrics(orderValue, projected, marginRequired, increases, projectedSymbolNotional, projectedGross);
    }

    private int currentPosition(Order order) {
        return getPosition(order.getPortfolioId(), order.getSymbol())
                .map(Position::getQuantity)
                .orElse(0);
    }

    private BigDecimal grossExposure(String portfolioId) {
        Map<String, Position> book = portfolioId == null ? null : positions.get(portfolioId);
        if (book == null) {
            return BigDecimal.ZERO;
        }
        return book.values().stream().map(Position::notional).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private BigDecimal marginRate(ProductType productType) {
        return productType == ProductType.MIS ? settings.getIntradayMarginRate() : settings.getDeliveryMarginRate();
    }

    private int recentOrderCount(String portfolioId) {
        if (portfolioId == null) {
            return 0;
        }
        Deque<Instant> history = orderHistory.get(portfolioId);
        if (history == null) {
            return 0;
        }
        synchronized (history) {
            evictExpired(history, clock.instant());
            return history.size();
        }
    }

    private void evictExpired(Deque<Instant> history, Instant now) {
        Instant cutoff = now.minus(settings.getRateWindow());
        while (!history.isEmpty() && !history.peekFirst().isAfter(cutoff)) {
            history.pollFirst();
        }
    }

    private static Position applyFill(Order order, Position existing, int signed, BigDecimal price) {
        if (existing == null) {
            return Position.builder()
                    .portfolioId(order.getPortfolioId())
                    .symbol(order.getSymbol())
                    .exchange(order.getExchange())
                    .quantity(signed)
                    .averagePrice(price)
                    .build();
        }
        int before = existing.getQuantity();
        int after = before + signed;
        BigDecimal averagePrice = existing.getAveragePrice();
        if (after == 0) {
            averagePrice = null;
        } else if (before == 0 || Integer.signum(before) != Integer.signum(after)) {
            // Flat or flipped: the remainder was opened at the fill price
            averagePrice = price;
        } else if (Math.abs(after) > Math.abs(before) && price != null && averagePrice != null) {
            averagePrice = averagePrice
                    .multiply(BigDecimal.valueOf(Math.abs(before)))
                    .add(price.multiply(BigDecimal.valueOf(Math.abs(signed))))
                    .divide(BigDecimal.valueOf(Math.abs(after)), 4, RoundingMode.HALF_UP);
        }
        return existing.toBuilder().quantity(after).averagePrice(averagePrice).build();
    }

    private static BigDecimal capitalOf(Portfolio portfolio) {
        if (portfolio == null || portfolio.getCapital() == null || portfolio.getCapital().signum() <= 0) {
            return null;
        }
        return portfolio.getCapital();
    }

    private static BigDecimal drawdownOf(Portfolio portfolio) {
        BigDecimal peak = portfolio.getPeakValue();
        BigDecimal current = portfolio.getCurrentValue();
        if (peak == null || current == null || peak.signum() <= 0) {
            return null;
        }
        return ratio(peak.subtract(current), peak);
    }

    private static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        return numerator.divide(denominator, 4, RoundingMode.HALF_UP);
    }

    private static String money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String percent(BigDecimal fraction) {
        return fraction.multiply(BigDecimal.valueOf(100)).setScale(2, RoundingMode.HALF_UP).toPlainString() + "%";
    }

    private static OrderExecutionException invalidOrder(Order order, String message) {
        return OrderExecutionException.validation(ErrorCode.INVALID_ORDER, message, SOURCE).withOrderId(order.getId());
    }

    private static final class OrderMetrics {
        private final BigDecimal orderValue;
        private final int projectedPosition;
        private final BigDecimal marginRequired;
        private final boolean increasesExposure;
        private final BigDecimal projectedSymbolNotional;
        private final BigDecimal projectedGrossExposure;

        private OrderMetrics(
                BigDecimal orderValue,
                int projectedPosition,
                BigDecimal marginRequired,
                boolean increasesExposure,
                BigDecimal projectedSymbolNotional,
                BigDecimal projectedGrossExposure) {
            this.orderValue = orderValue;
            this.projectedPosition = projectedPosition;
            this.marginRequired = marginRequired;
            this.increasesExposure = increasesExposure;
            this.projectedSymbolNotional = projectedSymbolNotional;
            this.projectedGrossExposure = projectedGrossExposure;
        }
    }
}
