package com.tradingplatform.risk;

import com.tradingplatform.domain.model.Order;
import com.tradingplatform.domain.model.Portfolio;
import com.tradingplatform.domain.model.Position;
import com.tradingplatform.domain.model.Strategy;
import com.tradingplatform.event.EventPublisherHelper;
import com.tradingplatform.event.RiskEventType;
import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.exception.OrderExecutionException;
import com.tradingplatform.resilience.ErrorClassifier;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorates a {@link RiskManager} with structured logging and risk events.
 *
 * <p>Breaches pass through unchanged after being logged and published as a
 * {@link com.tradingplatform.event.RiskEvent}. Unexpected failures of the delegate are
 * classified by the {@link ErrorClassifier} and rethrown as that classification, so an
 * order that could not be validated still fails.
 */
public class LoggingRiskManager implements RiskManager {

    private static final Logger log = LoggerFactory.getLogger(LoggingRiskManager.class);

    private final RiskManager delegate;
    private final ErrorClassifier errorClassifier;
    private final EventPublisherHelper eventPublisherHelper;

    public LoggingRiskManager(
            RiskManager delegate, ErrorClassifier errorClassifier, EventPublisherHelper eventPublisherHelper) {
        this.delegate = delegate;
        this.errorClassifier = errorClassifier;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Override
    public void validateOrder(Order order, Portfolio portfolio, Strategy strategy) {
        guarded("validateOrder", order, portfolio, () -> {
            delegate.validateOrder(order, portfolio, strategy);
            return null;
        });
        log.info("Risk validation passed: order={} symbol={} qty={} value={}",
                order.getId(), order.getSymbol(), order.getQuantity(), order.value());
    }

    @Override
    public void checkPositionLimits(Order order, Portfolio portfolio, Strategy strategy) {
        guarded("checkPositionLimits", order, portfolio, () -> {
            delegate.checkPositionLimits(order, portfolio, strategy);
            return null;
        });
    }

    @Override
    public void checkMarginRequirements(Order order, Portfolio portfolio) {
        guarded("checkMarginRequirements", order, portfolio, () -> {
            delegate.checkMarginRequirements(order, portfolio);
            return null;
        });
    }

    @Override
    public void checkRiskParameters(Order order, Strategy strategy) {
        guarded("checkRiskParameters", order, null, () -> {
            delegate.checkRiskParameters(order, strategy);
            return null;
        });
    }

    @Override
    public void checkRateLimits(Order order, Strategy strategy) {
        guarded("checkRateLimits", order, null, () -> {
            delegate.checkRateLimits(order, strategy);
            return null;
        });
    }

    @Override
    public RiskProfile createRiskProfile(RiskProfile profile) {
        return delegate.createRiskProfile(profile);
    }

    @Override
    public RiskProfile getRiskProfile(String profileId) {
        return delegate.getRiskProfile(profileId);
    }

    @Override
    public RiskProfile updateRiskProfile(RiskProfile profile) {
        return delegate.updateRiskProfile(profile);
    }

    @Override
    public void deleteRiskProfile(String profileId) {
        delegate.deleteRiskProfile(profileId);
    }

    @Override
    public List<RiskProfile> listRiskProfiles() {
        return delegate.listRiskProfiles();
    }

    @Override
    public void updatePosition(Position position) {
        delegate.updatePosition(position);
    }

    @Override
    public Optional<Position> getPosition(String portfolioId, String symbol) {
        return delegate.getPosition(portfolioId, symbol);
    }

    @Override
    public List<Position> getPortfolioPositions(String portfolioId) {
        return delegate.getPortfolioPositions(portfolioId);
    }

    @Override
    public void recordFill(Order order, int quantity, BigDecimal price) {
        delegate.recordFill(order, quantity, price);
    }

    @Override
    public void recordOrder(Order order) {
        delegate.recordOrder(order);
    }

    private <T> T guarded(String operation, Order order, Portfolio portfolio, Supplier<T> check) {
        String orderId = order == null ? null : order.getId();
        try {
            return check.get();
        } catch (OrderExecutionException e) {
            if (e.isValidation()) {
                log.warn("Risk check {} rejected order {}: {} [code={}]", operation, orderId, e.getMessage(), e.getErrorCode());
                publishBreach(e, orderId, portfolio);
            }
            throw e;
        } catch (RuntimeException e) {
            OrderExecutionException classified = errorClassifier.classify(e, ProfileRiskManager.SOURCE);
            errorClassifier.handleError("risk:" + operation + ":" + orderId, classified);
            log.error("Risk check {} failed unexpectedly for order {}", operation, orderId, e);
            publish(RiskEventType.VALIDATION_FAILURE, RiskLevel.HIGH, "risk validation failed", orderId, portfolio, null);
            throw classified.withOrderId(orderId);
        }
    }

    private void publishBreach(OrderExecutionException e, String orderId, Portfolio portfolio) {
        if (e instanceof RiskLimitBreachException) {
            RiskLimitBreachException breach = (RiskLimitBreachException) e;
            RiskEventType type = breach.getLimitType() == RiskLimitType.ORDER_RATE
                    ? RiskEventType.RATE_LIMIT_BREACH
                    : RiskEventType.LIMIT_BREACH;
            publish(type, breach.getLevel(), e.getMessage(), orderId, portfolio, breach.getLimitType());
        } else if (e.hasCode(ErrorCode.INSUFFICIENT_MARGIN)) {
            publish(RiskEventType.INSUFFICIENT_MARGIN, RiskLevel.MEDIUM, e.getMessage(), orderId, portfolio, null);
        } else if (e.hasCode(ErrorCode.POSITION_LIMIT_EXCEEDED)) {
            publish(RiskEventType.STRATEGY_PARAMETER_BREACH, RiskLevel.MEDIUM, e.getMessage(), orderId, portfolio, null);
        }
    }

    private void publish(
            RiskEventType type,
            RiskLevel level,
            String message,
            String orderId,
            Portfolio portfolio,
            RiskLimitType limitType) {
        Map<String, Object> details = new HashMap<>();
        if (orderId != null) {
            details.put("orderId", orderId);
        }
        if (portfolio != null && portfolio.getId() != null) {
            details.put("portfolioId", portfolio.getId());
        }
        if (limitType != null) {
            details.put("limitType", limitType.name());
        }
        eventPublisherHelper.publishRiskEvent(this, type, level, message, details);
    }
}
