package com.tradingplatform.risk;

import com.tradingplatform.domain.model.Order;
import com.tradingplatform.domain.model.Portfolio;
import com.tradingplatform.domain.model.Position;
import com.tradingplatform.domain.model.Strategy;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Pre-trade risk validation and the profile and position bookkeeping it depends on.
 *
 * <p>Every check returns normally when the order passes and throws a Validation-class
 * {@link com.tradingplatform.exception.OrderExecutionException} describing the first breach.
 */
public interface RiskManager {

    /**
     * Runs every check against the order: basic sanity, each enabled limit of the strategy's
     * risk profile, the strategy's own parameters and the margin requirement.
     */
    void validateOrder(Order order, Portfolio portfolio, Strategy strategy);

    /** POSITION_SIZE limit of the strategy's profile and the strategy's maximum position. */
    void checkPositionLimits(Order order, Portfolio portfolio, Strategy strategy);

    /** Free margin of the portfolio against the order's margin estimate. */
    void checkMarginRequirements(Order order, Portfolio portfolio);

    /** Strategy-level parameters: maximum order quantity and maximum position. */
    void checkRiskParameters(Order order, Strategy strategy);

    /** ORDER_RATE limit of the strategy's profile. */
    void checkRateLimits(Order order, Strategy strategy);

    // ---- Profiles ----

    RiskProfile createRiskProfile(RiskProfile profile);

    RiskProfile getRiskProfile(String profileId);

    RiskProfile updateRiskProfile(RiskProfile profile);

    void deleteRiskProfile(String profileId);

    List<RiskProfile> listRiskProfiles();

    // ---- Positions and order history ----

    void updatePosition(Position position);

    Optional<Position> getPosition(String portfolioId, String symbol);

    List<Position> getPortfolioPositions(String portfolioId);

    /** Applies a fill of {@code quantity} at {@code price} to the order's position. */
    void recordFill(Order order, int quantity, BigDecimal price);

    /** Counts the order against its portfolio's order-rate window. */
    void recordOrder(Order order);
}
