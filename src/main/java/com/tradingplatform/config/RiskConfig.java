package com.tradingplatform.config;

import com.tradingplatform.event.EventPublisherHelper;
import com.tradingplatform.resilience.ErrorClassifier;
import com.tradingplatform.risk.LoggingRiskManager;
import com.tradingplatform.risk.ProfileRiskManager;
import com.tradingplatform.risk.RiskManager;
import com.tradingplatform.risk.RiskProfileStore;
import com.tradingplatform.risk.RiskSettings;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Risk manager wiring. The exposed {@link RiskManager} is the profile-based manager
 * wrapped with logging and risk events.
 *
 * <p>Properties prefix: {@code tradingplatform.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskSettings riskSettings(
            @Value("${tradingplatform.risk.intraday-margin-rate:0.20}") BigDecimal intradayMarginRate,
            @Value("${tradingplatform.risk.delivery-margin-rate:1.00}") BigDecimal deliveryMarginRate,
            @Value("${tradingplatform.risk.rate-window:60s}") Duration rateWindow) {
        return RiskSettings.builder()
                .intradayMarginRate(intradayMarginRate)
                .deliveryMarginRate(deliveryMarginRate)
                .rateWindow(rateWindow)
                .build();
    }

    @Bean
    public RiskProfileStore riskProfileStore(Clock clock) {
        return new RiskProfileStore(clock);
    }

    @Bean
    public RiskManager riskManager(
            RiskProfileStore riskProfileStore,
            RiskSettings riskSettings,
            Clock clock,
            ErrorClassifier errorClassifier,
            EventPublisherHelper eventPublisherHelper) {
        return new LoggingRiskManager(
                new ProfileRiskManager(riskProfileStore, riskSettings, clock), errorClassifier, eventPublisherHelper);
    }
}
