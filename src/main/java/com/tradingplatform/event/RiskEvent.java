package com.tradingplatform.event;

import com.tradingplatform.risk.RiskLevel;
import java.util.Map;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * A pre-trade check rejected an order. Details hold {@code orderId}, {@code portfolioId} and,
 * for profile limits, {@code limitType}; absent keys were unknown at rejection time.
 */
@Getter
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public String getOrderId() {
        return (String) details.get("orderId");
    }
}
