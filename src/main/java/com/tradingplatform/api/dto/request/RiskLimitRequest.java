package com.tradingplatform.api.dto.request;

import com.tradingplatform.risk.RiskLevel;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** One limit entry of a {@link RiskProfileRequest}. Level defaults to MEDIUM, enabled to true. */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class RiskLimitRequest {

    @NotNull(message = "Limit value is required")
    @PositiveOrZero(message = "Limit value cannot be negative")
    private BigDecimal value;

    private RiskLevel level;

    private String description;

    private Boolean enabled;
}
