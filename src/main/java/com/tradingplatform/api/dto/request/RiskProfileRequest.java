package com.tradingplatform.api.dto.request;

import com.tradingplatform.risk.RiskLevel;
import com.tradingplatform.risk.RiskLimit;
import com.tradingplatform.risk.RiskLimitType;
import com.tradingplatform.risk.RiskProfile;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.EnumMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Request body for creating or replacing a risk profile. Limits are keyed by
 * {@link RiskLimitType} name, e.g. {@code {"ORDER_VALUE": {"value": 10000}}}.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class RiskProfileRequest {

    @NotBlank(message = "Profile ID is required")
    private String id;

    @NotBlank(message = "Profile name is required")
    private String name;

    private String description;

    private Map<RiskLimitType, @Valid RiskLimitRequest> limits;

    public RiskProfile toProfile() {
        Map<RiskLimitType, RiskLimit> converted = new EnumMap<>(RiskLimitType.class);
        if (limits != null) {
            limits.forEach((type, limit) -> converted.put(type, toLimit(type, limit)));
        }
        return RiskProfile.builder()
                .id(id)
                .name(name)
                .description(description)
                .limits(converted)
                .build();
    }

    private static RiskLimit toLimit(RiskLimitType type, RiskLimitRequest request) {
        return RiskLimit.builder()
                .type(type)
                .value(request.getValue())
                .level(request.getLevel() != null ? request.getLevel() : RiskLevel.MEDIUM)
                .description(request.getDescription())
                .enabled(request.getEnabled() == null || request.getEnabled())
                .build();
    }
}
