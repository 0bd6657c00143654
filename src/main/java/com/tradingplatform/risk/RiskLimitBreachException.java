package com.tradingplatform.risk;

import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.exception.ErrorSeverity;
import com.tradingplatform.exception.ErrorType;
import com.tradingplatform.exception.OrderExecutionException;
import lombok.Getter;

/** Validation failure raised when an order breaches an enabled profile limit. */
@Getter
public class RiskLimitBreachException extends OrderExecutionException {

    private final RiskLimitType limitType;
    private final RiskLevel level;

    public RiskLimitBreachException(RiskLimitType limitType, RiskLevel level, String message, String orderId) {
        super(ErrorType.VALIDATION, ErrorSeverity.WARNING, ErrorCode.INVALID_ORDER, message, null,
                ProfileRiskManager.SOURCE, orderId);
        this.limitType = limitType;
        this.level = level;
    }
}
