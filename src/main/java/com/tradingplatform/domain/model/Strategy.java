package com.tradingplatform.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Strategy configuration relevant to order execution. Null limits are not enforced.
 */
@Data
@Builder
public class Strategy {

    private String id;
    private String name;
    private String userId;

    /** Risk profile applied to every order of this strategy. */
    private String riskProfileId;

    /** Maximum absolute net position per symbol. */
    private Integer maxPositionSize;

    /** Maximum quantity of a single order. */
    private Integer maxOrderQuantity;
}
