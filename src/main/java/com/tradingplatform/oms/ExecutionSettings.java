package com.tradingplatform.oms;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Resubmission policy of the execution engine. */
@Value
@Builder
public class ExecutionSettings {

    /** Hard cap on placement attempts per order, independent of the classifier's budget. */
    @Builder.Default
    int maxSubmitAttempts = 4;

    @Builder.Default
    Duration backoffInitial = Duration.ofMillis(200);

    @Builder.Default
    double backoffMultiplier = 2.0;

    /** Jitter applied to each backoff interval, as a fraction of it. */
    @Builder.Default
    double backoffRandomization = 0.5;

    public static ExecutionSettings defaults() {
        return builder().build();
    }
}
