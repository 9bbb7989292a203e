package com.adsintel.optimizer.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One landing event from the click log.
 */
@Value
@Builder
public class TrafficRecord {

    /** Landing URL, carries gclid / gbraid when the click came from Ads */
    String destinationUrl;

    /** Null when the log has no cost for the click */
    BigDecimal cost;

    /** Free-form outcome tag, e.g. "registr" or "none" */
    String conversionKind;

    /** True when the log marks the click as coming from the paid channel */
    @Builder.Default
    boolean paidChannel = true;

    LocalDateTime timestamp;

    public BigDecimal costOrZero() {
        if (cost == null || cost.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return cost;
    }
}
