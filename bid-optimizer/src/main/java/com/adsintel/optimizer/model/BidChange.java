package com.adsintel.optimizer.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Per-keyword result of turning a decision into a bid.
 */
@Value
@Builder
public class BidChange {

    ResolvedKeyword keyword;
    Long criterionId;       // null when the keyword has no enabled criterion
    BigDecimal currentBid;
    BigDecimal newBid;      // already clamped
    ApplyStatus status;
    String message;

    public enum ApplyStatus {
        DRY_RUN, APPLIED, FAILED, NO_CRITERION
    }
}
