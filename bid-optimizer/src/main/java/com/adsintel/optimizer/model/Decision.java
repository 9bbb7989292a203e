package com.adsintel.optimizer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Decision {

    ResolvedKeyword keyword;
    BidAction action;

    /** Human-readable justification, shown as-is in reports */
    String reason;

    KeywordStatsSnapshot stats;
}
