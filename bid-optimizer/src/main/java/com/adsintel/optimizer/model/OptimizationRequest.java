package com.adsintel.optimizer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Everything one run needs. Dry-run travels with the request rather than living in global state.
 */
@Value
@Builder
public class OptimizationRequest {
    String campaignId;
    Strategy strategy;
    StrategyThresholds thresholds;
    int windowDays;
    boolean dryRun;
}
