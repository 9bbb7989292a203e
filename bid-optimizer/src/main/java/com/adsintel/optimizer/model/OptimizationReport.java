package com.adsintel.optimizer.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Structure handed to the report sink. One row per keyword known to the run.
 */
@Value
@Builder
public class OptimizationReport {

    String runId;
    String campaignId;
    Strategy strategy;
    int windowDays;
    boolean dryRun;
    String status;
    String errorMessage;
    LocalDateTime generatedAt;
    List<Row> rows;

    @Value
    @Builder
    public static class Row {
        String keyword;
        String keywordKind;
        BidAction action;
        String reason;
        long clicks;
        BigDecimal cost;
        long conversionCount;
        BigDecimal conversionValue;
        BigDecimal averageCostPerClick;
        BigDecimal currentBid;      // null when no bid change was proposed
        BigDecimal newBid;
        String applyStatus;
        String applyMessage;
    }
}
