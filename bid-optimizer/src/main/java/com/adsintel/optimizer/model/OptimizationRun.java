package com.adsintel.optimizer.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State of one optimisation run, handed to the report sink when the run ends.
 */
@Data
@Builder
public class OptimizationRun {

    private String runId;           // UUID
    private String campaignId;
    private Strategy strategy;
    private int windowDays;
    private boolean dryRun;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | FAILED
    private int trafficRecords;
    private int identifiersResolved;
    private String errorMessage;    // null on success

    @Builder.Default
    private Map<ResolvedKeyword, KeywordStatsSnapshot> stats = new LinkedHashMap<>();

    @Builder.Default
    private Map<ResolvedKeyword, Decision> decisions = new LinkedHashMap<>();

    @Builder.Default
    private Map<ResolvedKeyword, BidChange> bidChanges = new LinkedHashMap<>();
}
