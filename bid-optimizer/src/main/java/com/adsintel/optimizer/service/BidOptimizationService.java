package com.adsintel.optimizer.service;

import com.adsintel.optimizer.config.BidOptimizerProperties;
import com.adsintel.optimizer.model.BidChange;
import com.adsintel.optimizer.model.ClickReference;
import com.adsintel.optimizer.model.Decision;
import com.adsintel.optimizer.model.IdentityMapping;
import com.adsintel.optimizer.model.KeywordCriterion;
import com.adsintel.optimizer.model.KeywordStats;
import com.adsintel.optimizer.model.KeywordStatsSnapshot;
import com.adsintel.optimizer.model.OptimizationRequest;
import com.adsintel.optimizer.model.OptimizationRun;
import com.adsintel.optimizer.model.ResolvedKeyword;
import com.adsintel.optimizer.model.StrategyThresholds;
import com.adsintel.optimizer.model.TrafficRecord;
import com.adsintel.optimizer.output.ReportSink;
import com.adsintel.optimizer.source.CampaignDirectory;
import com.adsintel.optimizer.source.TrafficSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Orchestrates one optimisation run:
 *
 *   click log -> click ids -> keyword mapping -> per-keyword stats -> decisions
 *             -> priced bid changes (applied only outside dry-run) -> report
 *
 * Stages run strictly in sequence because aggregation needs the finished mapping.
 * Missing credentials abort the run before any traffic is read.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BidOptimizationService {

    private final BidOptimizerProperties properties;
    private final TrafficSource trafficSource;
    private final CampaignDirectory campaignDirectory;
    private final IdentifierExtractor extractor;
    private final IdentityResolver resolver;
    private final KeywordAggregator aggregator;
    private final StrategyEngine strategyEngine;
    private final BidChangeService bidChangeService;
    private final ReportBuilder reportBuilder;
    private final ReportSink reportSink;

    /**
     * Run with the campaign, strategy and thresholds from configuration.
     * Used by the scheduler.
     */
    public OptimizationRun optimizeConfigured() {
        BidOptimizerProperties.Optimization cfg = properties.getOptimization();
        return optimize(OptimizationRequest.builder()
                .campaignId(cfg.getCampaignId())
                .strategy(cfg.getStrategy())
                .thresholds(new StrategyThresholds(cfg.getMaxCpa(), cfg.getMinConversionRate()))
                .windowDays(cfg.getAttributionWindowDays())
                .dryRun(cfg.isDryRun())
                .build());
    }

    public OptimizationRun optimize(OptimizationRequest request) {
        properties.getGoogleAds().validate();
        if (request.getCampaignId() == null || request.getCampaignId().isBlank()) {
            throw new IllegalArgumentException("campaignId is required");
        }

        OptimizationRun run = OptimizationRun.builder()
                .runId(UUID.randomUUID().toString())
                .campaignId(request.getCampaignId())
                .strategy(request.getStrategy())
                .windowDays(request.getWindowDays())
                .dryRun(request.isDryRun())
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .build();

        log.info("Run {}: campaign {}, strategy {}, window {} days, dryRun={}",
                run.getRunId(), run.getCampaignId(), run.getStrategy(), run.getWindowDays(), run.isDryRun());

        try {
            List<TrafficRecord> records = trafficSource.fetch(request.getWindowDays());
            run.setTrafficRecords(records.size());
            log.info("Fetched {} paid clicks", records.size());

            IdentityMapping mapping = resolver.resolve(clicks(records));
            run.setIdentifiersResolved(mapping.size());

            List<KeywordCriterion> criteria = campaignDirectory.listKeywordCriteria(request.getCampaignId());
            Set<String> enabled = CampaignDirectory.enabledKeywords(criteria);
            log.info("Campaign {} has {} enabled keywords", request.getCampaignId(), enabled.size());

            Map<ResolvedKeyword, KeywordStats> stats = aggregator.aggregate(records, mapping, enabled);
            Map<ResolvedKeyword, KeywordStatsSnapshot> snapshots = new LinkedHashMap<>();
            stats.forEach((keyword, s) -> snapshots.put(keyword, s.snapshot()));
            run.setStats(snapshots);

            Map<ResolvedKeyword, Decision> decisions =
                    strategyEngine.decideAll(snapshots, request.getStrategy(), request.getThresholds());
            run.setDecisions(decisions);

            if (decisions.values().stream().anyMatch(d -> d.getAction().changesBid())) {
                Map<ResolvedKeyword, BidChange> changes =
                        bidChangeService.apply(decisions.values(), criteria, request.isDryRun());
                run.setBidChanges(changes);
            }

            run.setStatus("SUCCESS");
            return run;

        } catch (RuntimeException e) {
            log.error("Run {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
            throw e;
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            publish(run);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<ClickReference> clicks(List<TrafficRecord> records) {
        List<ClickReference> clicks = new ArrayList<>();
        for (TrafficRecord record : records) {
            if (!record.isPaidChannel()) continue;
            LocalDate day = record.getTimestamp() != null ? record.getTimestamp().toLocalDate() : null;
            extractor.extract(record.getDestinationUrl())
                    .ifPresent(id -> clicks.add(new ClickReference(id, day)));
        }
        return clicks;
    }

    private void publish(OptimizationRun run) {
        try {
            reportSink.write(reportBuilder.build(run));
        } catch (Exception e) {
            log.warn("Failed to publish report for run {}: {}", run.getRunId(), e.getMessage());
        }
    }
}
