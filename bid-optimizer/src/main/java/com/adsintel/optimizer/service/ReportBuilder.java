package com.adsintel.optimizer.service;

import com.adsintel.optimizer.model.BidChange;
import com.adsintel.optimizer.model.Decision;
import com.adsintel.optimizer.model.KeywordStatsSnapshot;
import com.adsintel.optimizer.model.OptimizationReport;
import com.adsintel.optimizer.model.OptimizationRun;
import com.adsintel.optimizer.model.ResolvedKeyword;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
public class ReportBuilder {

    public OptimizationReport build(OptimizationRun run) {
        Set<ResolvedKeyword> keywords = new LinkedHashSet<>(run.getStats().keySet());
        keywords.addAll(run.getDecisions().keySet());

        List<OptimizationReport.Row> rows = new ArrayList<>(keywords.size());
        for (ResolvedKeyword keyword : keywords) {
            rows.add(toRow(keyword,
                    run.getStats().getOrDefault(keyword, KeywordStatsSnapshot.ZERO),
                    run.getDecisions().get(keyword),
                    run.getBidChanges().get(keyword)));
        }

        return OptimizationReport.builder()
                .runId(run.getRunId())
                .campaignId(run.getCampaignId())
                .strategy(run.getStrategy())
                .windowDays(run.getWindowDays())
                .dryRun(run.isDryRun())
                .status(run.getStatus())
                .errorMessage(run.getErrorMessage())
                .generatedAt(LocalDateTime.now())
                .rows(List.copyOf(rows))
                .build();
    }

    private OptimizationReport.Row toRow(ResolvedKeyword keyword, KeywordStatsSnapshot stats,
                                         Decision decision, BidChange change) {
        return OptimizationReport.Row.builder()
                .keyword(keyword.label())
                .keywordKind(keyword.kind().name())
                .action(decision != null ? decision.getAction() : null)
                .reason(decision != null ? decision.getReason() : null)
                .clicks(stats.clicks())
                .cost(stats.cost())
                .conversionCount(stats.conversionCount())
                .conversionValue(stats.conversionValue())
                .averageCostPerClick(stats.averageCostPerClick())
                .currentBid(change != null ? change.getCurrentBid() : null)
                .newBid(change != null ? change.getNewBid() : null)
                .applyStatus(change != null ? change.getStatus().name() : null)
                .applyMessage(change != null ? change.getMessage() : null)
                .build();
    }
}
