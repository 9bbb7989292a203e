package com.adsintel.optimizer.service;

import com.adsintel.optimizer.model.BidAction;
import com.adsintel.optimizer.model.Decision;
import com.adsintel.optimizer.model.KeywordStatsSnapshot;
import com.adsintel.optimizer.model.ResolvedKeyword;
import com.adsintel.optimizer.model.Strategy;
import com.adsintel.optimizer.model.StrategyThresholds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns keyword stats into one decision per keyword. Pure: never talks to the Ads API.
 *
 * Rules, first match wins:
 *  1. no clicks                                  -> SKIP
 *  2. clicks but no conversions                  -> PAUSE_OR_LOWER
 *  3. ROAS and conversion value > 0              -> INCREASE
 *  4. CPA and average CPA > max CPA              -> DECREASE
 *  5. CPA and conversion rate < min rate         -> DECREASE
 *  6. Manual                                     -> REVIEW
 *  7. anything else                              -> NO_CHANGE
 */
@Component
@Slf4j
public class StrategyEngine {

    public Decision decide(ResolvedKeyword keyword,
                           KeywordStatsSnapshot stats,
                           Strategy strategy,
                           StrategyThresholds thresholds) {
        Decision.DecisionBuilder decision = Decision.builder().keyword(keyword).stats(stats);

        if (stats.clicks() == 0) {
            return decision.action(BidAction.SKIP).reason("no traffic").build();
        }
        if (stats.conversionCount() == 0) {
            return decision.action(BidAction.PAUSE_OR_LOWER)
                    .reason(format("no conversions from %d clicks (cost %.2f)", stats.clicks(), stats.cost()))
                    .build();
        }
        if (strategy == Strategy.ROAS && stats.conversionValue().signum() > 0) {
            return decision.action(BidAction.INCREASE)
                    .reason(format("favorable return: conversion value %.2f from %d conversions",
                            stats.conversionValue(), stats.conversionCount()))
                    .build();
        }
        if (strategy == Strategy.CPA) {
            BigDecimal averageCpa = stats.averageCpa();
            if (averageCpa.compareTo(thresholds.maxCpa()) > 0) {
                return decision.action(BidAction.DECREASE)
                        .reason(format("average CPA %.2f exceeds max CPA %.2f", averageCpa, thresholds.maxCpa()))
                        .build();
            }
            BigDecimal rate = stats.conversionRate();
            if (rate.compareTo(thresholds.minConversionRate()) < 0) {
                return decision.action(BidAction.DECREASE)
                        .reason(format("conversion rate %.2f%% below minimum %.2f%%",
                                percent(rate), percent(thresholds.minConversionRate())))
                        .build();
            }
        }
        if (strategy == Strategy.MANUAL) {
            return decision.action(BidAction.REVIEW).reason("manual strategy selected").build();
        }
        return decision.action(BidAction.NO_CHANGE).reason("within targets").build();
    }

    public Map<ResolvedKeyword, Decision> decideAll(Map<ResolvedKeyword, KeywordStatsSnapshot> stats,
                                                    Strategy strategy,
                                                    StrategyThresholds thresholds) {
        Map<ResolvedKeyword, Decision> decisions = new LinkedHashMap<>();
        Map<BidAction, Integer> tally = new EnumMap<>(BidAction.class);

        stats.forEach((keyword, snapshot) -> {
            Decision d = decide(keyword, snapshot, strategy, thresholds);
            decisions.put(keyword, d);
            tally.merge(d.getAction(), 1, Integer::sum);
        });

        log.info("{} strategy produced {} decisions: {}", strategy, decisions.size(), tally);
        return decisions;
    }

    private static BigDecimal percent(BigDecimal ratio) {
        return ratio.movePointRight(2);
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
