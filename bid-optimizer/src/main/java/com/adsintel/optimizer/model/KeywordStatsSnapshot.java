package com.adsintel.optimizer.model;

import java.math.BigDecimal;

/**
 * Frozen copy of {@link KeywordStats} attached to decisions and reports.
 */
public record KeywordStatsSnapshot(
        long clicks,
        BigDecimal cost,
        long conversionCount,
        BigDecimal conversionValue,
        BigDecimal averageCostPerClick,
        BigDecimal averageCpa) {

    public static final KeywordStatsSnapshot ZERO = new KeywordStats().snapshot();

    /** Conversions per click, 0 when there were no clicks. */
    public BigDecimal conversionRate() {
        return KeywordStats.ratio(BigDecimal.valueOf(conversionCount), clicks);
    }
}
