package com.adsintel.optimizer.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Per-keyword accumulator for one optimisation run.
 *
 * Invariants held by {@link #record}: conversionCount <= clicks and
 * conversionValue <= cost, since a conversion always comes with its own click and cost.
 */
public class KeywordStats {

    static final int RATIO_SCALE = 4;

    private long clicks;
    private BigDecimal cost = BigDecimal.ZERO;
    private long conversionCount;
    private BigDecimal conversionValue = BigDecimal.ZERO;

    /**
     * Fold one click into the totals.
     *
     * @param clickCost  non-negative cost of the click
     * @param converted  whether the click carried a qualifying conversion
     */
    public void record(BigDecimal clickCost, boolean converted) {
        clicks++;
        cost = cost.add(clickCost);
        if (converted) {
            conversionCount++;
            conversionValue = conversionValue.add(clickCost);
        }
    }

    public long getClicks() {
        return clicks;
    }

    public BigDecimal getCost() {
        return cost;
    }

    public long getConversionCount() {
        return conversionCount;
    }

    public BigDecimal getConversionValue() {
        return conversionValue;
    }

    public BigDecimal getAverageCostPerClick() {
        return ratio(cost, clicks);
    }

    public BigDecimal getAverageCpa() {
        return ratio(conversionValue, conversionCount);
    }

    public KeywordStatsSnapshot snapshot() {
        return new KeywordStatsSnapshot(clicks, cost, conversionCount, conversionValue,
                getAverageCostPerClick(), getAverageCpa());
    }

    static BigDecimal ratio(BigDecimal numerator, long denominator) {
        if (denominator == 0) {
            return BigDecimal.ZERO;
        }
        return numerator.divide(BigDecimal.valueOf(denominator), RATIO_SCALE, RoundingMode.HALF_UP);
    }
}
