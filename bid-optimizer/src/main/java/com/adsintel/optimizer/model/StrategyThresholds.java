package com.adsintel.optimizer.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * @param maxCpa             highest acceptable cost per conversion
 * @param minConversionRate  lowest acceptable conversions per click, e.g. 0.05 for 5%
 */
public record StrategyThresholds(BigDecimal maxCpa, BigDecimal minConversionRate) {

    public StrategyThresholds {
        Objects.requireNonNull(maxCpa, "maxCpa");
        Objects.requireNonNull(minConversionRate, "minConversionRate");
    }
}
