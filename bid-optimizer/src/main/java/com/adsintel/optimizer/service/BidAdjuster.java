package com.adsintel.optimizer.service;

import com.adsintel.optimizer.config.BidOptimizerProperties;
import com.adsintel.optimizer.model.BidAction;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.OptionalLong;

/**
 * Converts a decision into a concrete CPC bid.
 *
 * INCREASE nudges the bid up by {@code optimization.step}; DECREASE and PAUSE_OR_LOWER
 * nudge it down by the same step. Whatever the raw figure, the result is clamped to
 * [current * (1 - maxChange), current * (1 + maxChange)] before anything is sent out.
 */
@Component
public class BidAdjuster {

    public static final BigDecimal MICROS_PER_UNIT = BigDecimal.valueOf(1_000_000L);

    private final BigDecimal step;
    private final BigDecimal maxChange;

    public BidAdjuster(BidOptimizerProperties properties) {
        this.step = properties.getOptimization().getStep();
        this.maxChange = properties.getOptimization().getMaxChange();
        if (maxChange.signum() < 0 || maxChange.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("optimization.max-change must be in [0, 1): " + maxChange);
        }
    }

    /**
     * @return the clamped new bid in micros, or empty when the action does not move the bid
     *         or there is no positive current bid to scale
     */
    public OptionalLong proposeMicros(BidAction action, long currentMicros) {
        if (!action.changesBid() || currentMicros <= 0) {
            return OptionalLong.empty();
        }
        BigDecimal current = BigDecimal.valueOf(currentMicros);
        BigDecimal factor = action == BidAction.INCREASE ? BigDecimal.ONE.add(step) : BigDecimal.ONE.subtract(step);
        BigDecimal clamped = clamp(current, current.multiply(factor));

        // Round towards the current bid so rounding can never leave the band.
        RoundingMode mode = clamped.compareTo(current) > 0 ? RoundingMode.FLOOR : RoundingMode.CEILING;
        return OptionalLong.of(clamped.setScale(0, mode).longValueExact());
    }

    public BigDecimal clamp(BigDecimal currentBid, BigDecimal rawBid) {
        BigDecimal lower = currentBid.multiply(BigDecimal.ONE.subtract(maxChange));
        BigDecimal upper = currentBid.multiply(BigDecimal.ONE.add(maxChange));
        return rawBid.max(lower).min(upper);
    }

    public static BigDecimal fromMicros(long micros) {
        return BigDecimal.valueOf(micros).divide(MICROS_PER_UNIT, 6, RoundingMode.UNNECESSARY);
    }
}
