package com.adsintel.optimizer.source;

import com.adsintel.optimizer.model.ApplyResult;
import com.adsintel.optimizer.model.KeywordCriterion;

/**
 * Pushes a new CPC bid to the live campaign. Only called when dry-run is off.
 */
public interface ChangeApplier {

    /**
     * @param newBidMicros already clamped bid
     * @param reason       shown in logs next to the change
     * @return success or failure for this keyword; must not throw for API errors
     */
    ApplyResult apply(KeywordCriterion criterion, long newBidMicros, String reason);
}
