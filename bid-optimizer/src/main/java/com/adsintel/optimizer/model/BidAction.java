package com.adsintel.optimizer.model;

public enum BidAction {
    INCREASE,
    DECREASE,
    PAUSE_OR_LOWER,
    REVIEW,
    SKIP,
    NO_CHANGE;

    /** Actions that translate into a bid mutation. */
    public boolean changesBid() {
        return this == INCREASE || this == DECREASE || this == PAUSE_OR_LOWER;
    }
}
