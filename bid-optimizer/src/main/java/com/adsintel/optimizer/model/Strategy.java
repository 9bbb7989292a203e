package com.adsintel.optimizer.model;

import java.util.Locale;

/**
 * Bid strategy selected for a run.
 */
public enum Strategy {
    ROAS, CPA, MANUAL;

    /** Lenient lookup: accepts "roas", "Manual", " CPA ". */
    public static Strategy fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Strategy name is required");
        }
        try {
            return Strategy.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown strategy: " + name + " (expected ROAS, CPA or Manual)");
        }
    }
}
