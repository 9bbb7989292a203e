package com.adsintel.optimizer.model;

/**
 * Outcome of a single bid mutation call.
 */
public record ApplyResult(boolean success, String message) {

    public static ApplyResult ok(String message) {
        return new ApplyResult(true, message);
    }

    public static ApplyResult failed(String message) {
        return new ApplyResult(false, message);
    }
}
