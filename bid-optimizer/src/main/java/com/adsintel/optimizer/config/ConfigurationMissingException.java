package com.adsintel.optimizer.config;

import java.util.List;

/**
 * Raised when credentials required by the run are not configured.
 * Always fatal: the run aborts before any traffic is read.
 */
public class ConfigurationMissingException extends RuntimeException {

    private final List<String> missingKeys;

    public ConfigurationMissingException(List<String> missingKeys) {
        super("Missing required configuration: " + String.join(", ", missingKeys));
        this.missingKeys = List.copyOf(missingKeys);
    }

    public List<String> getMissingKeys() {
        return missingKeys;
    }
}
