package com.adsintel.optimizer.model;

import java.util.Objects;

/**
 * What a click was attributed to. Used as the key of the stats and decision maps.
 */
public record ResolvedKeyword(Kind kind, String label) {

    public static final String UNKNOWN_LABEL = "unknown";

    public enum Kind {
        KEYWORD, AD_GROUP, UNMAPPED, UNKNOWN
    }

    public ResolvedKeyword {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(label, "label");
    }

    public static ResolvedKeyword keyword(String text) {
        return new ResolvedKeyword(Kind.KEYWORD, text);
    }

    public static ResolvedKeyword adGroup(long adGroupId) {
        return new ResolvedKeyword(Kind.AD_GROUP, "AdGroup(" + adGroupId + ")");
    }

    public static ResolvedKeyword unmapped(String identifier) {
        return new ResolvedKeyword(Kind.UNMAPPED, "Unmapped(" + identifier + ")");
    }

    public static ResolvedKeyword unknown() {
        return new ResolvedKeyword(Kind.UNKNOWN, UNKNOWN_LABEL);
    }

    public boolean isKeyword() {
        return kind == Kind.KEYWORD;
    }

    @Override
    public String toString() {
        return label;
    }
}
