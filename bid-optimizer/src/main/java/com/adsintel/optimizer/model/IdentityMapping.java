package com.adsintel.optimizer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Click identifier to keyword lookup, built once per run and read-only afterwards.
 */
public final class IdentityMapping {

    private static final IdentityMapping EMPTY = new IdentityMapping(Map.of());

    private final Map<String, ResolvedKeyword> entries;

    public IdentityMapping(Map<String, ResolvedKeyword> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static IdentityMapping empty() {
        return EMPTY;
    }

    /** Never null: identifiers the mapping has not seen come back as Unmapped(id). */
    public ResolvedKeyword lookup(String identifier) {
        ResolvedKeyword resolved = entries.get(identifier);
        return resolved != null ? resolved : ResolvedKeyword.unmapped(identifier);
    }

    public boolean contains(String identifier) {
        return entries.containsKey(identifier);
    }

    public int size() {
        return entries.size();
    }

    public long unmappedCount() {
        return entries.values().stream()
                .filter(k -> k.kind() == ResolvedKeyword.Kind.UNMAPPED)
                .count();
    }

    public Map<String, ResolvedKeyword> asMap() {
        return entries;
    }
}
