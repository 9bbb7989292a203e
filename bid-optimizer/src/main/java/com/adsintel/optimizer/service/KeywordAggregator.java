package com.adsintel.optimizer.service;

import com.adsintel.optimizer.config.BidOptimizerProperties;
import com.adsintel.optimizer.model.ClickIdentifier;
import com.adsintel.optimizer.model.IdentityMapping;
import com.adsintel.optimizer.model.KeywordStats;
import com.adsintel.optimizer.model.ResolvedKeyword;
import com.adsintel.optimizer.model.TrafficRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Folds click log records into per-keyword stats.
 *
 * Attribution per record:
 *  - no gclid/gbraid in the landing URL -> "unknown"
 *  - id not in the mapping              -> "Unmapped(id)"
 *  - otherwise                          -> the mapped keyword
 *
 * Every click adds to clicks and cost. Clicks whose conversion tag is in
 * {@code conversion.qualifying-kinds} also add to conversion count and value.
 * Enabled keywords that received no traffic are still present with zero stats.
 */
@Component
@Slf4j
public class KeywordAggregator {

    private final IdentifierExtractor extractor;
    private final Set<String> qualifyingKinds;

    public KeywordAggregator(IdentifierExtractor extractor, BidOptimizerProperties properties) {
        this.extractor = extractor;
        this.qualifyingKinds = properties.getConversion().getQualifyingKinds().stream()
                .map(KeywordAggregator::normalise)
                .collect(Collectors.toUnmodifiableSet());
    }

    public Map<ResolvedKeyword, KeywordStats> aggregate(Collection<TrafficRecord> records,
                                                        IdentityMapping mapping,
                                                        Collection<String> enabledKeywords) {
        Map<ResolvedKeyword, KeywordStats> stats = new LinkedHashMap<>();
        int skipped = 0;

        for (TrafficRecord record : records) {
            if (!record.isPaidChannel()) {
                skipped++;
                continue;
            }
            ResolvedKeyword keyword = attribute(record, mapping);
            getOrCreate(stats, keyword).record(record.costOrZero(), isConversion(record.getConversionKind()));
        }

        int added = 0;
        if (enabledKeywords != null) {
            for (String text : enabledKeywords) {
                if (text == null || text.isBlank()) continue;
                ResolvedKeyword keyword = ResolvedKeyword.keyword(text);
                if (!stats.containsKey(keyword)) {
                    getOrCreate(stats, keyword);
                    added++;
                }
            }
        }

        log.info("Aggregated {} records into {} keywords ({} enabled keywords without traffic, {} non-paid skipped)",
                records.size() - skipped, stats.size(), added, skipped);
        return stats;
    }

    public boolean isConversion(String conversionKind) {
        return conversionKind != null && qualifyingKinds.contains(normalise(conversionKind));
    }

    private ResolvedKeyword attribute(TrafficRecord record, IdentityMapping mapping) {
        Optional<ClickIdentifier> id = extractor.extract(record.getDestinationUrl());
        return id.map(clickId -> mapping.lookup(clickId.value()))
                .orElseGet(ResolvedKeyword::unknown);
    }

    /** The only place stats entries are created, so a fresh entry always starts at zero. */
    static KeywordStats getOrCreate(Map<ResolvedKeyword, KeywordStats> stats, ResolvedKeyword keyword) {
        KeywordStats existing = stats.get(keyword);
        if (existing == null) {
            existing = new KeywordStats();
            stats.put(keyword, existing);
        }
        return existing;
    }

    private static String normalise(String kind) {
        return kind.trim().toLowerCase(Locale.ROOT);
    }
}
