package com.adsintel.optimizer.service;

import com.adsintel.optimizer.config.BidOptimizerProperties;
import com.adsintel.optimizer.model.ClickReference;
import com.adsintel.optimizer.model.IdentityMapping;
import com.adsintel.optimizer.model.ResolvedKeyword;
import com.adsintel.optimizer.source.CampaignDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Resolves click ids to keywords through the campaign directory.
 *
 * The Ads API caps how many ids one query may filter on, so ids are sent in batches
 * of {@code resolver.batch-size}, never more than {@link #MAX_BATCH_SIZE}. A failing batch is logged and its ids degrade to
 * Unmapped(id); the other batches carry on. The returned mapping always covers every
 * requested id.
 *
 * Two lookup modes:
 *  - DIRECT:   click id -> keyword text in one query
 *  - AD_GROUP: click id -> adGroupAds/{adGroup}~{ad} resource name, then
 *              ad group -> keyword texts; the first keyword of the ad group wins
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IdentityResolver {

    /** Most click ids one Ads API query accepts. */
    public static final int MAX_BATCH_SIZE = 50;

    private final CampaignDirectory directory;
    private final BidOptimizerProperties properties;

    public IdentityMapping resolve(Collection<ClickReference> clicks) {
        List<ClickReference> unique = dedupe(clicks);
        if (unique.isEmpty()) {
            log.info("No click ids to resolve");
            return IdentityMapping.empty();
        }

        BidOptimizerProperties.Resolver cfg = properties.getResolver();
        int batchSize = effectiveBatchSize(cfg.getBatchSize());
        List<List<ClickReference>> batches = partition(unique, batchSize);
        log.info("Resolving {} click ids in {} batches of up to {} ({} mode)",
                unique.size(), batches.size(), batchSize, cfg.getMode());

        List<Map<String, ResolvedKeyword>> results = cfg.getParallelism() > 1 && batches.size() > 1
                ? resolveConcurrently(batches, cfg.getParallelism())
                : resolveSequentially(batches);

        // Merge in batch order; batches are disjoint so this is a plain union.
        Map<String, ResolvedKeyword> merged = new LinkedHashMap<>();
        results.forEach(merged::putAll);

        IdentityMapping mapping = new IdentityMapping(merged);
        log.info("Resolved {} click ids, {} unmapped", mapping.size(), mapping.unmappedCount());
        return mapping;
    }

    static <T> List<List<T>> partition(List<T> ids, int batchSize) {
        if (batchSize <= 0 || batchSize > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("batchSize must be between 1 and " + MAX_BATCH_SIZE + ": " + batchSize);
        }
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < ids.size(); i += batchSize) {
            batches.add(List.copyOf(ids.subList(i, Math.min(i + batchSize, ids.size()))));
        }
        return batches;
    }

    static int effectiveBatchSize(int configured) {
        if (configured > MAX_BATCH_SIZE) {
            log.warn("resolver.batch-size {} exceeds the API limit, using {}", configured, MAX_BATCH_SIZE);
            return MAX_BATCH_SIZE;
        }
        return configured;
    }

    /** Keeps the first occurrence of each id value together with that click's date. */
    private List<ClickReference> dedupe(Collection<ClickReference> clicks) {
        Map<String, ClickReference> seen = new LinkedHashMap<>();
        if (clicks != null) {
            for (ClickReference click : clicks) {
                if (click == null || click.value() == null || click.value().isBlank()) continue;
                seen.putIfAbsent(click.value(), click);
            }
        }
        return new ArrayList<>(seen.values());
    }

    // ── Batch execution ──────────────────────────────────────────────────────

    private List<Map<String, ResolvedKeyword>> resolveSequentially(List<List<ClickReference>> batches) {
        List<Map<String, ResolvedKeyword>> results = new ArrayList<>(batches.size());
        for (int i = 0; i < batches.size(); i++) {
            results.add(resolveBatch(batches.get(i), i));
        }
        return results;
    }

    private List<Map<String, ResolvedKeyword>> resolveConcurrently(List<List<ClickReference>> batches, int parallelism) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, batches.size()));
        try {
            List<Future<Map<String, ResolvedKeyword>>> futures = new ArrayList<>(batches.size());
            for (int i = 0; i < batches.size(); i++) {
                final int index = i;
                futures.add(pool.submit(() -> resolveBatch(batches.get(index), index)));
            }

            List<Map<String, ResolvedKeyword>> results = new ArrayList<>(batches.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    log.warn("Batch {} failed: {}", i, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                    results.add(allUnmapped(batches.get(i)));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while resolving, remaining batches degrade to unmapped");
                    for (int j = i; j < batches.size(); j++) {
                        results.add(allUnmapped(batches.get(j)));
                    }
                    break;
                }
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private Map<String, ResolvedKeyword> resolveBatch(List<ClickReference> batch, int index) {
        try {
            Map<String, ResolvedKeyword> resolved = switch (properties.getResolver().getMode()) {
                case DIRECT -> resolveDirect(batch);
                case AD_GROUP -> resolveViaAdGroup(batch);
            };
            log.debug("Batch {}: {} ids resolved", index, batch.size());
            return resolved;
        } catch (RuntimeException e) {
            log.warn("Batch {} ({} ids) failed, marking as unmapped: {}", index, batch.size(), e.getMessage());
            return allUnmapped(batch);
        }
    }

    // ── Lookup modes ─────────────────────────────────────────────────────────

    private Map<String, ResolvedKeyword> resolveDirect(List<ClickReference> batch) {
        Map<String, String> found = nullSafe(directory.resolveKeywords(batch));

        Map<String, ResolvedKeyword> out = new LinkedHashMap<>();
        for (ClickReference click : batch) {
            String id = click.value();
            String text = found.get(id);
            out.put(id, text == null || text.isBlank()
                    ? ResolvedKeyword.unmapped(id)
                    : ResolvedKeyword.keyword(text));
        }
        return out;
    }

    private Map<String, ResolvedKeyword> resolveViaAdGroup(List<ClickReference> batch) {
        Map<String, String> paths = nullSafe(directory.resolveAdGroupAds(batch));

        Map<String, Long> adGroupByClick = new LinkedHashMap<>();
        for (ClickReference click : batch) {
            String id = click.value();
            String path = paths.get(id);
            if (path == null) continue;
            AdGroupAdPathParser.Result parsed = AdGroupAdPathParser.parse(path);
            if (parsed.valid()) {
                adGroupByClick.put(id, parsed.adGroupId());
            } else {
                log.debug("Click {} has unusable ad group path '{}': {}", id, path, parsed.error());
            }
        }

        Set<Long> adGroupIds = new LinkedHashSet<>(adGroupByClick.values());
        Map<Long, List<String>> keywords = adGroupIds.isEmpty()
                ? Map.of()
                : nullSafe(directory.keywordsForAdGroups(adGroupIds));

        Map<String, ResolvedKeyword> out = new LinkedHashMap<>();
        for (ClickReference click : batch) {
            String id = click.value();
            Long adGroupId = adGroupByClick.get(id);
            out.put(id, adGroupId == null
                    ? ResolvedKeyword.unmapped(id)
                    : firstKeyword(id, adGroupId, keywords.get(adGroupId)));
        }
        return out;
    }

    private ResolvedKeyword firstKeyword(String clickId, long adGroupId, List<String> texts) {
        if (texts != null) {
            for (String text : texts) {
                if (text != null && !text.isBlank()) return ResolvedKeyword.keyword(text);
            }
        }
        return properties.getResolver().isAdGroupFallback()
                ? ResolvedKeyword.adGroup(adGroupId)
                : ResolvedKeyword.unmapped(clickId);
    }

    private static Map<String, ResolvedKeyword> allUnmapped(List<ClickReference> batch) {
        Map<String, ResolvedKeyword> out = new LinkedHashMap<>();
        batch.forEach(click -> out.put(click.value(), ResolvedKeyword.unmapped(click.value())));
        return out;
    }

    private static <K, V> Map<K, V> nullSafe(Map<K, V> map) {
        return map == null ? Map.of() : map;
    }
}
