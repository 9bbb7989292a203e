package com.adsintel.optimizer.source;

import com.adsintel.optimizer.model.ClickReference;
import com.adsintel.optimizer.model.KeywordCriterion;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only view of the advertising account.
 *
 * The click lookups return partial maps keyed by click id value: clicks the account
 * does not know, or cannot look up for their family, are simply absent. Callers keep
 * batches within the API's per-query limit.
 */
public interface CampaignDirectory {

    /** click id to keyword text. */
    Map<String, String> resolveKeywords(List<ClickReference> clicks);

    /** click id to ad-group-ad resource name, e.g. customers/1/adGroupAds/111~222. */
    Map<String, String> resolveAdGroupAds(List<ClickReference> clicks);

    /** ad group id to its keyword texts, in the order the account returns them. */
    Map<Long, List<String>> keywordsForAdGroups(Collection<Long> adGroupIds);

    List<KeywordCriterion> listKeywordCriteria(String campaignId);

    default Set<String> listEnabledKeywords(String campaignId) {
        return enabledKeywords(listKeywordCriteria(campaignId));
    }

    /** Distinct keyword texts of the given criteria, in criteria order. */
    static Set<String> enabledKeywords(List<KeywordCriterion> criteria) {
        return criteria.stream()
                .map(KeywordCriterion::text)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
