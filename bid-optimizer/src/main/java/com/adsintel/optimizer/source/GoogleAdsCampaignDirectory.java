package com.adsintel.optimizer.source;

import com.adsintel.optimizer.model.ClickIdentifier;
import com.adsintel.optimizer.model.ClickReference;
import com.adsintel.optimizer.model.GoogleAdsSearchResponse;
import com.adsintel.optimizer.model.KeywordCriterion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * CampaignDirectory backed by GAQL queries over click_view, keyword_view and
 * ad_group_criterion.
 *
 * Click lookups issue one click_view query per click day in the batch. Only gclid
 * clicks are resolvable; gbraid clicks come back absent and end up Unmapped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GoogleAdsCampaignDirectory implements CampaignDirectory {

    private final GoogleAdsApiClient apiClient;

    @Override
    public Map<String, String> resolveKeywords(List<ClickReference> clicks) {
        Map<String, String> out = new LinkedHashMap<>();
        byClickDate(clicks).forEach((date, gclids) -> {
            String query = """
                SELECT click_view.gclid, click_view.keyword_info.text
                FROM click_view
                WHERE click_view.gclid IN (%s)
                AND segments.date = '%s'
                """.formatted(quoted(gclids), date);

            for (GoogleAdsSearchResponse.Row row : apiClient.search(query)) {
                GoogleAdsSearchResponse.ClickView cv = row.getClickView();
                if (cv == null || cv.getGclid() == null || cv.getKeywordInfo() == null) continue;
                out.putIfAbsent(cv.getGclid(), cv.getKeywordInfo().getText());
            }
        });
        return out;
    }

    @Override
    public Map<String, String> resolveAdGroupAds(List<ClickReference> clicks) {
        Map<String, String> out = new LinkedHashMap<>();
        byClickDate(clicks).forEach((date, gclids) -> {
            String query = """
                SELECT click_view.gclid, click_view.ad_group_ad
                FROM click_view
                WHERE click_view.gclid IN (%s)
                AND segments.date = '%s'
                """.formatted(quoted(gclids), date);

            for (GoogleAdsSearchResponse.Row row : apiClient.search(query)) {
                GoogleAdsSearchResponse.ClickView cv = row.getClickView();
                if (cv == null || cv.getGclid() == null || cv.getAdGroupAd() == null) continue;
                out.putIfAbsent(cv.getGclid(), cv.getAdGroupAd());
            }
        });
        return out;
    }

    @Override
    public Map<Long, List<String>> keywordsForAdGroups(Collection<Long> adGroupIds) {
        if (adGroupIds.isEmpty()) return Map.of();

        String ids = adGroupIds.stream().map(String::valueOf).collect(Collectors.joining(", "));
        String query = """
            SELECT ad_group.id, ad_group_criterion.keyword.text
            FROM keyword_view
            WHERE ad_group.id IN (%s)
            AND ad_group_criterion.status = 'ENABLED'
            """.formatted(ids);

        Map<Long, List<String>> out = new LinkedHashMap<>();
        for (GoogleAdsSearchResponse.Row row : apiClient.search(query)) {
            if (row.getAdGroup() == null || row.getAdGroup().getId() == null) continue;
            String text = keywordText(row.getAdGroupCriterion());
            if (text == null) continue;
            out.computeIfAbsent(row.getAdGroup().getId(), k -> new ArrayList<>()).add(text);
        }
        return out;
    }

    @Override
    public List<KeywordCriterion> listKeywordCriteria(String campaignId) {
        String query = """
            SELECT ad_group.id,
                   ad_group_criterion.criterion_id,
                   ad_group_criterion.keyword.text,
                   ad_group_criterion.effective_cpc_bid_micros
            FROM ad_group_criterion
            WHERE campaign.id = %s
            AND ad_group_criterion.type = 'KEYWORD'
            AND ad_group_criterion.status = 'ENABLED'
            """.formatted(numericId(campaignId));

        List<KeywordCriterion> out = new ArrayList<>();
        for (GoogleAdsSearchResponse.Row row : apiClient.search(query)) {
            GoogleAdsSearchResponse.AdGroupCriterion c = row.getAdGroupCriterion();
            String text = keywordText(c);
            if (text == null || c.getCriterionId() == null || row.getAdGroup() == null) continue;

            Long bid = c.getEffectiveCpcBidMicros() != null ? c.getEffectiveCpcBidMicros() : c.getCpcBidMicros();
            out.add(new KeywordCriterion(c.getCriterionId(), row.getAdGroup().getId(), text, bid == null ? 0L : bid));
        }
        log.debug("Campaign {}: {} enabled keyword criteria", campaignId, out.size());
        return out;
    }

    // ── GAQL helpers ─────────────────────────────────────────────────────────

    /**
     * click_view only answers single-day queries keyed by gclid, so gclids are grouped
     * by click day. gbraid clicks and clicks without a date cannot be looked up there
     * and are left out of the result.
     */
    static Map<LocalDate, List<String>> byClickDate(List<ClickReference> clicks) {
        Map<LocalDate, List<String>> byDate = new TreeMap<>();
        int skippedGbraid = 0;
        int skippedUndated = 0;
        for (ClickReference click : clicks) {
            if (click.family() != ClickIdentifier.Family.GCLID) {
                skippedGbraid++;
            } else if (click.clickDate() == null) {
                skippedUndated++;
            } else {
                byDate.computeIfAbsent(click.clickDate(), d -> new ArrayList<>()).add(click.value());
            }
        }
        if (skippedGbraid > 0 || skippedUndated > 0) {
            log.debug("Not resolvable through click_view: {} gbraid clicks, {} clicks without a date",
                    skippedGbraid, skippedUndated);
        }
        return byDate;
    }

    private static String keywordText(GoogleAdsSearchResponse.AdGroupCriterion c) {
        if (c == null || c.getKeyword() == null) return null;
        String text = c.getKeyword().getText();
        return text == null || text.isBlank() ? null : text;
    }

    static String quoted(List<String> values) {
        return values.stream()
                .map(v -> "'" + v.replace("\\", "\\\\").replace("'", "\\'") + "'")
                .collect(Collectors.joining(", "));
    }

    static String numericId(String id) {
        String digits = id == null ? "" : id.replace("-", "").trim();
        if (!digits.matches("\\d+")) {
            throw new IllegalArgumentException("Campaign id must be numeric: " + id);
        }
        return digits;
    }
}
