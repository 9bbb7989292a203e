package com.adsintel.optimizer.source;

import com.adsintel.optimizer.config.BidOptimizerProperties;
import com.adsintel.optimizer.model.ClickIdentifier;
import com.adsintel.optimizer.model.ClickReference;
import com.adsintel.optimizer.model.GoogleAdsSearchResponse;
import com.adsintel.optimizer.model.IdentityMapping;
import com.adsintel.optimizer.model.KeywordCriterion;
import com.adsintel.optimizer.model.ResolvedKeyword;
import com.adsintel.optimizer.service.IdentifierExtractor;
import com.adsintel.optimizer.service.IdentityResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GoogleAdsCampaignDirectoryTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    private GoogleAdsApiClient apiClient;
    private GoogleAdsCampaignDirectory directory;

    @BeforeEach
    void setUp() {
        apiClient = mock(GoogleAdsApiClient.class);
        directory = new GoogleAdsCampaignDirectory(apiClient);
    }

    private static GoogleAdsSearchResponse.KeywordInfo keyword(String text) {
        GoogleAdsSearchResponse.KeywordInfo info = new GoogleAdsSearchResponse.KeywordInfo();
        info.setText(text);
        return info;
    }

    private static GoogleAdsSearchResponse.Row clickRow(String gclid, String keywordText, String adGroupAd) {
        GoogleAdsSearchResponse.ClickView cv = new GoogleAdsSearchResponse.ClickView();
        cv.setGclid(gclid);
        cv.setKeywordInfo(keywordText == null ? null : keyword(keywordText));
        cv.setAdGroupAd(adGroupAd);
        GoogleAdsSearchResponse.Row row = new GoogleAdsSearchResponse.Row();
        row.setClickView(cv);
        return row;
    }

    private static GoogleAdsSearchResponse.Row criterionRow(Long adGroupId, Long criterionId, String text,
                                                            Long cpcBid, Long effectiveBid) {
        GoogleAdsSearchResponse.AdGroup adGroup = new GoogleAdsSearchResponse.AdGroup();
        adGroup.setId(adGroupId);
        GoogleAdsSearchResponse.AdGroupCriterion c = new GoogleAdsSearchResponse.AdGroupCriterion();
        c.setCriterionId(criterionId);
        c.setKeyword(text == null ? null : keyword(text));
        c.setCpcBidMicros(cpcBid);
        c.setEffectiveCpcBidMicros(effectiveBid);
        GoogleAdsSearchResponse.Row row = new GoogleAdsSearchResponse.Row();
        row.setAdGroup(adGroup);
        row.setAdGroupCriterion(c);
        return row;
    }

    @Test
    void resolvesKeywordsFromClickView() {
        when(apiClient.search(anyString())).thenReturn(List.of(
                clickRow("g1", "shoes", null),
                clickRow("g2", null, null),
                clickRow("g1", "boots", null)));

        Map<String, String> found = directory.resolveKeywords(List.of(
                ClickReference.gclid("g1", DAY), ClickReference.gclid("g2", DAY), ClickReference.gclid("g'3", DAY)));

        assertThat(found).containsExactly(Map.entry("g1", "shoes"));
        ArgumentCaptor<String> query = ArgumentCaptor.forClass(String.class);
        verify(apiClient).search(query.capture());
        assertThat(query.getValue())
                .contains("FROM click_view")
                .contains("click_view.gclid IN ('g1', 'g2', 'g\\'3')")
                .contains("segments.date = '2024-03-01'");
    }

    @Test
    void clickViewIsQueriedOncePerClickDay() {
        when(apiClient.search(anyString())).thenReturn(List.of());

        directory.resolveKeywords(List.of(
                ClickReference.gclid("late", DAY.plusDays(1)),
                ClickReference.gclid("early", DAY),
                ClickReference.gclid("late2", DAY.plusDays(1))));

        ArgumentCaptor<String> queries = ArgumentCaptor.forClass(String.class);
        verify(apiClient, times(2)).search(queries.capture());
        assertThat(queries.getAllValues().get(0))
                .contains("IN ('early')")
                .contains("segments.date = '2024-03-01'");
        assertThat(queries.getAllValues().get(1))
                .contains("IN ('late', 'late2')")
                .contains("segments.date = '2024-03-02'");
    }

    @Test
    void gbraidAndUndatedClicksAreNotLookedUp() {
        Map<String, String> found = directory.resolveKeywords(List.of(
                ClickReference.gbraid("0AAAAAgbr", DAY),
                ClickReference.gclid("nodate", null)));

        assertThat(found).isEmpty();
        verify(apiClient, never()).search(anyString());
    }

    @Test
    void gbraidLandingEndsUpUnmappedWithoutQuery() {
        BidOptimizerProperties properties = new BidOptimizerProperties();
        IdentityResolver resolver = new IdentityResolver(directory, properties);
        Optional<ClickIdentifier> id = new IdentifierExtractor().extract("https://shop.example/?gbraid=0AAAAAgbr");

        IdentityMapping mapping = resolver.resolve(List.of(new ClickReference(id.orElseThrow(), DAY)));

        assertThat(id.get().family()).isEqualTo(ClickIdentifier.Family.GBRAID);
        assertThat(mapping.lookup("0AAAAAgbr")).isEqualTo(ResolvedKeyword.unmapped("0AAAAAgbr"));
        verify(apiClient, never()).search(anyString());
    }

    @Test
    void resolvesAdGroupAdResourceNames() {
        when(apiClient.search(anyString())).thenReturn(List.of(
                clickRow("g1", null, "customers/1/adGroupAds/22~33")));

        assertThat(directory.resolveAdGroupAds(List.of(ClickReference.gclid("g1", DAY), ClickReference.gclid("g2", DAY))))
                .containsExactly(Map.entry("g1", "customers/1/adGroupAds/22~33"));
        ArgumentCaptor<String> query = ArgumentCaptor.forClass(String.class);
        verify(apiClient).search(query.capture());
        assertThat(query.getValue())
                .contains("click_view.ad_group_ad")
                .contains("segments.date = '2024-03-01'");
    }

    @Test
    void groupsKeywordsByAdGroupInOrder() {
        when(apiClient.search(anyString())).thenReturn(List.of(
                criterionRow(22L, 1L, "shoes", null, null),
                criterionRow(33L, 2L, "boots", null, null),
                criterionRow(22L, 3L, "trainers", null, null),
                criterionRow(22L, 4L, " ", null, null)));

        Map<Long, List<String>> keywords = directory.keywordsForAdGroups(List.of(22L, 33L));

        assertThat(keywords).containsEntry(22L, List.of("shoes", "trainers")).containsEntry(33L, List.of("boots"));
        ArgumentCaptor<String> query = ArgumentCaptor.forClass(String.class);
        verify(apiClient).search(query.capture());
        assertThat(query.getValue()).contains("ad_group.id IN (22, 33)");
    }

    @Test
    void noAdGroupsMeansNoQuery() {
        assertThat(directory.keywordsForAdGroups(List.of())).isEmpty();
        verify(apiClient, never()).search(anyString());
    }

    @Test
    void listsCriteriaPreferringEffectiveBid() {
        when(apiClient.search(anyString())).thenReturn(List.of(
                criterionRow(22L, 1L, "shoes", 500_000L, 750_000L),
                criterionRow(22L, 2L, "boots", 400_000L, null),
                criterionRow(22L, 3L, "sandals", null, null),
                criterionRow(22L, null, "orphan", 1L, 1L)));

        List<KeywordCriterion> criteria = directory.listKeywordCriteria("123-456-7890");

        assertThat(criteria).containsExactly(
                new KeywordCriterion(1L, 22L, "shoes", 750_000L),
                new KeywordCriterion(2L, 22L, "boots", 400_000L),
                new KeywordCriterion(3L, 22L, "sandals", 0L));
        ArgumentCaptor<String> query = ArgumentCaptor.forClass(String.class);
        verify(apiClient).search(query.capture());
        assertThat(query.getValue()).contains("campaign.id = 1234567890");
    }

    @Test
    void enabledKeywordsAreDistinctTexts() {
        when(apiClient.search(anyString())).thenReturn(List.of(
                criterionRow(22L, 1L, "shoes", 1L, null),
                criterionRow(33L, 2L, "shoes", 1L, null),
                criterionRow(33L, 3L, "boots", 1L, null)));

        Set<String> enabled = directory.listEnabledKeywords("42");

        assertThat(enabled).containsExactly("shoes", "boots");
    }

    @Test
    void quotesAndEscapesIds() {
        assertThat(GoogleAdsCampaignDirectory.quoted(List.of("a", "b\\c"))).isEqualTo("'a', 'b\\\\c'");
    }

    @Test
    void campaignIdMustBeNumeric() {
        assertThat(GoogleAdsCampaignDirectory.numericId(" 12-34 ")).isEqualTo("1234");
        assertThatThrownBy(() -> GoogleAdsCampaignDirectory.numericId("1 OR 1=1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GoogleAdsCampaignDirectory.numericId(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
