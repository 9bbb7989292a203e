package com.adsintel.optimizer.service;

import com.adsintel.optimizer.config.BidOptimizerProperties;
import com.adsintel.optimizer.model.ApplyResult;
import com.adsintel.optimizer.model.BidAction;
import com.adsintel.optimizer.model.BidChange;
import com.adsintel.optimizer.model.Decision;
import com.adsintel.optimizer.model.KeywordCriterion;
import com.adsintel.optimizer.model.KeywordStatsSnapshot;
import com.adsintel.optimizer.model.ResolvedKeyword;
import com.adsintel.optimizer.source.ChangeApplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BidChangeServiceTest {

    private static final KeywordCriterion SHOES = new KeywordCriterion(11L, 100L, "shoes", 1_000_000L);
    private static final KeywordCriterion BOOTS = new KeywordCriterion(12L, 100L, "boots", 2_000_000L);

    private ChangeApplier applier;
    private BidChangeService service;

    @BeforeEach
    void setUp() {
        applier = mock(ChangeApplier.class);
        service = new BidChangeService(new BidAdjuster(new BidOptimizerProperties()), applier);
    }

    private static Decision decision(ResolvedKeyword keyword, BidAction action) {
        return Decision.builder()
                .keyword(keyword)
                .action(action)
                .reason("because")
                .stats(KeywordStatsSnapshot.ZERO)
                .build();
    }

    @Test
    void dryRunPricesChangesWithoutCallingTheApplier() {
        Map<ResolvedKeyword, BidChange> changes = service.apply(
                List.of(decision(ResolvedKeyword.keyword("shoes"), BidAction.INCREASE)),
                List.of(SHOES), true);

        BidChange change = changes.get(ResolvedKeyword.keyword("shoes"));
        assertThat(change.getStatus()).isEqualTo(BidChange.ApplyStatus.DRY_RUN);
        assertThat(change.getCurrentBid()).isEqualByComparingTo("1.00");
        assertThat(change.getNewBid()).isEqualByComparingTo("1.10");
        verify(applier, never()).apply(any(), anyLong(), anyString());
    }

    @Test
    void appliesClampedBidsAndRecordsFailuresPerKeyword() {
        when(applier.apply(eq(SHOES), anyLong(), anyString())).thenReturn(ApplyResult.failed("POLICY_VIOLATION"));
        when(applier.apply(eq(BOOTS), anyLong(), anyString())).thenReturn(ApplyResult.ok("done"));

        Map<ResolvedKeyword, BidChange> changes = service.apply(List.of(
                decision(ResolvedKeyword.keyword("shoes"), BidAction.DECREASE),
                decision(ResolvedKeyword.keyword("boots"), BidAction.PAUSE_OR_LOWER)), List.of(SHOES, BOOTS), false);

        assertThat(changes.get(ResolvedKeyword.keyword("shoes")).getStatus()).isEqualTo(BidChange.ApplyStatus.FAILED);
        assertThat(changes.get(ResolvedKeyword.keyword("shoes")).getMessage()).isEqualTo("POLICY_VIOLATION");
        assertThat(changes.get(ResolvedKeyword.keyword("boots")).getStatus()).isEqualTo(BidChange.ApplyStatus.APPLIED);
        verify(applier).apply(SHOES, 900_000L, "because");
        verify(applier).apply(BOOTS, 1_800_000L, "because");
    }

    @Test
    void applierExceptionIsRecordedNotPropagated() {
        when(applier.apply(eq(SHOES), anyLong(), anyString())).thenThrow(new IllegalStateException("boom"));
        when(applier.apply(eq(BOOTS), anyLong(), anyString())).thenReturn(ApplyResult.ok("done"));

        Map<ResolvedKeyword, BidChange> changes = service.apply(List.of(
                decision(ResolvedKeyword.keyword("shoes"), BidAction.INCREASE),
                decision(ResolvedKeyword.keyword("boots"), BidAction.INCREASE)), List.of(SHOES, BOOTS), false);

        assertThat(changes.get(ResolvedKeyword.keyword("shoes")).getStatus()).isEqualTo(BidChange.ApplyStatus.FAILED);
        assertThat(changes.get(ResolvedKeyword.keyword("boots")).getStatus()).isEqualTo(BidChange.ApplyStatus.APPLIED);
    }

    @Test
    void nonKeywordAttributionsHaveNoCriterion() {
        Map<ResolvedKeyword, BidChange> changes = service.apply(List.of(
                decision(ResolvedKeyword.unknown(), BidAction.PAUSE_OR_LOWER),
                decision(ResolvedKeyword.keyword("sandals"), BidAction.INCREASE)), List.of(SHOES), false);

        assertThat(changes.values()).extracting(BidChange::getStatus)
                .containsOnly(BidChange.ApplyStatus.NO_CRITERION);
        verify(applier, never()).apply(any(), anyLong(), anyString());
    }

    @Test
    void actionsThatDoNotMoveBidsAreLeftOut() {
        Map<ResolvedKeyword, BidChange> changes = service.apply(List.of(
                decision(ResolvedKeyword.keyword("shoes"), BidAction.SKIP),
                decision(ResolvedKeyword.keyword("boots"), BidAction.REVIEW)), List.of(SHOES, BOOTS), false);

        assertThat(changes).isEmpty();
    }
}
