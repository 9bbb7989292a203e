package com.adsintel.optimizer.service;

import com.adsintel.optimizer.model.ApplyResult;
import com.adsintel.optimizer.model.BidChange;
import com.adsintel.optimizer.model.Decision;
import com.adsintel.optimizer.model.KeywordCriterion;
import com.adsintel.optimizer.model.ResolvedKeyword;
import com.adsintel.optimizer.source.ChangeApplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Prices bid-moving decisions and, outside dry-run, pushes them to the campaign.
 *
 * Each keyword is handled on its own: a failed mutation is recorded against that
 * keyword and the loop moves on.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BidChangeService {

    private final BidAdjuster bidAdjuster;
    private final ChangeApplier changeApplier;

    public Map<ResolvedKeyword, BidChange> apply(Collection<Decision> decisions,
                                                 List<KeywordCriterion> criteria,
                                                 boolean dryRun) {
        Map<String, KeywordCriterion> byText = new LinkedHashMap<>();
        for (KeywordCriterion c : criteria) {
            // A keyword text can exist in several ad groups; the first one listed is adjusted.
            byText.putIfAbsent(c.text(), c);
        }

        Map<ResolvedKeyword, BidChange> changes = new LinkedHashMap<>();
        int applied = 0;
        int failed = 0;

        for (Decision decision : decisions) {
            if (!decision.getAction().changesBid()) continue;

            ResolvedKeyword keyword = decision.getKeyword();
            KeywordCriterion criterion = keyword.isKeyword() ? byText.get(keyword.label()) : null;
            if (criterion == null) {
                changes.put(keyword, BidChange.builder()
                        .keyword(keyword)
                        .status(BidChange.ApplyStatus.NO_CRITERION)
                        .message("no enabled keyword criterion in campaign")
                        .build());
                continue;
            }

            OptionalLong proposed = bidAdjuster.proposeMicros(decision.getAction(), criterion.cpcBidMicros());
            if (proposed.isEmpty()) {
                changes.put(keyword, BidChange.builder()
                        .keyword(keyword)
                        .criterionId(criterion.criterionId())
                        .currentBid(BidAdjuster.fromMicros(criterion.cpcBidMicros()))
                        .status(BidChange.ApplyStatus.NO_CRITERION)
                        .message("criterion has no positive CPC bid to adjust")
                        .build());
                continue;
            }

            long newMicros = proposed.getAsLong();
            BidChange.BidChangeBuilder change = BidChange.builder()
                    .keyword(keyword)
                    .criterionId(criterion.criterionId())
                    .currentBid(BidAdjuster.fromMicros(criterion.cpcBidMicros()))
                    .newBid(BidAdjuster.fromMicros(newMicros));

            if (dryRun) {
                changes.put(keyword, change.status(BidChange.ApplyStatus.DRY_RUN)
                        .message("dry run, not applied").build());
                continue;
            }

            ApplyResult result;
            try {
                result = changeApplier.apply(criterion, newMicros, decision.getReason());
            } catch (RuntimeException e) {
                result = ApplyResult.failed(e.getMessage());
            }

            if (result.success()) {
                applied++;
                log.info("Bid for '{}' {} {} -> {} ({})", keyword, decision.getAction(),
                        criterion.cpcBidMicros(), newMicros, decision.getReason());
                changes.put(keyword, change.status(BidChange.ApplyStatus.APPLIED).message(result.message()).build());
            } else {
                failed++;
                log.warn("Bid change for '{}' failed: {}", keyword, result.message());
                changes.put(keyword, change.status(BidChange.ApplyStatus.FAILED).message(result.message()).build());
            }
        }

        log.info("Bid changes: {} proposed, {} applied, {} failed (dryRun={})",
                changes.size(), applied, failed, dryRun);
        return changes;
    }
}
