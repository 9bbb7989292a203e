package com.adsintel.optimizer.source;

import com.adsintel.optimizer.model.ApplyResult;
import com.adsintel.optimizer.model.KeywordCriterion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class GoogleAdsChangeApplier implements ChangeApplier {

    private final GoogleAdsApiClient apiClient;

    @Override
    public ApplyResult apply(KeywordCriterion criterion, long newBidMicros, String reason) {
        String resourceName = apiClient.criterionResourceName(criterion.adGroupId(), criterion.criterionId());
        try {
            apiClient.updateCpcBid(resourceName, newBidMicros);
            log.debug("Updated {} to {} micros: {}", resourceName, newBidMicros, reason);
            return ApplyResult.ok("cpc bid set to " + newBidMicros + " micros");
        } catch (Exception e) {
            log.error("Mutate failed for {}: {}", resourceName, e.getMessage());
            return ApplyResult.failed(e.getMessage());
        }
    }
}
