package com.adsintel.optimizer.model;

/**
 * An enabled keyword criterion of the campaign, as needed to address a bid mutation.
 *
 * @param cpcBidMicros effective CPC bid in micros (1 currency unit = 1,000,000 micros)
 */
public record KeywordCriterion(long criterionId, long adGroupId, String text, long cpcBidMicros) {
}
