package com.adsintel.optimizer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw DTO matching the Google Ads REST googleAds:search response.
 * Only the fields our GAQL queries select are mapped.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GoogleAdsSearchResponse {

    private List<Row> results = new ArrayList<>();

    private String nextPageToken;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Row {
        private ClickView clickView;
        private AdGroup adGroup;
        private AdGroupCriterion adGroupCriterion;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClickView {
        private String gclid;

        /** Resource name, e.g. customers/123/adGroupAds/456~789 */
        private String adGroupAd;

        private KeywordInfo keywordInfo;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AdGroup {
        private Long id;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AdGroupCriterion {
        private Long criterionId;
        private String status;
        private KeywordInfo keyword;
        private Long cpcBidMicros;
        private Long effectiveCpcBidMicros;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KeywordInfo {
        private String text;
        private String matchType;
    }
}
