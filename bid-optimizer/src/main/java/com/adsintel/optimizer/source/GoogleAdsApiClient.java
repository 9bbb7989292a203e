package com.adsintel.optimizer.source;

import com.adsintel.optimizer.config.BidOptimizerProperties;
import com.adsintel.optimizer.model.GoogleAdsSearchResponse;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Thin client over the Google Ads REST API.
 *
 * Only two calls are needed: GAQL search (paged through nextPageToken) and the
 * ad group criterion mutate used to change CPC bids. 429 and 5xx responses are
 * retried by Resilience4j with exponential backoff (see application.yml).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GoogleAdsApiClient {

    private final RestTemplate restTemplate;
    private final BidOptimizerProperties properties;
    private final GoogleAdsTokenProvider tokenProvider;

    /**
     * Run a GAQL query against the login customer and return every row.
     */
    @Retry(name = "googleAds")
    public List<GoogleAdsSearchResponse.Row> search(String query) {
        String url = customerUrl() + "/googleAds:search";
        List<GoogleAdsSearchResponse.Row> rows = new ArrayList<>();
        String pageToken = null;

        do {
            SearchRequest request = new SearchRequest(query, pageToken);
            log.debug("GAQL: {} (page {})", query, pageToken);
            GoogleAdsSearchResponse page = restTemplate.postForObject(url, new HttpEntity<>(request, headers()),
                    GoogleAdsSearchResponse.class);
            if (page == null) break;
            if (page.getResults() != null) rows.addAll(page.getResults());
            pageToken = page.getNextPageToken();
        } while (pageToken != null && !pageToken.isBlank());

        log.debug("GAQL returned {} rows", rows.size());
        return rows;
    }

    /**
     * Update the CPC bid of one keyword criterion.
     *
     * @return the raw API response (contains the updated resource name)
     */
    @Retry(name = "googleAds")
    public JsonNode updateCpcBid(String criterionResourceName, long cpcBidMicros) {
        String url = customerUrl() + "/adGroupCriteria:mutate";
        MutateRequest request = new MutateRequest(List.of(new MutateOperation(
                new CriterionUpdate(criterionResourceName, Long.toString(cpcBidMicros)),
                "cpcBidMicros")));
        try {
            return restTemplate.postForObject(url, new HttpEntity<>(request, headers()), JsonNode.class);
        } catch (HttpClientErrorException.BadRequest e) {
            // Policy / validation errors will not succeed on retry
            throw new BidMutationRejectedException(e.getResponseBodyAsString(), e);
        }
    }

    public String criterionResourceName(long adGroupId, long criterionId) {
        return "customers/" + properties.getGoogleAds().customerId() + "/adGroupCriteria/" + adGroupId + "~" + criterionId;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String customerUrl() {
        BidOptimizerProperties.GoogleAds cfg = properties.getGoogleAds();
        return cfg.getBaseUrl() + "/" + cfg.getApiVersion() + "/customers/" + cfg.customerId();
    }

    private HttpHeaders headers() {
        BidOptimizerProperties.GoogleAds cfg = properties.getGoogleAds();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(tokenProvider.accessToken());
        headers.set("developer-token", cfg.getDeveloperToken());
        headers.set("login-customer-id", cfg.customerId());
        return headers;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SearchRequest(String query, String pageToken) {}

    public record MutateRequest(List<MutateOperation> operations) {}

    public record MutateOperation(CriterionUpdate update, String updateMask) {}

    public record CriterionUpdate(String resourceName, String cpcBidMicros) {}

    public static class BidMutationRejectedException extends RuntimeException {
        public BidMutationRejectedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
