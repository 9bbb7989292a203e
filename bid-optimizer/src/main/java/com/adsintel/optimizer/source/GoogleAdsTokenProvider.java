package com.adsintel.optimizer.source;

import com.adsintel.optimizer.config.BidOptimizerProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;

/**
 * Exchanges the configured OAuth refresh token for short-lived access tokens.
 * Tokens are cached until a minute before they expire.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GoogleAdsTokenProvider {

    private static final long EXPIRY_MARGIN_SECONDS = 60;

    private final RestTemplate restTemplate;
    private final BidOptimizerProperties properties;

    private String accessToken;
    private Instant expiresAt = Instant.EPOCH;

    public synchronized String accessToken() {
        if (accessToken != null && Instant.now().isBefore(expiresAt)) {
            return accessToken;
        }

        BidOptimizerProperties.GoogleAds cfg = properties.getGoogleAds();
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("client_id", cfg.getClientId());
        form.add("client_secret", cfg.getClientSecret());
        form.add("refresh_token", cfg.getRefreshToken());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        try {
            JsonNode body = restTemplate.postForObject(cfg.getTokenUrl(), new HttpEntity<>(form, headers), JsonNode.class);
            if (body == null || !body.hasNonNull("access_token")) {
                throw new IllegalStateException("OAuth token response has no access_token");
            }
            accessToken = body.get("access_token").asText();
            long ttl = body.path("expires_in").asLong(3600);
            expiresAt = Instant.now().plusSeconds(Math.max(0, ttl - EXPIRY_MARGIN_SECONDS));
            log.debug("Refreshed Google Ads access token, valid for {}s", ttl);
            return accessToken;
        } catch (RestClientException e) {
            throw new IllegalStateException("OAuth token refresh failed: " + e.getMessage(), e);
        }
    }
}
