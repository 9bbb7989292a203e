package com.adsintel.optimizer.source;

import com.adsintel.optimizer.config.BidOptimizerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GoogleAdsTokenProviderTest {

    private static final String TOKEN_URL = "https://oauth2.googleapis.com/token";

    private MockRestServiceServer server;
    private GoogleAdsTokenProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        BidOptimizerProperties properties = new BidOptimizerProperties();
        properties.getGoogleAds().setClientId("client");
        properties.getGoogleAds().setClientSecret("secret");
        properties.getGoogleAds().setRefreshToken("refresh");

        provider = new GoogleAdsTokenProvider(restTemplate, properties);
    }

    @Test
    void exchangesRefreshTokenOnceWhileValid() {
        server.expect(ExpectedCount.once(), requestTo(TOKEN_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().string(containsString("grant_type=refresh_token")))
                .andExpect(content().string(containsString("refresh_token=refresh")))
                .andRespond(withSuccess("{\"access_token\": \"tok-1\", \"expires_in\": 3599}",
                        MediaType.APPLICATION_JSON));

        assertThat(provider.accessToken()).isEqualTo("tok-1");
        assertThat(provider.accessToken()).isEqualTo("tok-1");
        server.verify();
    }

    @Test
    void responseWithoutTokenFails() {
        server.expect(requestTo(TOKEN_URL))
                .andRespond(withSuccess("{\"error\": \"invalid_grant\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.accessToken())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no access_token");
    }

    @Test
    void transportFailureIsWrapped() {
        server.expect(requestTo(TOKEN_URL)).andRespond(withServerError());

        assertThatThrownBy(() -> provider.accessToken())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("OAuth token refresh failed");
    }
}
