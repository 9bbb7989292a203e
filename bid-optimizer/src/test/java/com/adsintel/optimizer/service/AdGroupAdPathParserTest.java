package com.adsintel.optimizer.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class AdGroupAdPathParserTest {

    @Test
    void parsesFullResourceName() {
        AdGroupAdPathParser.Result result = AdGroupAdPathParser.parse("customers/1234567890/adGroupAds/111~222");

        assertThat(result.valid()).isTrue();
        assertThat(result.adGroupId()).isEqualTo(111L);
        assertThat(result.adId()).isEqualTo(222L);
        assertThat(result.error()).isNull();
    }

    @Test
    void prefixIsOptional() {
        AdGroupAdPathParser.Result result = AdGroupAdPathParser.parse("adGroupAds/5~6");

        assertThat(result.valid()).isTrue();
        assertThat(result.adGroupId()).isEqualTo(5L);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "customers/1/adGroups/111",
            "customers/1/adGroupAds/111",
            "customers/1/adGroupAds/abc~222",
            "customers/1/adGroupAds/111~",
            "customers/1/adGroupAds/111~222/extra",
            "customers/1/adGroupAds/99999999999999999999~1"
    })
    void rejectsMalformedPaths(String path) {
        AdGroupAdPathParser.Result result = AdGroupAdPathParser.parse(path);

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).isNotBlank();
        assertThat(result.input()).isEqualTo(path);
    }

    @Test
    void nullIsAFailureNotAnException() {
        assertThat(AdGroupAdPathParser.parse(null).valid()).isFalse();
    }
}
