package com.adsintel.optimizer.service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses ad-group-ad resource names returned by the Ads API.
 *
 * Grammar (anchored, whole string):
 * <pre>
 *   path     := [ prefix "/" ] "adGroupAds/" adGroupId "~" adId
 *   prefix   := any characters, e.g. "customers/1234567890"
 *   adGroupId, adId := one or more ASCII digits
 * </pre>
 * Example: {@code customers/1234567890/adGroupAds/111~222} gives ad group 111, ad 222.
 */
public final class AdGroupAdPathParser {

    private static final Pattern PATH = Pattern.compile("^(?:.*/)?adGroupAds/([0-9]+)~([0-9]+)$");

    private AdGroupAdPathParser() {
    }

    public static Result parse(String resourceName) {
        if (resourceName == null || resourceName.isBlank()) {
            return Result.failure(resourceName, "empty resource name");
        }
        Matcher m = PATH.matcher(resourceName.trim());
        if (!m.matches()) {
            return Result.failure(resourceName, "expected .../adGroupAds/{adGroupId}~{adId}");
        }
        try {
            return Result.success(resourceName, Long.parseLong(m.group(1)), Long.parseLong(m.group(2)));
        } catch (NumberFormatException e) {
            return Result.failure(resourceName, "id out of range");
        }
    }

    /**
     * Either both ids or an error. Ids are only meaningful when {@link #valid()} is true.
     */
    public record Result(String input, boolean valid, long adGroupId, long adId, String error) {

        static Result success(String input, long adGroupId, long adId) {
            return new Result(input, true, adGroupId, adId, null);
        }

        static Result failure(String input, String error) {
            return new Result(input, false, 0L, 0L, error);
        }
    }
}
