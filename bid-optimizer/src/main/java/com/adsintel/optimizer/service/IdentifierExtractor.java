package com.adsintel.optimizer.service;

import com.adsintel.optimizer.model.ClickIdentifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Pulls the click tracking id out of a landing URL.
 *
 * gclid wins over gbraid. Only the first occurrence of a repeated parameter counts,
 * blank values are treated as absent, and a URL that cannot be parsed simply has no id.
 */
@Component
@Slf4j
public class IdentifierExtractor {

    public Optional<ClickIdentifier> extract(String url) {
        if (url == null || url.isBlank()) return Optional.empty();

        MultiValueMap<String, String> params;
        try {
            params = UriComponentsBuilder.fromUriString(url.trim()).build().getQueryParams();
        } catch (RuntimeException e) {
            log.debug("Unparseable landing URL {}: {}", url, e.getMessage());
            return Optional.empty();
        }

        for (ClickIdentifier.Family family : ClickIdentifier.Family.values()) {
            String value = decode(params.getFirst(family.parameter()));
            if (value != null && !value.isBlank()) {
                return Optional.of(new ClickIdentifier(family, value));
            }
        }
        return Optional.empty();
    }

    private String decode(String raw) {
        if (raw == null) return null;
        try {
            return UriUtils.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // broken percent-escape, keep the raw token
            return raw;
        }
    }
}
