package com.adflux.services.adplatforms.event;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PayloadSanitizerTest {

    @Test
    void longTokensKeepTheirEnds() {
        Map<String, Object> clean = PayloadSanitizer.sanitize(Map.of("access_token", "EAABwzLixnjYBAOZBZC9xYz"));

        assertThat(clean).containsEntry("access_token", "EAAB...9xYz");
    }

    @Test
    void shortSecretsAndNonStringValuesAreRedacted() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("secret", "abc123");
        payload.put("credentials", Map.of("appId", "123", "appSecret", "s3cr3t-value"));

        Map<String, Object> clean = PayloadSanitizer.sanitize(payload);

        assertThat(clean).containsEntry("secret", "[REDACTED]");
        assertThat(clean).containsEntry("credentials", "[REDACTED]");
    }

    @Test
    void keysMatchCaseInsensitively() {
        Map<String, Object> clean = PayloadSanitizer.sanitize(Map.of("Authorization", "Bearer abcdefghijkl"));

        assertThat(clean).containsEntry("Authorization", "Bear...ijkl");
    }

    @Test
    @SuppressWarnings("unchecked")
    void nestedMapsAndListsAreWalked() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("endpoint", "oauth/access_token");
        payload.put("request", Map.of("client_id", "snap-client-1234", "grant_type", "refresh_token"));
        payload.put("items", List.of(Map.of("token", "0123456789abcdef"), "plain"));

        Map<String, Object> clean = PayloadSanitizer.sanitize(payload);

        assertThat(clean).containsEntry("endpoint", "oauth/access_token");
        Map<String, Object> request = (Map<String, Object>) clean.get("request");
        assertThat(request).containsEntry("client_id", "snap...1234").containsEntry("grant_type", "refresh_token");
        List<Object> items = (List<Object>) clean.get("items");
        assertThat((Map<String, Object>) items.get(0)).containsEntry("token", "0123...cdef");
        assertThat(items.get(1)).isEqualTo("plain");
    }

    @Test
    void nullPayloadBecomesEmpty() {
        assertThat(PayloadSanitizer.sanitize(null)).isEmpty();
    }
}
