package com.adflux.services.adplatforms.event;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Redacts credentials and tokens from event payloads before they leave the service.
 *
 * Strings under a sensitive key keep their first and last four characters
 * ("EAAB...9xYz"); any other value under such a key becomes [REDACTED].
 */
@UtilityClass
public class PayloadSanitizer {

    private static final String REDACTED = "[REDACTED]";

    private static final Set<String> SENSITIVE_KEYS = Set.of(
            "apikey", "apisecret", "accesstoken", "refreshtoken", "credentials",
            "clientid", "clientsecret", "token", "password", "key", "secret",
            "access_token", "refresh_token", "client_secret", "client_id",
            "authorization", "access-token", "fb_exchange_token", "input_token"
    );

    public Map<String, Object> sanitize(Map<String, ?> payload) {
        if (payload == null) return Map.of();
        Map<String, Object> clean = new LinkedHashMap<>();
        payload.forEach((key, value) -> clean.put(key, sanitizeEntry(key, value)));
        return clean;
    }

    public boolean isSensitiveKey(String key) {
        return key != null && SENSITIVE_KEYS.contains(key.toLowerCase());
    }

    public String mask(String value) {
        if (value == null) return null;
        if (value.length() <= 8) return REDACTED;
        return value.substring(0, 4) + "..." + value.substring(value.length() - 4);
    }

    private Object sanitizeEntry(String key, Object value) {
        if (isSensitiveKey(key)) {
            return value instanceof String ? mask((String) value) : REDACTED;
        }
        return sanitizeValue(value);
    }

    @SuppressWarnings("unchecked")
    private Object sanitizeValue(Object value) {
        if (value instanceof Map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            ((Map<Object, Object>) value).forEach((k, v) -> nested.put(String.valueOf(k), sanitizeEntry(String.valueOf(k), v)));
            return nested;
        }
        if (value instanceof List) {
            List<Object> items = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                items.add(sanitizeValue(item));
            }
            return items;
        }
        return value;
    }
}
