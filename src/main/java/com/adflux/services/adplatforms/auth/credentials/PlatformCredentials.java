package com.adflux.services.adplatforms.auth.credentials;

import com.adflux.services.adplatforms.constants.Platform;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Credentials supplied when a platform adapter is registered.
 * Implementations never print secrets from {@code toString()}.
 */
public abstract class PlatformCredentials {

    private static final Set<String> PLACEHOLDER_VALUES = Set.of(
            "null", "undefined", "changeme", "your-app-id", "your-app-secret", "your-access-token");

    public abstract Platform getPlatform();

    /** Names of required fields that are missing, blank or unresolved placeholders */
    public abstract List<String> missingFields();

    protected static List<String> missing(Object... namesAndValues) {
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            Object value = namesAndValues[i + 1];
            if (value == null || (value instanceof String && isBlankOrPlaceholder((String) value))) {
                missing.add((String) namesAndValues[i]);
            }
        }
        return missing;
    }

    private static boolean isBlankOrPlaceholder(String value) {
        String trimmed = value.trim();
        return trimmed.isEmpty()
                || trimmed.startsWith("${")
                || PLACEHOLDER_VALUES.contains(trimmed.toLowerCase(Locale.ROOT));
    }
}
