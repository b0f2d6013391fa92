package com.adflux.services.adplatforms.constants;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Advertising platforms reachable through the integration layer.
 * The lower-case value is the wire tag used by callers.
 */
public enum Platform {
    META("meta", "Meta"),
    X("x", "X"),
    GOOGLE("google", "Google Ads"),
    TIKTOK("tiktok", "TikTok"),
    SNAPCHAT("snapchat", "Snapchat");

    private final String value;
    private final String displayName;

    Platform(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Prefix used for platform-namespaced error codes, e.g. META_190 */
    public String errorPrefix() {
        return name();
    }

    @JsonCreator
    public static Platform fromValue(String value) {
        for (Platform platform : Platform.values()) {
            if (platform.value.equalsIgnoreCase(value) || platform.name().equalsIgnoreCase(value)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + value);
    }
}
