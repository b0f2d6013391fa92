package com.adflux.services.adplatforms.client;

import com.adflux.services.adplatforms.config.AdPlatformsProperties;
import com.adflux.services.adplatforms.constants.Platform;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Effective transport settings of one client: the platform profile with the
 * configured overrides applied.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ClientSettings {

    private final Platform platform;
    private final String baseUrl;
    private final Duration timeout;
    private final int retries;
    private final Map<String, String> headers;
    private final boolean withCredentials;
    private final RateLimitProfile rateLimit;

    public static ClientSettings defaults(Platform platform) {
        return resolve(platform, null);
    }

    public static ClientSettings resolve(Platform platform, AdPlatformsProperties.ClientOverrides overrides) {
        PlatformProfile profile = PlatformProfile.of(platform);
        Map<String, String> headers = new LinkedHashMap<>(profile.getDefaultHeaders());

        ClientSettingsBuilder builder = ClientSettings.builder()
                .platform(platform)
                .baseUrl(profile.getBaseUrl())
                .timeout(profile.getTimeout())
                .retries(profile.getRetries())
                .withCredentials(true)
                .rateLimit(profile.getRateLimit());

        if (overrides != null) {
            if (overrides.getBaseUrl() != null && !overrides.getBaseUrl().isBlank()) {
                builder.baseUrl(overrides.getBaseUrl());
            }
            if (overrides.getTimeout() != null) {
                builder.timeout(overrides.getTimeout());
            }
            if (overrides.getRetries() != null) {
                builder.retries(overrides.getRetries());
            }
            if (overrides.getWithCredentials() != null) {
                builder.withCredentials(overrides.getWithCredentials());
            }
            if (overrides.getHeaders() != null) {
                headers.putAll(overrides.getHeaders());
            }
        }
        return builder.headers(Collections.unmodifiableMap(headers)).build();
    }
}
