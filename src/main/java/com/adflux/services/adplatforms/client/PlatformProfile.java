package com.adflux.services.adplatforms.client;

import com.adflux.services.adplatforms.constants.Platform;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed transport defaults per platform. Configuration can override base URL,
 * timeout, retries and headers, never the rate-limit profile.
 *
 * ┌──────────┬─────────────────────────────────────────────────┬─────────┬─────────┬───────────────┐
 * │ platform │ base URL                                        │ timeout │ retries │ rate limit    │
 * ├──────────┼─────────────────────────────────────────────────┼─────────┼─────────┼───────────────┤
 * │ meta     │ https://graph.facebook.com/v18.0                │ 30s     │ 3       │ 200 / 1h      │
 * │ x        │ https://ads-api.twitter.com/12                  │ 30s     │ 2       │ 450 / 15min   │
 * │ google   │ https://googleads.googleapis.com/v15            │ 60s     │ 3       │ -             │
 * │ tiktok   │ https://business-api.tiktok.com/open_api/v1.3   │ 30s     │ 3       │ 1000 / 24h    │
 * │ snapchat │ https://adsapi.snapchat.com/v1                  │ 30s     │ 3       │ -             │
 * └──────────┴─────────────────────────────────────────────────┴─────────┴─────────┴───────────────┘
 */
@Getter
public final class PlatformProfile {

    private static final Map<Platform, PlatformProfile> PROFILES = new EnumMap<>(Platform.class);

    static {
        PROFILES.put(Platform.META, new PlatformProfile(Platform.META,
                "https://graph.facebook.com/v18.0", Duration.ofSeconds(30), 3,
                new RateLimitProfile(200, Duration.ofHours(1))));
        PROFILES.put(Platform.X, new PlatformProfile(Platform.X,
                "https://ads-api.twitter.com/12", Duration.ofSeconds(30), 2,
                new RateLimitProfile(450, Duration.ofMinutes(15))));
        PROFILES.put(Platform.GOOGLE, new PlatformProfile(Platform.GOOGLE,
                "https://googleads.googleapis.com/v15", Duration.ofSeconds(60), 3, null));
        PROFILES.put(Platform.TIKTOK, new PlatformProfile(Platform.TIKTOK,
                "https://business-api.tiktok.com/open_api/v1.3", Duration.ofSeconds(30), 3,
                new RateLimitProfile(1000, Duration.ofHours(24))));
        PROFILES.put(Platform.SNAPCHAT, new PlatformProfile(Platform.SNAPCHAT,
                "https://adsapi.snapchat.com/v1", Duration.ofSeconds(30), 3, null));
    }

    private final Platform platform;
    private final String baseUrl;
    private final Duration timeout;
    private final int retries;
    private final Map<String, String> defaultHeaders;
    private final RateLimitProfile rateLimit;

    private PlatformProfile(Platform platform, String baseUrl, Duration timeout, int retries,
                            RateLimitProfile rateLimit) {
        this.platform = platform;
        this.baseUrl = baseUrl;
        this.timeout = timeout;
        this.retries = retries;
        this.rateLimit = rateLimit;
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        headers.put(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        this.defaultHeaders = Collections.unmodifiableMap(headers);
    }

    public static PlatformProfile of(Platform platform) {
        return PROFILES.get(platform);
    }
}
