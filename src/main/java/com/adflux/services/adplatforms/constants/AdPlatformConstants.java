package com.adflux.services.adplatforms.constants;

import java.time.Duration;

/**
 * Application-wide constants for the ad platforms service
 */
public final class AdPlatformConstants {

    private AdPlatformConstants() {
        throw new IllegalStateException("Constants class cannot be instantiated");
    }

    // API Versioning
    public static final String API_V1 = "/api/v1";

    // Error codes not namespaced by platform
    public static final String ERROR_API = "API_ERROR";
    public static final String ERROR_NETWORK = "NETWORK_ERROR";
    public static final String ERROR_TIMEOUT = "TIMEOUT_ERROR";
    public static final String ERROR_NOT_INITIALIZED = "PLATFORM_NOT_INITIALIZED";
    public static final String ERROR_NOT_AUTHENTICATED = "NOT_AUTHENTICATED";
    public static final String ERROR_REFRESH_NOT_SUPPORTED = "REFRESH_NOT_SUPPORTED";
    public static final String ERROR_NO_CREDENTIALS = "NO_CREDENTIALS";
    public static final String ERROR_AUTHENTICATION_FAILED = "AUTHENTICATION_FAILED";
    public static final String ERROR_INVALID_CAMPAIGN = "INVALID_CAMPAIGN";
    public static final String ERROR_RESOURCE_CREATION = "RESOURCE_CREATION_FAILED";

    // Auth
    public static final Duration DEFAULT_REFRESH_THRESHOLD = Duration.ofSeconds(300);
    public static final Duration META_LONG_LIVED_TOKEN_TTL = Duration.ofDays(60);
    public static final Duration META_SHORT_LIVED_TOKEN_TTL = Duration.ofHours(2);
    public static final Duration META_REEXCHANGE_WINDOW = Duration.ofDays(7);
    public static final Duration GOOGLE_TOKEN_TTL = Duration.ofHours(1);
    public static final Duration DEFAULT_PLATFORM_TOKEN_TTL = Duration.ofHours(24);

    // Rate limits
    public static final double RATE_LIMIT_WARN_RATIO = 0.9;

    // Retry backoff
    public static final long BASE_DELAY_MS = 1_000L;
    public static final long RATE_LIMIT_DELAY_MS = 5_000L;
    public static final int NETWORK_RETRY_CEILING = 3;
}
