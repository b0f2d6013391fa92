package com.adflux.services.adplatforms.client;

import com.adflux.services.adplatforms.constants.AdPlatformConstants;

/**
 * Exponential backoff between attempts.
 *
 * Retry n (0-based) waits BASE * 2^n:
 *   regular failures  1s, 2s, 4s ...
 *   rate limits       5s, 10s, 20s ...
 */
public final class RetryPolicy {

    private static final RetryPolicy DEFAULT =
            new RetryPolicy(AdPlatformConstants.BASE_DELAY_MS, AdPlatformConstants.RATE_LIMIT_DELAY_MS);

    private final long baseDelayMs;
    private final long rateLimitDelayMs;

    public RetryPolicy(long baseDelayMs, long rateLimitDelayMs) {
        this.baseDelayMs = baseDelayMs;
        this.rateLimitDelayMs = rateLimitDelayMs;
    }

    public static RetryPolicy defaults() {
        return DEFAULT;
    }

    public long backoffMillis(int attempt, boolean rateLimited) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got " + attempt);
        }
        long base = rateLimited ? rateLimitDelayMs : baseDelayMs;
        return base * (1L << attempt);
    }
}
