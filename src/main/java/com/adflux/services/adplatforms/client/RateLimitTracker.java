package com.adflux.services.adplatforms.client;

import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.dto.response.RateLimitSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.time.Clock;
import java.time.Instant;

/**
 * Request counter of one client instance, fed from platform rate-limit headers.
 *
 * Headers read:
 *   Meta    x-app-usage             {"call_count": 42, ...}  (percent of the app allowance)
 *   X       x-rate-limit-remaining / x-rate-limit-reset      (reset in epoch seconds)
 *   TikTok  x-ratelimit-remaining  / x-ratelimit-reset       (reset in epoch seconds)
 *
 * Without usable headers every response counts as one call.
 * Counters live in this instance only.
 */
@Slf4j
public class RateLimitTracker {

    static final String META_APP_USAGE = "x-app-usage";
    static final String X_REMAINING = "x-rate-limit-remaining";
    static final String X_RESET = "x-rate-limit-reset";
    static final String TIKTOK_REMAINING = "x-ratelimit-remaining";
    static final String TIKTOK_RESET = "x-ratelimit-reset";

    private final Platform platform;
    private final RateLimitProfile profile;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    private int count;
    private Instant resetAt;

    public RateLimitTracker(Platform platform, RateLimitProfile profile, Clock clock, ObjectMapper objectMapper) {
        this.platform = platform;
        this.profile = profile;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.resetAt = profile != null ? clock.instant().plus(profile.window()) : null;
    }

    public synchronized void recordResponse(HttpHeaders headers) {
        if (profile == null) return;
        rollWindowIfElapsed();

        Integer used = null;
        Integer remaining = null;
        Instant reset = null;

        switch (platform) {
            case META -> used = metaUsage(headers);
            case X -> {
                remaining = intHeader(headers, X_REMAINING);
                reset = epochSecondsHeader(headers, X_RESET);
            }
            case TIKTOK -> {
                remaining = intHeader(headers, TIKTOK_REMAINING);
                reset = epochSecondsHeader(headers, TIKTOK_RESET);
            }
            default -> {
            }
        }

        if (used != null) {
            count = used;
        } else if (remaining != null) {
            count = Math.max(0, profile.limit() - remaining);
        } else {
            count++;
        }
        if (reset != null) {
            resetAt = reset;
        }

        if (count >= profile.limit() * AdPlatformConstants.RATE_LIMIT_WARN_RATIO) {
            log.warn("{} rate limit nearly exhausted: {}/{} calls, window resets at {}",
                    platform.getValue(), count, profile.limit(), resetAt);
        }
    }

    /**
     * True once usage reaches 90% of the limit in the current window.
     * Always false right after the window rolls over.
     */
    public synchronized boolean isRateLimitNearExhaustion() {
        if (profile == null) return false;
        if (rollWindowIfElapsed()) return false;
        return count >= profile.limit() * AdPlatformConstants.RATE_LIMIT_WARN_RATIO;
    }

    public synchronized RateLimitSnapshot snapshot() {
        if (profile == null) return null;
        return RateLimitSnapshot.builder()
                .limit(profile.limit())
                .used(count)
                .resetAt(resetAt)
                .nearExhaustion(count >= profile.limit() * AdPlatformConstants.RATE_LIMIT_WARN_RATIO)
                .build();
    }

    private boolean rollWindowIfElapsed() {
        Instant now = clock.instant();
        if (resetAt == null || now.isAfter(resetAt)) {
            count = 0;
            resetAt = now.plus(profile.window());
            return true;
        }
        return false;
    }

    private Integer metaUsage(HttpHeaders headers) {
        String usage = headers.getFirst(META_APP_USAGE);
        if (usage == null) return null;
        try {
            JsonNode node = objectMapper.readTree(usage);
            JsonNode callCount = node.get("call_count");
            if (callCount == null || !callCount.isNumber()) return null;
            return (int) Math.floor(profile.limit() * callCount.asDouble() / 100.0);
        } catch (Exception ex) {
            log.debug("Ignoring unparseable {} header: {}", META_APP_USAGE, usage);
            return null;
        }
    }

    private Integer intHeader(HttpHeaders headers, String name) {
        String value = headers.getFirst(name);
        if (value == null) return null;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private Instant epochSecondsHeader(HttpHeaders headers, String name) {
        String value = headers.getFirst(name);
        if (value == null) return null;
        try {
            return Instant.ofEpochSecond(Long.parseLong(value.trim()));
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
