package com.adflux.services.adplatforms.client;

import java.time.Duration;

/**
 * Request allowance of a platform: {@code limit} calls per {@code window}.
 */
public record RateLimitProfile(int limit, Duration window) {
}
