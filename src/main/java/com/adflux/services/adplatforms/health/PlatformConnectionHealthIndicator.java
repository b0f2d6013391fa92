package com.adflux.services.adplatforms.health;

import com.adflux.services.adplatforms.adapter.PlatformAdapter;
import com.adflux.services.adplatforms.auth.AuthManager;
import com.adflux.services.adplatforms.auth.AuthState;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.dto.response.RateLimitSnapshot;
import com.adflux.services.adplatforms.service.AdPlatformService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Actuator "adPlatforms" health: auth state and rate-limit usage per registered platform.
 *
 * Read-only, no platform calls. Platforms authenticate lazily on first use, so an
 * unauthenticated platform is reported as a detail and never takes the service DOWN.
 */
@Component("adPlatforms")
@RequiredArgsConstructor
public class PlatformConnectionHealthIndicator implements HealthIndicator {

    private final AdPlatformService adPlatformService;
    private final AuthManager authManager;

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        int authenticated = 0;

        for (Platform platform : adPlatformService.getRegisteredPlatforms()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            boolean isAuthenticated = authManager.isAuthenticated(platform);
            if (isAuthenticated) authenticated++;
            entry.put("authenticated", isAuthenticated);
            authManager.getAuthState(platform)
                    .map(AuthState::getExpiresAt)
                    .ifPresent(expiresAt -> entry.put("expiresAt", expiresAt.toString()));

            adPlatformService.getAdapter(platform)
                    .map(PlatformAdapter::rateLimitSnapshot)
                    .ifPresent(snapshot -> entry.put("rateLimit", rateLimit(snapshot)));
            details.put(platform.getValue(), entry);
        }

        return Health.up()
                .withDetail("registered", details.size())
                .withDetail("authenticated", authenticated)
                .withDetail("platforms", details)
                .build();
    }

    private static Map<String, Object> rateLimit(RateLimitSnapshot snapshot) {
        Map<String, Object> rateLimit = new LinkedHashMap<>();
        rateLimit.put("limit", snapshot.getLimit());
        rateLimit.put("used", snapshot.getUsed());
        rateLimit.put("remaining", snapshot.getRemaining());
        rateLimit.put("nearExhaustion", snapshot.isNearExhaustion());
        if (snapshot.getResetAt() != null) {
            rateLimit.put("resetAt", snapshot.getResetAt().toString());
        }
        return rateLimit;
    }
}
