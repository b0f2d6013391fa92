package com.adflux.services.adplatforms.scheduler;

import com.adflux.services.adplatforms.auth.AuthManager;
import com.adflux.services.adplatforms.auth.AuthState;
import com.adflux.services.adplatforms.constants.Platform;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * ══════════════════════════════════════════════════════════════════
 * Token Maintenance Scheduler
 * ══════════════════════════════════════════════════════════════════
 *
 * Refresh timers live in memory and die with the process, and a platform
 * whose token lapsed while nobody called it still reads as authenticated
 * until someone looks. This sweep looks at every registered platform:
 *
 *   1. Reads the auth state, which flips lapsed tokens to unauthenticated
 *   2. Re-arms the refresh timer of authenticated platforms that lost it
 *   3. Warns about tokens expiring within 7 days
 *
 * SCHEDULE
 * ─────────
 *   Sweep: every 15 min (adplatforms.auth.maintenance-cron overrides)
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TokenMaintenanceScheduler {

    /** Days before expiry to start warning */
    private static final Duration EXPIRY_WARN_WINDOW = Duration.ofDays(7);

    private final AuthManager authManager;
    private final Clock clock;

    @Scheduled(cron = "${adplatforms.auth.maintenance-cron:0 */15 * * * *}")
    public void runTokenMaintenance() {
        log.debug("=== Token maintenance START ===");

        int healthy = 0, expiringSoon = 0, unauthenticated = 0, errors = 0;

        for (Platform platform : authManager.registeredPlatforms()) {
            try {
                switch (check(platform)) {
                    case HEALTHY:
                        healthy++;
                        break;
                    case EXPIRING_SOON:
                        expiringSoon++;
                        break;
                    default:
                        unauthenticated++;
                        break;
                }
            } catch (RuntimeException ex) {
                log.error("Token maintenance failed for {}: {}", platform.getValue(), ex.getMessage(), ex);
                errors++;
            }
        }

        log.info("=== Token maintenance DONE: healthy={}, expiringSoon={}, unauthenticated={}, errors={} ===",
                healthy, expiringSoon, unauthenticated, errors);
    }

    TokenHealth check(Platform platform) {
        Optional<AuthState> state = authManager.getAuthState(platform);
        if (state.isEmpty() || !state.get().isAuthenticated()) {
            log.debug("{}: not authenticated", platform.getValue());
            return TokenHealth.UNAUTHENTICATED;
        }

        authManager.ensureRefreshScheduled(platform);

        Instant expiresAt = state.get().getExpiresAt();
        if (expiresAt != null) {
            Duration remaining = Duration.between(clock.instant(), expiresAt);
            if (remaining.compareTo(EXPIRY_WARN_WINDOW) <= 0) {
                log.warn("{}: token expires in {}h (at {})", platform.getValue(), remaining.toHours(), expiresAt);
                return TokenHealth.EXPIRING_SOON;
            }
        }
        return TokenHealth.HEALTHY;
    }

    enum TokenHealth {
        HEALTHY, EXPIRING_SOON, UNAUTHENTICATED
    }
}
