package com.adflux.services.adplatforms.auth;

import com.adflux.services.adplatforms.auth.credentials.PlatformCredentials;
import com.adflux.services.adplatforms.config.AdPlatformsProperties;
import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.ErrorType;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.constants.PlatformEventType;
import com.adflux.services.adplatforms.dto.response.ApiErrorDetail;
import com.adflux.services.adplatforms.event.PlatformEventPublisher;
import com.adflux.services.adplatforms.exception.AdPlatformException;
import com.adflux.services.adplatforms.exception.NotAuthenticatedException;
import com.adflux.services.adplatforms.exception.PlatformApiException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-platform credential and token lifecycle.
 *
 * Flow:
 * ┌──────────────────┐  authenticate   ┌──────────────┐  save   ┌────────────┐
 * │ credentials       │ ──────────────► │ Authenticator│ ──────► │ TokenStore │
 * └──────────────────┘                  └──────────────┘         └────────────┘
 *          │                                                          │
 *          └── refresh timer fires at expiresAt - refreshThreshold ◄──┘
 *
 * authenticate, refresh and logout for one platform never interleave: each holds
 * that platform's lock for the whole mutation. Expiry is detected lazily on read
 * as well as by the timer.
 */
@Service
@Slf4j
public class AuthManager {

    private final TokenStore tokenStore;
    private final Map<Platform, PlatformAuthenticator> authenticators = new EnumMap<>(Platform.class);
    private final TaskScheduler refreshScheduler;
    private final Clock clock;
    private final PlatformEventPublisher eventPublisher;
    private final AdPlatformsProperties.Auth authProperties;

    private final Map<Platform, ReentrantLock> locks = new EnumMap<>(Platform.class);
    private final Map<Platform, PlatformCredentials> credentials = new ConcurrentHashMap<>();
    private final Map<Platform, ScheduledFuture<?>> refreshTimers = new ConcurrentHashMap<>();

    public AuthManager(TokenStore tokenStore,
                       List<PlatformAuthenticator> authenticators,
                       @Qualifier("authRefreshScheduler") TaskScheduler refreshScheduler,
                       Clock clock,
                       PlatformEventPublisher eventPublisher,
                       AdPlatformsProperties properties) {
        this.tokenStore = tokenStore;
        this.refreshScheduler = refreshScheduler;
        this.clock = clock;
        this.eventPublisher = eventPublisher;
        this.authProperties = properties.getAuth();
        for (PlatformAuthenticator authenticator : authenticators) {
            this.authenticators.put(authenticator.platform(), authenticator);
        }
        for (Platform platform : Platform.values()) {
            locks.put(platform, new ReentrantLock());
        }
    }

    // ========================
    // CREDENTIALS
    // ========================

    /**
     * Remember the credentials used for later authenticate/refresh calls.
     * A still-valid persisted token gets its refresh timer re-armed.
     */
    public void registerCredentials(PlatformCredentials platformCredentials) {
        Platform platform = platformCredentials.getPlatform();
        withLock(platform, () -> {
            credentials.put(platform, platformCredentials);
            tokenStore.load(platform)
                    .map(StoredAuth::state)
                    .filter(state -> state.isAuthenticated() && !state.isExpiredAt(clock.instant()))
                    .ifPresent(state -> {
                        log.info("Restored {} token from store, expiresAt={}", platform.getValue(), state.getExpiresAt());
                        scheduleRefresh(platform, state.getExpiresAt());
                    });
            return null;
        });
    }

    public boolean hasCredentials(Platform platform) {
        return credentials.containsKey(platform);
    }

    public Set<Platform> registeredPlatforms() {
        Set<Platform> platforms = EnumSet.noneOf(Platform.class);
        platforms.addAll(credentials.keySet());
        return platforms;
    }

    // ========================
    // AUTHENTICATE
    // ========================

    public AuthResult authenticate(PlatformCredentials platformCredentials) {
        Platform platform = platformCredentials.getPlatform();
        PlatformAuthenticator authenticator = authenticators.get(platform);
        if (authenticator == null) {
            return failed(platform, ApiErrorDetail.of(AdPlatformConstants.ERROR_AUTHENTICATION_FAILED,
                    "No authenticator available for " + platform.getValue(), platform, ErrorType.AUTH));
        }

        log.info("Authenticating {}", platform.getValue());
        try {
            AuthState state = withLock(platform, () -> {
                AuthGrant grant = authenticator.authenticate(platformCredentials);
                credentials.put(platform, platformCredentials);
                return storeGrant(platform, grant);
            });
            publishAuthEvent(platform, true, state.getExpiresAt(), null);
            log.info("Authenticated {}: expiresAt={}", platform.getValue(), state.getExpiresAt());
            return AuthResult.success(state);
        } catch (RuntimeException ex) {
            return failed(platform, toDetail(ex, platform));
        }
    }

    /** Authenticate again with the credentials registered for the platform */
    public AuthResult authenticate(Platform platform) {
        PlatformCredentials registered = credentials.get(platform);
        if (registered == null) {
            return failed(platform, noCredentials(platform));
        }
        return authenticate(registered);
    }

    // ========================
    // READ
    // ========================

    /**
     * True while a token is stored and not past its expiry. Reading an expired state
     * flips it to unauthenticated and persists the change.
     */
    public boolean isAuthenticated(Platform platform) {
        return withLock(platform, () -> currentState(platform)
                .map(AuthState::isAuthenticated)
                .orElse(false));
    }

    public Optional<AuthState> getAuthState(Platform platform) {
        return withLock(platform, () -> currentState(platform));
    }

    /** Token of an authenticated platform; empty when nothing valid is stored */
    public Optional<String> getToken(Platform platform) {
        return withLock(platform, () -> {
            boolean authenticated = currentState(platform).map(AuthState::isAuthenticated).orElse(false);
            if (!authenticated) {
                return Optional.<String>empty();
            }
            return tokenStore.load(platform).map(StoredAuth::token);
        });
    }

    public String requireToken(Platform platform) {
        return getToken(platform).orElseThrow(() -> new NotAuthenticatedException(platform));
    }

    // ========================
    // REFRESH
    // ========================

    public AuthResult refresh(Platform platform) {
        PlatformAuthenticator authenticator = authenticators.get(platform);
        if (authenticator == null || !authenticator.supportsRefresh()) {
            log.warn("Token refresh requested for {} which has no refresh flow", platform.getValue());
            return AuthResult.failure(ApiErrorDetail.of(AdPlatformConstants.ERROR_REFRESH_NOT_SUPPORTED,
                    "Token refresh is not supported for " + platform.getDisplayName(), platform, ErrorType.AUTH));
        }

        try {
            AuthState state = withLock(platform, () -> {
                PlatformCredentials registered = credentials.get(platform);
                if (registered == null) {
                    throw new PlatformApiException(noCredentials(platform));
                }
                String currentToken = tokenStore.load(platform).map(StoredAuth::token).orElse(null);
                AuthGrant grant = authenticator.refresh(registered, currentToken);
                return storeGrant(platform, grant);
            });
            publishAuthEvent(platform, true, state.getExpiresAt(), "refresh");
            log.info("Refreshed {} token: expiresAt={}", platform.getValue(), state.getExpiresAt());
            return AuthResult.success(state);
        } catch (RuntimeException ex) {
            ApiErrorDetail detail = toDetail(ex, platform);
            log.error("Token refresh failed for {}: {} - {}", platform.getValue(), detail.getCode(), detail.getMessage());
            publishAuthEvent(platform, false, null, "refresh");
            return AuthResult.failure(detail);
        }
    }

    /** Re-arm the refresh timer of an authenticated platform when none is pending */
    public void ensureRefreshScheduled(Platform platform) {
        withLock(platform, () -> {
            ScheduledFuture<?> pending = refreshTimers.get(platform);
            if (pending != null && !pending.isDone()) {
                return null;
            }
            currentState(platform)
                    .filter(AuthState::isAuthenticated)
                    .ifPresent(state -> scheduleRefresh(platform, state.getExpiresAt()));
            return null;
        });
    }

    // ========================
    // LOGOUT
    // ========================

    /**
     * Cancels the refresh timer and clears the stored state and token.
     * Registered credentials are kept so the platform can authenticate again.
     */
    public void logout(Platform platform) {
        withLock(platform, () -> {
            cancelRefresh(platform);
            tokenStore.delete(platform);
            return null;
        });
        publishAuthEvent(platform, false, null, "logout");
        log.info("Logged out of {}", platform.getValue());
    }

    public void logoutAll() {
        Set<Platform> platforms = EnumSet.noneOf(Platform.class);
        platforms.addAll(credentials.keySet());
        platforms.addAll(tokenStore.loadAll().keySet());
        platforms.forEach(this::logout);
    }

    @PreDestroy
    public void shutdown() {
        refreshTimers.keySet().forEach(this::cancelRefresh);
        log.info("Auth manager stopped, refresh timers cancelled");
    }

    // ========================
    // PRIVATE HELPERS
    // ========================

    /** Caller holds the platform lock */
    private Optional<AuthState> currentState(Platform platform) {
        Optional<StoredAuth> stored = tokenStore.load(platform);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        AuthState state = stored.get().state();
        if (state.isAuthenticated() && state.isExpiredAt(clock.instant())) {
            AuthState expired = state.expired();
            tokenStore.save(platform, stored.get().withState(expired));
            log.warn("{} token expired at {}", platform.getValue(), state.getExpiresAt());
            return Optional.of(expired);
        }
        return Optional.of(state);
    }

    /** Caller holds the platform lock */
    private AuthState storeGrant(Platform platform, AuthGrant grant) {
        AuthState state = AuthState.builder()
                .platform(platform)
                .authenticated(true)
                .expiresAt(grant.expiresAt())
                .lastRefreshed(clock.instant())
                .build();
        tokenStore.save(platform, new StoredAuth(state, grant.accessToken()));
        scheduleRefresh(platform, grant.expiresAt());
        return state;
    }

    /** Caller holds the platform lock */
    private void scheduleRefresh(Platform platform, Instant expiresAt) {
        cancelRefresh(platform);
        if (!authProperties.isAutoRefresh() || expiresAt == null) {
            return;
        }
        PlatformAuthenticator authenticator = authenticators.get(platform);
        if (authenticator == null || !authenticator.supportsRefresh()) {
            return;
        }
        Duration threshold = authProperties.getRefreshThreshold() != null
                ? authProperties.getRefreshThreshold()
                : AdPlatformConstants.DEFAULT_REFRESH_THRESHOLD;
        Instant now = clock.instant();
        Instant fireAt = expiresAt.minus(threshold);
        if (fireAt.isBefore(now)) {
            fireAt = now;
        }
        ScheduledFuture<?> future = refreshScheduler.schedule(() -> runScheduledRefresh(platform), fireAt);
        refreshTimers.put(platform, future);
        log.debug("Scheduled {} token refresh at {}", platform.getValue(), fireAt);
    }

    private void runScheduledRefresh(Platform platform) {
        refreshTimers.remove(platform);
        AuthResult result = refresh(platform);
        if (!result.isSuccess()) {
            log.warn("Scheduled refresh for {} failed: {}", platform.getValue(), result.getError().getMessage());
        }
    }

    private void cancelRefresh(Platform platform) {
        ScheduledFuture<?> pending = refreshTimers.remove(platform);
        if (pending != null) {
            pending.cancel(false);
        }
    }

    private <T> T withLock(Platform platform, Supplier<T> action) {
        ReentrantLock lock = locks.get(platform);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private AuthResult failed(Platform platform, ApiErrorDetail detail) {
        log.error("Authentication failed for {}: {} - {}", platform.getValue(), detail.getCode(), detail.getMessage());
        publishAuthEvent(platform, false, null, null);
        return AuthResult.failure(detail);
    }

    private ApiErrorDetail toDetail(RuntimeException ex, Platform platform) {
        if (ex instanceof PlatformApiException) {
            return ((PlatformApiException) ex).getDetail();
        }
        if (ex instanceof AdPlatformException) {
            return ApiErrorDetail.of(((AdPlatformException) ex).getErrorCode(), ex.getMessage(), platform, ErrorType.AUTH);
        }
        log.error("Unexpected error during authentication for {}", platform.getValue(), ex);
        return ApiErrorDetail.of(AdPlatformConstants.ERROR_AUTHENTICATION_FAILED,
                ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName(), platform, ErrorType.AUTH);
    }

    private ApiErrorDetail noCredentials(Platform platform) {
        return ApiErrorDetail.of(AdPlatformConstants.ERROR_NO_CREDENTIALS,
                "No credentials registered for " + platform.getDisplayName(), platform, ErrorType.AUTH);
    }

    private void publishAuthEvent(Platform platform, boolean success, Instant expiresAt, String action) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", success);
        if (action != null) payload.put("action", action);
        if (expiresAt != null) payload.put("expiresAt", expiresAt.toString());
        eventPublisher.publish(PlatformEventType.AUTHENTICATION, platform, payload);
    }
}
