package com.adflux.services.adplatforms.service;

import com.adflux.services.adplatforms.adapter.PlatformAdapter;
import com.adflux.services.adplatforms.adapter.PlatformAdapterFactory;
import com.adflux.services.adplatforms.auth.AuthManager;
import com.adflux.services.adplatforms.auth.AuthResult;
import com.adflux.services.adplatforms.auth.AuthState;
import com.adflux.services.adplatforms.auth.credentials.PlatformCredentials;
import com.adflux.services.adplatforms.config.AdPlatformsProperties;
import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.ErrorType;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.constants.PlatformEventType;
import com.adflux.services.adplatforms.dto.request.AdCampaign;
import com.adflux.services.adplatforms.dto.request.AdCampaignUpdate;
import com.adflux.services.adplatforms.dto.response.ApiErrorDetail;
import com.adflux.services.adplatforms.dto.response.ApiResponse;
import com.adflux.services.adplatforms.event.PlatformEventPublisher;
import com.adflux.services.adplatforms.exception.AdapterNotInitializedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Single entry point for ad operations.
 *
 * Dispatches by platform to the registered adapter. Every exception is turned into
 * an {@link ApiResponse} error here; nothing thrown by an adapter or the transport
 * reaches the caller.
 *
 * Multi-platform calls fan out on the "adFanOutExecutor" pool. Each platform gets its
 * own response entry and a failure on one never affects the others.
 */
@Service
@Slf4j
public class AdPlatformService {

    private final PlatformAdapterFactory adapterFactory;
    private final AuthManager authManager;
    private final PlatformEventPublisher eventPublisher;
    private final Executor fanOutExecutor;
    private final Clock clock;
    private final Duration fanOutTimeout;

    private final Map<Platform, PlatformAdapter> adapters = new ConcurrentHashMap<>();

    public AdPlatformService(PlatformAdapterFactory adapterFactory,
                             AuthManager authManager,
                             PlatformEventPublisher eventPublisher,
                             @Qualifier("adFanOutExecutor") Executor fanOutExecutor,
                             Clock clock,
                             AdPlatformsProperties properties) {
        this.adapterFactory = adapterFactory;
        this.authManager = authManager;
        this.eventPublisher = eventPublisher;
        this.fanOutExecutor = fanOutExecutor;
        this.clock = clock;
        this.fanOutTimeout = properties.getFanOut().getTimeout();
    }

    // ========================
    // REGISTRATION
    // ========================

    /**
     * Register credentials and build the platform's adapter. Replaces any adapter
     * already registered for that platform; authentication happens on first use
     * or through {@link #initialize(Platform)}.
     */
    public PlatformAdapter registerAdapter(PlatformCredentials credentials,
                                           AdPlatformsProperties.ClientOverrides overrides) {
        Platform platform = credentials.getPlatform();
        authManager.registerCredentials(credentials);
        PlatformAdapter adapter = adapterFactory.create(credentials, overrides);
        PlatformAdapter previous = adapters.put(platform, adapter);
        log.info("{} adapter {}", platform.getDisplayName(), previous == null ? "registered" : "replaced");
        return adapter;
    }

    public ApiResponse<Map<String, Object>> initialize(Platform platform) {
        return dispatch(platform, "initialize", PlatformAdapter::initialize);
    }

    public List<Platform> getRegisteredPlatforms() {
        List<Platform> platforms = new ArrayList<>(adapters.keySet());
        Collections.sort(platforms);
        return platforms;
    }

    public boolean isRegistered(Platform platform) {
        return adapters.containsKey(platform);
    }

    public Optional<PlatformAdapter> getAdapter(Platform platform) {
        return Optional.ofNullable(adapters.get(platform));
    }

    // ========================
    // AUTH
    // ========================

    public ApiResponse<AuthState> getAuthStatus(Platform platform) {
        AuthState state = authManager.getAuthState(platform)
                .orElse(AuthState.builder().platform(platform).authenticated(false).build());
        return ApiResponse.success(state, platform.getDisplayName() + " auth status retrieved");
    }

    public ApiResponse<AuthState> refreshAuth(Platform platform) {
        AuthResult result = authManager.refresh(platform);
        if (!result.isSuccess()) {
            return ApiResponse.error(result.getError());
        }
        return ApiResponse.success(result.getState(), platform.getDisplayName() + " token refreshed");
    }

    public ApiResponse<Void> logout(Platform platform) {
        authManager.logout(platform);
        return ApiResponse.success(platform.getDisplayName() + " logged out");
    }

    // ========================
    // SINGLE-PLATFORM OPERATIONS
    // ========================

    public ApiResponse<Map<String, Object>> createAd(AdCampaign campaign) {
        if (campaign == null || campaign.getPlatform() == null) {
            return ApiResponse.error("Campaign platform is required", AdPlatformConstants.ERROR_INVALID_CAMPAIGN);
        }
        Platform platform = campaign.getPlatform();
        long started = clock.millis();
        ApiResponse<Map<String, Object>> response = dispatch(platform, "createAd", adapter -> adapter.createAd(campaign));

        if (response.isSuccessful()) {
            Map<String, Object> payload = new LinkedHashMap<>(response.getData());
            payload.put("campaignName", campaign.getName());
            eventPublisher.publish(PlatformEventType.AD_CREATED, platform, requestId(response),
                    clock.millis() - started, payload);
        }
        return response;
    }

    public ApiResponse<Map<String, Object>> updateAd(Platform platform, String adId, AdCampaignUpdate update) {
        ApiResponse<Map<String, Object>> response = dispatch(platform, "updateAd",
                adapter -> adapter.updateAd(adId, update));
        if (response.isSuccessful()) {
            eventPublisher.publish(PlatformEventType.AD_UPDATED, platform, response.getData());
        }
        return response;
    }

    public ApiResponse<Map<String, Object>> deleteAd(Platform platform, String adId) {
        ApiResponse<Map<String, Object>> response = dispatch(platform, "deleteAd", adapter -> adapter.deleteAd(adId));
        if (response.isSuccessful()) {
            eventPublisher.publish(PlatformEventType.AD_DELETED, platform, response.getData());
        }
        return response;
    }

    public ApiResponse<Map<String, Object>> getAdStatus(Platform platform, String adId) {
        return dispatch(platform, "getAdStatus", adapter -> adapter.getAdStatus(adId));
    }

    public ApiResponse<Map<String, Object>> getAdPerformance(Platform platform, String adId, List<String> metrics) {
        return dispatch(platform, "getAdPerformance", adapter -> adapter.getAdPerformance(adId, metrics));
    }

    // ========================
    // MULTI-PLATFORM OPERATIONS
    // ========================

    /**
     * Create the same campaign on every listed platform concurrently.
     * The result holds one entry per distinct platform, in request order.
     */
    public Map<Platform, ApiResponse<Map<String, Object>>> createMultiPlatformAd(AdCampaign baseCampaign,
                                                                                 List<Platform> platforms) {
        log.info("Creating ad '{}' on {} platform(s): {}",
                baseCampaign != null ? baseCampaign.getName() : null, platforms.size(), platforms);
        Map<Platform, Supplier<ApiResponse<Map<String, Object>>>> calls = new LinkedHashMap<>();
        for (Platform platform : platforms) {
            calls.put(platform, () -> baseCampaign == null
                    ? ApiResponse.error("Campaign is required", AdPlatformConstants.ERROR_INVALID_CAMPAIGN)
                    : createAd(baseCampaign.forPlatform(platform)));
        }
        return fanOut("createMultiPlatformAd", calls);
    }

    /**
     * Read performance for one ad per platform concurrently.
     */
    public Map<Platform, ApiResponse<Map<String, Object>>> getMultiPlatformPerformance(Map<Platform, String> adIds,
                                                                                       List<String> metrics) {
        Map<Platform, Supplier<ApiResponse<Map<String, Object>>>> calls = new LinkedHashMap<>();
        adIds.forEach((platform, adId) -> calls.put(platform, () -> getAdPerformance(platform, adId, metrics)));
        return fanOut("getMultiPlatformPerformance", calls);
    }

    // ========================
    // INTERNALS
    // ========================

    private <T> Map<Platform, ApiResponse<T>> fanOut(String operation,
                                                     Map<Platform, Supplier<ApiResponse<T>>> calls) {
        Map<Platform, CompletableFuture<ApiResponse<T>>> futures = new LinkedHashMap<>();
        calls.forEach((platform, call) -> futures.put(platform, submit(platform, operation, call)));

        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        Map<Platform, ApiResponse<T>> results = new LinkedHashMap<>();
        futures.forEach((platform, future) -> results.put(platform, future.join()));

        long succeeded = results.values().stream().filter(ApiResponse::isSuccessful).count();
        log.info("{} finished: {}/{} platform(s) succeeded", operation, succeeded, results.size());
        return results;
    }

    private <T> CompletableFuture<ApiResponse<T>> submit(Platform platform, String operation,
                                                         Supplier<ApiResponse<T>> call) {
        try {
            return CompletableFuture.supplyAsync(call, fanOutExecutor)
                    .orTimeout(fanOutTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> unwrap(ex) instanceof TimeoutException
                            ? timedOut(platform, operation)
                            : failed(platform, operation, unwrap(ex)));
        } catch (RejectedExecutionException ex) {
            log.error("{} on {} rejected by the fan-out pool: {}", operation, platform.getDisplayName(), ex.getMessage());
            return CompletableFuture.completedFuture(ApiResponse.error(ApiErrorDetail.of(
                    AdPlatformConstants.ERROR_API,
                    operation + " on " + platform.getDisplayName() + " was not started: fan-out pool is saturated",
                    platform, ErrorType.SERVER)));
        }
    }

    private <T> ApiResponse<T> dispatch(Platform platform, String operation,
                                        Function<PlatformAdapter, ApiResponse<T>> call) {
        try {
            PlatformAdapter adapter = adapters.get(platform);
            if (adapter == null) {
                throw new AdapterNotInitializedException(platform);
            }
            return call.apply(adapter);
        } catch (AdapterNotInitializedException ex) {
            log.warn("{} rejected: {}", operation, ex.getMessage());
            return ApiResponse.error(ApiErrorDetail.of(ex.getErrorCode(), ex.getMessage(), platform, ErrorType.VALIDATION));
        } catch (RuntimeException ex) {
            return failed(platform, operation, ex);
        }
    }

    private <T> ApiResponse<T> failed(Platform platform, String operation, Throwable ex) {
        log.error("{} failed on {}: {}", operation, platform.getDisplayName(), ex.getMessage(), ex);
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return ApiResponse.error(ApiErrorDetail.of(AdPlatformConstants.ERROR_API, message, platform));
    }

    private <T> ApiResponse<T> timedOut(Platform platform, String operation) {
        log.error("{} on {} did not finish within {}", operation, platform.getDisplayName(), fanOutTimeout);
        return ApiResponse.error(ApiErrorDetail.of(AdPlatformConstants.ERROR_TIMEOUT,
                operation + " on " + platform.getDisplayName() + " timed out after " + fanOutTimeout,
                platform, ErrorType.TIMEOUT));
    }

    private static Throwable unwrap(Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }

    private static String requestId(ApiResponse<?> response) {
        return response.getMeta() != null ? response.getMeta().getRequestId() : null;
    }
}
