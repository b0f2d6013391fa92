package com.adflux.services.adplatforms.adapter;

import com.adflux.services.adplatforms.auth.AuthManager;
import com.adflux.services.adplatforms.auth.AuthResult;
import com.adflux.services.adplatforms.client.PlatformHttpClient;
import com.adflux.services.adplatforms.client.RequestSigner;
import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.CampaignStatus;
import com.adflux.services.adplatforms.constants.ErrorType;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.dto.request.AdCampaign;
import com.adflux.services.adplatforms.dto.request.AdCampaignUpdate;
import com.adflux.services.adplatforms.dto.request.AdContent;
import com.adflux.services.adplatforms.dto.request.TargetAudience;
import com.adflux.services.adplatforms.dto.response.ApiErrorDetail;
import com.adflux.services.adplatforms.dto.response.ApiResponse;
import com.adflux.services.adplatforms.dto.response.RateLimitSnapshot;
import com.adflux.services.adplatforms.dto.response.ResponseMeta;
import com.adflux.services.adplatforms.exception.AdPlatformException;
import com.adflux.services.adplatforms.exception.InvalidCampaignException;
import com.adflux.services.adplatforms.exception.NotAuthenticatedException;
import com.adflux.services.adplatforms.exception.PlatformApiException;
import com.adflux.services.adplatforms.exception.ResourceCreationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.*;
import java.util.function.Supplier;

/**
 * Generic multi-step resource adapter.
 *
 * createAd runs the same algorithm on every platform:
 *   1. ensure authenticated, initializing if not
 *   2. platform prerequisites (account ids etc.)
 *   3. POST each {@link CreationStep} in order, threading the ids created so far
 *   4. answer {id, <parent ids>, status: pending}
 *
 * A step that fails after earlier steps succeeded raises {@link ResourceCreationException};
 * the ids created so far are returned in {@code meta.partialIds} and stay on the platform.
 *
 * Subclasses supply the creation graph, the update/delete/status/insights calls and a
 * {@link PlatformVocabulary}; everything else lives here.
 */
@Slf4j
public abstract class AbstractPlatformAdapter implements PlatformAdapter {

    public static final List<String> DEFAULT_METRICS =
            List.of("impressions", "clicks", "ctr", "reach", "spend", "conversions");

    protected final PlatformHttpClient client;
    protected final AuthManager authManager;
    protected final PlatformVocabulary vocabulary;
    protected final Clock clock;

    private volatile boolean accountResolved;

    protected AbstractPlatformAdapter(PlatformHttpClient client,
                                      AuthManager authManager,
                                      PlatformVocabulary vocabulary,
                                      Clock clock) {
        this.client = client;
        this.authManager = authManager;
        this.vocabulary = vocabulary;
        this.clock = clock;
    }

    // ========================
    // PLATFORM HOOKS
    // ========================

    /** Resolve account-level ids after authentication; returned entries are reported by initialize() */
    protected Map<String, Object> resolveAccount() {
        return new LinkedHashMap<>();
    }

    /** Adapter-level checks that must hold before any resource is created */
    protected void validatePrerequisites(AdCampaign campaign) {
    }

    protected abstract List<CreationStep> creationSteps(AdCampaign campaign);

    /** Patch whichever levels the update touches; returned entries are merged into the response */
    protected abstract Map<String, Object> applyUpdate(String adId, AdCampaignUpdate update);

    protected abstract Map<String, Object> removeAd(String adId);

    protected abstract PlatformAdState fetchStatus(String adId);

    /**
     * One insights row keyed by platform metric name. Money values are already in
     * major currency units.
     */
    protected abstract Map<String, Object> fetchInsights(String adId, List<String> fields,
                                                         LocalDate since, LocalDate until);

    protected Optional<BigDecimal> metricValue(String metric, Map<String, Object> row) {
        return toDecimal(row.get(vocabulary.metric(metric)));
    }

    // ========================
    // OPERATIONS
    // ========================

    @Override
    public Platform platform() {
        return client.getPlatform();
    }

    @Override
    public ApiResponse<Map<String, Object>> initialize() {
        log.info("Initializing {} adapter", label());
        AuthResult auth = authManager.authenticate(platform());
        if (!auth.isSuccess()) {
            log.error("{} authentication failed: {}", label(), auth.getError().getMessage());
            return ApiResponse.error(auth.getError());
        }
        return run("initialize", () -> {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("authenticated", true);
            data.putAll(resolveAccount());
            accountResolved = true;
            return ApiResponse.success(data, label() + " adapter initialized", client.lastResponseMeta());
        });
    }

    @Override
    public ApiResponse<Map<String, Object>> createAd(AdCampaign campaign) {
        return run("create ad", () -> {
            validateCampaign(campaign);
            ensureReady();
            validatePrerequisites(campaign);

            log.info("Creating ad on {}: campaign={}", label(), campaign.getName());
            long started = clock.millis();
            Map<String, String> ids = runCreationSteps(creationSteps(campaign));

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("id", ids.get("id"));
            ids.forEach((key, value) -> {
                if (!"id".equals(key)) data.put(key, value);
            });
            data.put("status", CampaignStatus.PENDING.getValue());
            data.put("platform", platform().getValue());
            data.put("createdAt", clock.instant().toString());

            log.info("Ad created on {} in {}ms: {}", label(), clock.millis() - started, ids);
            return ApiResponse.success(data, "Ad created on " + label(), client.lastResponseMeta());
        });
    }

    @Override
    public ApiResponse<Map<String, Object>> updateAd(String adId, AdCampaignUpdate update) {
        return run("update ad", () -> {
            requireAdId(adId);
            if (update == null || update.isEmpty()) {
                throw new InvalidCampaignException("Update for ad " + adId + " carries no changes");
            }
            ensureReady();

            log.info("Updating {} ad {}: {}", label(), adId, update);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("id", adId);
            data.putAll(applyUpdate(adId, update));
            if (update.getStatus() != null) {
                data.put("status", update.getStatus().getValue());
            }
            data.put("platform", platform().getValue());
            data.put("updatedAt", clock.instant().toString());
            return ApiResponse.success(data, "Ad updated on " + label(), client.lastResponseMeta());
        });
    }

    @Override
    public ApiResponse<Map<String, Object>> deleteAd(String adId) {
        return run("delete ad", () -> {
            requireAdId(adId);
            ensureReady();

            log.info("Deleting {} ad {}", label(), adId);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("id", adId);
            data.put("deleted", true);
            data.putAll(removeAd(adId));
            data.put("platform", platform().getValue());
            data.put("deletedAt", clock.instant().toString());
            return ApiResponse.success(data, "Ad deleted on " + label(), client.lastResponseMeta());
        });
    }

    @Override
    public ApiResponse<Map<String, Object>> getAdStatus(String adId) {
        return run("get ad status", () -> {
            requireAdId(adId);
            ensureReady();

            PlatformAdState state = fetchStatus(adId);
            CampaignStatus status = vocabulary.fromPlatformStatus(state.platformStatus());

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("id", adId);
            data.put("status", status.getValue());
            data.put("platformStatus", state.platformStatus());
            data.putAll(state.details());
            data.put("platform", platform().getValue());
            data.put("lastChecked", clock.instant().toString());
            log.debug("{} ad {} status: {} ({})", label(), adId, status.getValue(), state.platformStatus());
            return ApiResponse.success(data, "Ad status retrieved from " + label(), client.lastResponseMeta());
        });
    }

    @Override
    public ApiResponse<Map<String, Object>> getAdPerformance(String adId, List<String> metrics) {
        return run("get ad performance", () -> {
            requireAdId(adId);
            ensureReady();

            List<String> requested = metrics == null || metrics.isEmpty() ? DEFAULT_METRICS : metrics;
            LocalDate until = LocalDate.now(clock);
            LocalDate since = until.minusDays(vocabulary.getLookbackDays());

            Set<String> fields = new LinkedHashSet<>();
            requested.forEach(metric -> fields.add(vocabulary.metric(metric)));
            fields.add(vocabulary.metric("spend"));
            fields.add(vocabulary.metric("clicks"));
            fields.add(vocabulary.metric("conversions"));

            Map<String, Object> row = fetchInsights(adId, new ArrayList<>(fields), since, until);

            Map<String, Object> values = new LinkedHashMap<>();
            for (String metric : requested) {
                values.put(metric, metricValue(metric, row).orElse(BigDecimal.ZERO));
            }
            addDerivedMetrics(values, row);

            Map<String, Object> period = new LinkedHashMap<>();
            period.put("from", since.toString());
            period.put("to", until.toString());

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("id", adId);
            data.put("metrics", values);
            data.put("period", period);
            data.put("platform", platform().getValue());
            return ApiResponse.success(data, "Ad performance retrieved from " + label(), client.lastResponseMeta());
        });
    }

    @Override
    public boolean isRateLimitNearExhaustion() {
        return client.isRateLimitNearExhaustion();
    }

    @Override
    public RateLimitSnapshot rateLimitSnapshot() {
        return client.rateLimitSnapshot();
    }

    // ========================
    // SHARED HELPERS
    // ========================

    protected Map<String, String> runCreationSteps(List<CreationStep> steps) {
        Map<String, String> ids = new LinkedHashMap<>();
        Map<String, String> created = Collections.unmodifiableMap(ids);

        for (CreationStep step : steps) {
            Object payload = step.payload().apply(created);
            if (payload == null) {
                log.debug("{}: nothing to send for {}, skipping", label(), step.idKey());
                continue;
            }
            String endpoint = step.endpoint().apply(created);

            Map<String, Object> response;
            try {
                response = client.post(endpoint, payload);
            } catch (PlatformApiException ex) {
                if (ids.isEmpty()) {
                    throw ex;
                }
                throw new ResourceCreationException(label() + " failed creating " + step.idKey()
                        + ": " + ex.getMessage(), step.idKey(), ids, ex);
            }

            String id = JsonPaths.readString(response, step.idPath())
                    .orElseThrow(() -> new ResourceCreationException(label() + " returned no " + step.idKey()
                            + " (expected at '" + step.idPath() + "')", step.idKey(), ids));
            ids.put(step.idKey(), id);
            log.info("{} {} created: {}", label(), step.idKey(), id);
        }
        return ids;
    }

    protected void ensureReady() {
        if (!authManager.isAuthenticated(platform())) {
            log.info("{} not authenticated, initializing", label());
            ApiResponse<Map<String, Object>> init = initialize();
            if (!init.isSuccessful()) {
                throw new PlatformApiException(init.getError());
            }
        } else if (!accountResolved) {
            resolveAccount();
            accountResolved = true;
        }
    }

    /** Signer adding the platform's bearer token; tokens are read per request */
    protected RequestSigner bearerSigner() {
        Platform platform = client.getPlatform();
        return (method, uri) -> Map.of(HttpHeaders.AUTHORIZATION, "Bearer " + authManager.requireToken(platform));
    }

    protected String label() {
        return platform().getDisplayName();
    }

    /** The platform answered but holds no such resource */
    protected PlatformApiException notFound(String code, String message) {
        return new PlatformApiException(ApiErrorDetail.of(code, message, platform(), ErrorType.NOT_FOUND));
    }

    /** An account-level id the platform needs is neither configured nor resolvable */
    protected PlatformApiException notConfigured(String code, String message) {
        return new PlatformApiException(ApiErrorDetail.of(code, message, platform(), ErrorType.VALIDATION));
    }

    protected static TargetAudience audience(AdCampaign campaign) {
        return campaign.getTargetAudience() != null ? campaign.getTargetAudience() : TargetAudience.builder().build();
    }

    protected static String isoStart(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant().toString();
    }

    protected static String isoEnd(LocalDate date) {
        return date.atTime(23, 59, 59).toInstant(ZoneOffset.UTC).toString();
    }

    protected static Optional<BigDecimal> toDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return Optional.of((BigDecimal) value);
        }
        if (value instanceof Number) {
            return Optional.of(new BigDecimal(value.toString()));
        }
        if (value instanceof String && !((String) value).isBlank()) {
            try {
                return Optional.of(new BigDecimal(((String) value).trim()));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private void addDerivedMetrics(Map<String, Object> values, Map<String, Object> row) {
        Optional<BigDecimal> spend = metricValue("spend", row);
        if (spend.isEmpty()) {
            return;
        }
        metricValue("clicks", row)
                .filter(clicks -> clicks.signum() > 0)
                .ifPresent(clicks -> values.put("costPerClick", spend.get().divide(clicks, 2, RoundingMode.HALF_UP)));
        metricValue("conversions", row)
                .filter(conversions -> conversions.signum() > 0)
                .ifPresent(conversions -> values.put("costPerConversion",
                        spend.get().divide(conversions, 2, RoundingMode.HALF_UP)));
    }

    private void validateCampaign(AdCampaign campaign) {
        if (campaign == null) {
            throw new InvalidCampaignException("Campaign is required");
        }
        if (campaign.getName() == null || campaign.getName().isBlank()) {
            throw new InvalidCampaignException("Campaign name is required");
        }
        if (campaign.getBudget() == null || campaign.getBudget().signum() <= 0) {
            throw new InvalidCampaignException("Campaign budget must be positive");
        }
        if (campaign.getStartDate() == null || campaign.getEndDate() == null) {
            throw new InvalidCampaignException("Campaign start and end dates are required");
        }
        if (campaign.getEndDate().isBefore(campaign.getStartDate())) {
            throw new InvalidCampaignException("Campaign end date " + campaign.getEndDate()
                    + " is before start date " + campaign.getStartDate());
        }
        AdContent content = campaign.getContent();
        if (content == null || content.getLandingUrl() == null || content.getLandingUrl().isBlank()) {
            throw new InvalidCampaignException("Ad content with a landing URL is required");
        }
    }

    private static void requireAdId(String adId) {
        if (adId == null || adId.isBlank()) {
            throw new InvalidCampaignException("Ad id is required");
        }
    }

    private ApiResponse<Map<String, Object>> run(String operation, Supplier<ApiResponse<Map<String, Object>>> body) {
        client.clearResponseMeta();
        try {
            return body.get();
        } catch (RuntimeException ex) {
            return toErrorResponse(operation, ex);
        }
    }

    private ApiResponse<Map<String, Object>> toErrorResponse(String operation, RuntimeException ex) {
        ResponseMeta meta = client.lastResponseMeta();
        ApiErrorDetail detail;

        if (ex instanceof ResourceCreationException) {
            ResourceCreationException partial = (ResourceCreationException) ex;
            detail = partial.getCause() instanceof PlatformApiException
                    ? ((PlatformApiException) partial.getCause()).getDetail()
                    : ApiErrorDetail.of(partial.getErrorCode(), partial.getMessage(), platform(), ErrorType.UNKNOWN);
            meta.setPartialIds(partial.getPartialIds());
            log.error("{} creation stopped at {}; resources left on the platform: {}",
                    label(), partial.getStep(), partial.getPartialIds());
        } else if (ex instanceof PlatformApiException) {
            detail = ((PlatformApiException) ex).getDetail();
        } else if (ex instanceof InvalidCampaignException) {
            detail = ApiErrorDetail.of(((InvalidCampaignException) ex).getErrorCode(), ex.getMessage(),
                    platform(), ErrorType.VALIDATION);
        } else if (ex instanceof NotAuthenticatedException) {
            detail = ApiErrorDetail.of(((NotAuthenticatedException) ex).getErrorCode(), ex.getMessage(),
                    platform(), ErrorType.AUTH);
        } else if (ex instanceof AdPlatformException) {
            detail = ApiErrorDetail.of(((AdPlatformException) ex).getErrorCode(), ex.getMessage(),
                    platform(), ErrorType.UNKNOWN);
        } else {
            log.error("Unexpected error during {} on {}", operation, label(), ex);
            detail = ApiErrorDetail.of(AdPlatformConstants.ERROR_API,
                    ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName(),
                    platform(), ErrorType.UNKNOWN);
        }

        log.error("Failed to {} on {}: code={}, message={}", operation, label(), detail.getCode(), detail.getMessage());
        return ApiResponse.error(detail, meta);
    }
}
