package com.adflux.services.adplatforms.client;

import com.adflux.services.adplatforms.classifier.ErrorBodyParser;
import com.adflux.services.adplatforms.classifier.ErrorClassifier;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.dto.response.ApiErrorDetail;
import com.adflux.services.adplatforms.dto.response.RateLimitSnapshot;
import com.adflux.services.adplatforms.dto.response.ResponseMeta;
import com.adflux.services.adplatforms.exception.AdPlatformException;
import com.adflux.services.adplatforms.exception.PlatformApiException;
import com.adflux.services.adplatforms.exception.PlatformErrorBodyException;
import com.adflux.services.adplatforms.middleware.ErrorContext;
import com.adflux.services.adplatforms.middleware.MiddlewarePipeline;
import com.adflux.services.adplatforms.middleware.RequestContext;
import com.adflux.services.adplatforms.middleware.ResponseContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * HTTP transport of one platform.
 *
 * Every attempt runs through the middleware pipeline and the platform's circuit breaker.
 * Failures are classified by {@link ErrorClassifier}; retryable ones (or ones an error
 * middleware marked as handled) are retried after {@link RetryPolicy} backoff until the
 * retry ceiling is reached, everything else surfaces at once as {@link PlatformApiException}.
 */
@Slf4j
public class PlatformHttpClient {

    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE =
            new ParameterizedTypeReference<>() {};

    private static final char[] ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

    @Getter
    private final ClientSettings settings;
    private final WebClient webClient;
    private final MiddlewarePipeline pipeline;
    private final ErrorClassifier classifier;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Clock clock;
    private final CircuitBreaker circuitBreaker;
    private final RateLimitTracker rateLimitTracker;

    private volatile RequestSigner signer = RequestSigner.NONE;
    // adapter operations are blocking, so the calling thread identifies the operation
    private final ThreadLocal<String> lastRequestId = new ThreadLocal<>();

    public PlatformHttpClient(ClientSettings settings,
                              WebClient webClient,
                              MiddlewarePipeline pipeline,
                              ErrorClassifier classifier,
                              RetryPolicy retryPolicy,
                              Sleeper sleeper,
                              Clock clock,
                              ObjectMapper objectMapper,
                              CircuitBreaker circuitBreaker) {
        this.settings = settings;
        this.webClient = webClient;
        this.pipeline = pipeline;
        this.classifier = classifier;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.clock = clock;
        this.circuitBreaker = circuitBreaker;
        this.rateLimitTracker = new RateLimitTracker(settings.getPlatform(), settings.getRateLimit(), clock, objectMapper);
    }

    public Platform getPlatform() {
        return settings.getPlatform();
    }

    public void setSigner(RequestSigner signer) {
        this.signer = signer != null ? signer : RequestSigner.NONE;
    }

    // ========================
    // Convenience verbs
    // ========================

    public Map<String, Object> get(String endpoint, Map<String, String> queryParams) {
        return request(HttpMethod.GET, endpoint, null, RequestOptions.query(queryParams));
    }

    public Map<String, Object> post(String endpoint, Object body) {
        return request(HttpMethod.POST, endpoint, body, RequestOptions.none());
    }

    public Map<String, Object> post(String endpoint, Object body, RequestOptions options) {
        return request(HttpMethod.POST, endpoint, body, options);
    }

    public Map<String, Object> put(String endpoint, Object body) {
        return request(HttpMethod.PUT, endpoint, body, RequestOptions.none());
    }

    public Map<String, Object> delete(String endpoint) {
        return request(HttpMethod.DELETE, endpoint, null, RequestOptions.none());
    }

    // ========================
    // Core request loop
    // ========================

    /**
     * Send one logical request, retrying per classification.
     *
     * @return the decoded JSON body, empty when the platform sent none
     * @throws PlatformApiException when the request failed for good
     */
    public Map<String, Object> request(HttpMethod method, String endpoint, Object body, RequestOptions options) {
        RequestOptions opts = options != null ? options : RequestOptions.none();
        int maxRetries = opts.getRetries() != null ? opts.getRetries() : settings.getRetries();
        Duration timeout = opts.getTimeout() != null ? opts.getTimeout() : settings.getTimeout();
        URI uri = buildUri(endpoint, opts.getQueryParams());
        String requestId = newRequestId();
        lastRequestId.set(requestId);

        if (rateLimitTracker.isRateLimitNearExhaustion()) {
            log.warn("{} is close to its rate limit; sending {} {} anyway", getPlatform().getValue(), method, endpoint);
        }

        for (int attempt = 0; ; attempt++) {
            RequestContext request = pipeline.processRequest(RequestContext.builder()
                    .platform(getPlatform())
                    .method(method.name())
                    .endpoint(endpoint)
                    .requestId(requestId)
                    .startTime(clock.instant())
                    .body(body)
                    .headers(resolveHeaders(method, uri, opts))
                    .retryCount(attempt)
                    .build());
            long started = clock.millis();

            try {
                ResponseEntity<Map<String, Object>> entity =
                        circuitBreaker.executeSupplier(() -> exchange(method, uri, request, timeout));
                rateLimitTracker.recordResponse(entity.getHeaders());

                Map<String, Object> payload = entity.getBody() != null ? entity.getBody() : new LinkedHashMap<>();
                if (ErrorBodyParser.carriesError(getPlatform(), payload)) {
                    throw new PlatformErrorBodyException(entity.getStatusCode().value(), payload);
                }

                ResponseContext response = pipeline.processResponse(request, ResponseContext.builder()
                        .statusCode(entity.getStatusCode().value())
                        .body(payload)
                        .durationMs(clock.millis() - started)
                        .retryCount(attempt)
                        .build());

                if (attempt > 0) {
                    log.info("{} {} succeeded after {} attempts [{}]", method, endpoint, attempt + 1, requestId);
                }
                return response.getBody();

            } catch (RuntimeException ex) {
                if (ex instanceof WebClientResponseException) {
                    rateLimitTracker.recordResponse(((WebClientResponseException) ex).getHeaders());
                }

                ApiErrorDetail detail = classifier.classify(ex, getPlatform());
                ErrorContext error = pipeline.processError(request, ErrorContext.builder()
                        .error(ex)
                        .detail(detail)
                        .durationMs(clock.millis() - started)
                        .retryCount(attempt)
                        .message(detail.getMessage())
                        .build());

                boolean handled = error == null;
                if ((handled || detail.isRetryable()) && attempt < maxRetries) {
                    long delay = retryPolicy.backoffMillis(attempt, detail.isRateLimited());
                    log.warn("{} {} failed (attempt {}/{}): {}. Retrying in {}ms",
                            method, endpoint, attempt + 1, maxRetries + 1, detail.getCode(), delay);
                    pause(delay, requestId);
                    continue;
                }

                ApiErrorDetail surfaced = handled ? detail : error.resolvedDetail();
                log.error("{} {} failed permanently after {} attempt(s): code={}, message={}",
                        method, endpoint, attempt + 1, surfaced.getCode(), surfaced.getMessage());
                throw new PlatformApiException(surfaced, ex);
            }
        }
    }

    public boolean isRateLimitNearExhaustion() {
        return rateLimitTracker.isRateLimitNearExhaustion();
    }

    public RateLimitSnapshot rateLimitSnapshot() {
        return rateLimitTracker.snapshot();
    }

    /**
     * Request id of the most recent call made from the calling thread, with the platform's
     * current rate-limit usage. Calls running on other threads never show up here.
     */
    public ResponseMeta lastResponseMeta() {
        return ResponseMeta.builder()
                .requestId(lastRequestId.get())
                .rateLimit(rateLimitTracker.snapshot())
                .build();
    }

    /** Forget the calling thread's request id, so a pooled thread starts its next operation clean */
    public void clearResponseMeta() {
        lastRequestId.remove();
    }

    // ════════════════════════════════════════════════════════════
    // PRIVATE
    // ════════════════════════════════════════════════════════════

    private ResponseEntity<Map<String, Object>> exchange(HttpMethod method, URI uri,
                                                         RequestContext request, Duration timeout) {
        WebClient.RequestBodySpec spec = webClient.method(method)
                .uri(uri)
                .headers(h -> request.getHeaders().forEach(h::set));
        WebClient.RequestHeadersSpec<?> ready = request.getBody() != null ? spec.bodyValue(request.getBody()) : spec;
        return ready.retrieve()
                .toEntity(MAP_TYPE)
                .timeout(timeout)
                .block();
    }

    private Map<String, String> resolveHeaders(HttpMethod method, URI uri, RequestOptions options) {
        Map<String, String> headers = new LinkedHashMap<>(settings.getHeaders());
        headers.putAll(options.getHeaders());
        if (settings.isWithCredentials()) {
            headers.putAll(signer.sign(method, uri));
        }
        return headers;
    }

    private URI buildUri(String endpoint, Map<String, String> queryParams) {
        String path = endpoint.startsWith("/") ? endpoint : "/" + endpoint;
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl()).path(path);
        queryParams.forEach((name, value) -> {
            if (value != null) builder.queryParam(name, value);
        });
        return builder.build().encode().toUri();
    }

    private void pause(long millis, String requestId) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AdPlatformException(requestId + " interrupted during retry backoff", "RETRY_INTERRUPTED", ie);
        }
    }

    private String newRequestId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(7);
        for (int i = 0; i < 7; i++) {
            suffix.append(ID_ALPHABET[random.nextInt(ID_ALPHABET.length)]);
        }
        return getPlatform().getValue() + "_" + clock.millis() + "_" + suffix;
    }
}
