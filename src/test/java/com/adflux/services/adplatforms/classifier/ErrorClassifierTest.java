package com.adflux.services.adplatforms.classifier;

import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.ErrorType;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.dto.response.ApiErrorDetail;
import com.adflux.services.adplatforms.exception.PlatformErrorBodyException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ErrorClassifier")
class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier(new ObjectMapper());

    @Test
    @DisplayName("TikTok 429 with code 42900 is a retryable, namespaced rate limit")
    void tiktokRateLimitKeepsPlatformCode() {
        ApiErrorDetail detail = classifier.classify(
                response(429, "{\"code\": 42900, \"message\": \"Too many requests\"}"), Platform.TIKTOK);

        assertThat(detail.getCode()).isEqualTo("TIKTOK_42900");
        assertThat(detail.getType()).isEqualTo(ErrorType.RATE_LIMIT);
        assertThat(detail.isRetryable()).isTrue();
        assertThat(detail.isRateLimited()).isTrue();
        assertThat(detail.getHttpStatus()).isEqualTo(429);
        assertThat(detail.getPlatform()).isEqualTo(Platform.TIKTOK);
    }

    @Test
    @DisplayName("Meta code 190 on a 400 is an authentication error")
    void metaExpiredTokenIsAuth() {
        ApiErrorDetail detail = classifier.classify(
                response(400, "{\"error\": {\"code\": 190, \"message\": \"Error validating access token\"}}"),
                Platform.META);

        assertThat(detail.getCode()).isEqualTo("META_190");
        assertThat(detail.getType()).isEqualTo(ErrorType.AUTH);
        assertThat(detail.isAuthError()).isTrue();
        assertThat(detail.isRetryable()).isFalse();
        assertThat(detail.getRecommendedAction()).isEqualTo(ErrorType.AUTH.getRecommendedAction());
    }

    @Test
    @DisplayName("X errors array is read from the first entry")
    void xErrorsArray() {
        ApiErrorDetail detail = classifier.classify(
                response(400, "{\"errors\": [{\"code\": 88, \"message\": \"Rate limit exceeded\"}]}"), Platform.X);

        assertThat(detail.getCode()).isEqualTo("X_88");
        assertThat(detail.getType()).isEqualTo(ErrorType.RATE_LIMIT);
        assertThat(detail.isRetryable()).isTrue();
    }

    @Test
    @DisplayName("5xx without a body is a retryable server error")
    void serverErrorWithoutBody() {
        ApiErrorDetail detail = classifier.classify(response(503, ""), Platform.GOOGLE);

        assertThat(detail.getCode()).isEqualTo("GOOGLE_SERVER_ERROR");
        assertThat(detail.getType()).isEqualTo(ErrorType.SERVER);
        assertThat(detail.isRetryable()).isTrue();
    }

    @Test
    void notFoundWithoutKnownCode() {
        ApiErrorDetail detail = classifier.classify(response(404, "{}"), Platform.SNAPCHAT);

        assertThat(detail.getCode()).isEqualTo("SNAPCHAT_NOT_FOUND");
        assertThat(detail.getType()).isEqualTo(ErrorType.NOT_FOUND);
        assertThat(detail.isRetryable()).isFalse();
    }

    @Test
    @DisplayName("Unknown platform code on a 400 is not retried")
    void unknownCodeIsNotRetryable() {
        ApiErrorDetail detail = classifier.classify(
                response(400, "{\"error\": {\"code\": 99999, \"message\": \"Something odd\"}}"), Platform.META);

        assertThat(detail.getCode()).isEqualTo("META_99999");
        assertThat(detail.getMessage()).isEqualTo("Something odd");
        assertThat(detail.getType()).isEqualTo(ErrorType.UNKNOWN);
        assertThat(detail.isRetryable()).isFalse();
    }

    @Test
    @DisplayName("TikTok error reported inside a 200 body")
    void errorBodyOnSuccessStatus() {
        PlatformErrorBodyException ex = new PlatformErrorBodyException(200,
                Map.of("code", 40100, "message", "Access token is invalid"));

        ApiErrorDetail detail = classifier.classify(ex, Platform.TIKTOK);

        assertThat(detail.getCode()).isEqualTo("TIKTOK_40100");
        assertThat(detail.getType()).isEqualTo(ErrorType.AUTH);
        assertThat(detail.isAuthError()).isTrue();
    }

    @Test
    void connectionFailureIsNetwork() {
        WebClientRequestException ex = new WebClientRequestException(new ConnectException("Connection refused"),
                HttpMethod.GET, URI.create("https://graph.facebook.com/v18.0/me"), HttpHeaders.EMPTY);

        ApiErrorDetail detail = classifier.classify(ex, Platform.META);

        assertThat(detail.getCode()).isEqualTo(AdPlatformConstants.ERROR_NETWORK);
        assertThat(detail.getType()).isEqualTo(ErrorType.NETWORK);
        assertThat(detail.isRetryable()).isTrue();
    }

    @Test
    void timeoutIsRetryable() {
        ApiErrorDetail detail = classifier.classify(new TimeoutException("Did not observe any item"), Platform.X);

        assertThat(detail.getCode()).isEqualTo(AdPlatformConstants.ERROR_TIMEOUT);
        assertThat(detail.getType()).isEqualTo(ErrorType.TIMEOUT);
        assertThat(detail.isRetryable()).isTrue();
    }

    @Test
    @DisplayName("Open circuit is reported without retry")
    void openCircuit() {
        CircuitBreaker breaker = CircuitBreaker.ofDefaults("meta");
        breaker.transitionToOpenState();

        ApiErrorDetail detail = classifier.classify(
                CallNotPermittedException.createCallNotPermittedException(breaker), Platform.META);

        assertThat(detail.getCode()).isEqualTo("META_CIRCUIT_OPEN");
        assertThat(detail.isRetryable()).isFalse();
    }

    private static WebClientResponseException response(int status, String body) {
        return WebClientResponseException.create(status, "HTTP " + status, HttpHeaders.EMPTY,
                body.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);
    }
}
