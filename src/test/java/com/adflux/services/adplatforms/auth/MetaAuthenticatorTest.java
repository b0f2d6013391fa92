package com.adflux.services.adplatforms.auth;

import com.adflux.services.adplatforms.auth.credentials.MetaCredentials;
import com.adflux.services.adplatforms.classifier.ErrorClassifier;
import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.ErrorType;
import com.adflux.services.adplatforms.exception.AuthenticationException;
import com.adflux.services.adplatforms.exception.PlatformApiException;
import com.adflux.services.adplatforms.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@DisplayName("MetaAuthenticator")
class MetaAuthenticatorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
    private final List<ClientRequest> requests = new ArrayList<>();

    private Function<ClientRequest, ClientResponse> graph;
    private MetaAuthenticator authenticator;
    private MetaCredentials credentials;

    @BeforeEach
    void setUp() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(graph.apply(request));
                })
                .build();
        authenticator = new MetaAuthenticator(webClient, new ErrorClassifier(new ObjectMapper()), clock);
        credentials = MetaCredentials.builder()
                .appId("1234567890").appSecret("app-secret").accessToken("EAAB-short")
                .build();
    }

    @Test
    @DisplayName("A short-lived user token is verified and exchanged for a long-lived one")
    void shortLivedUserTokenIsExchanged() {
        long inOneHour = clock.instant().plus(Duration.ofHours(1)).getEpochSecond();
        graph = request -> {
            if (request.url().getPath().endsWith("/debug_token")) {
                return json(HttpStatus.OK, "{\"data\": {\"is_valid\": true, \"type\": \"USER\", \"expires_at\": " + inOneHour + "}}");
            }
            if ("fb_exchange_token".equals(query(request, "grant_type"))) {
                return json(HttpStatus.OK, "{\"access_token\": \"EAAB-long\", \"expires_in\": 5184000}");
            }
            return json(HttpStatus.OK, "{\"access_token\": \"1234567890|app\"}");
        };

        AuthGrant grant = authenticator.authenticate(credentials);

        assertThat(grant.accessToken()).isEqualTo("EAAB-long");
        assertThat(grant.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofDays(60)));
        assertThat(requests).hasSize(3);
        assertThat(query(requests.get(0), "grant_type")).isEqualTo("client_credentials");
        assertThat(query(requests.get(1), "input_token")).isEqualTo("EAAB-short");
        assertThat(query(requests.get(1), "access_token")).isEqualTo("1234567890|app");
        assertThat(query(requests.get(2), "fb_exchange_token")).isEqualTo("EAAB-short");
    }

    @Test
    @DisplayName("A system-user token with expires_at 0 never expires and is not exchanged")
    void systemUserTokenNeverExpires() {
        graph = request -> request.url().getPath().endsWith("/debug_token")
                ? json(HttpStatus.OK, "{\"data\": {\"is_valid\": true, \"type\": \"SYSTEM_USER\", \"expires_at\": 0}}")
                : json(HttpStatus.OK, "{\"access_token\": \"1234567890|app\"}");

        AuthGrant grant = authenticator.authenticate(credentials);

        assertThat(grant.accessToken()).isEqualTo("EAAB-short");
        assertThat(grant.expiresAt()).isNull();
        assertThat(requests).hasSize(2);
    }

    @Test
    void invalidTokenIsRejected() {
        graph = request -> request.url().getPath().endsWith("/debug_token")
                ? json(HttpStatus.OK, "{\"data\": {\"is_valid\": false, \"type\": \"USER\"}}")
                : json(HttpStatus.OK, "{\"access_token\": \"1234567890|app\"}");

        AuthenticationException ex = catchThrowableOfType(
                () -> authenticator.authenticate(credentials), AuthenticationException.class);

        assertThat(ex.getErrorCode()).isEqualTo("META_TOKEN_INVALID");
    }

    @Test
    @DisplayName("Refresh re-exchanges a user token inside the seven day window")
    void refreshExchangesTokenCloseToExpiry() {
        long inThreeDays = clock.instant().plus(Duration.ofDays(3)).getEpochSecond();
        graph = request -> {
            if (request.url().getPath().endsWith("/debug_token")) {
                return json(HttpStatus.OK, "{\"data\": {\"is_valid\": true, \"type\": \"USER\", \"expires_at\": " + inThreeDays + "}}");
            }
            if ("fb_exchange_token".equals(query(request, "grant_type"))) {
                return json(HttpStatus.OK, "{\"access_token\": \"EAAB-renewed\"}");
            }
            return json(HttpStatus.OK, "{\"access_token\": \"1234567890|app\"}");
        };

        AuthGrant grant = authenticator.refresh(credentials, "EAAB-current");

        assertThat(grant.accessToken()).isEqualTo("EAAB-renewed");
        assertThat(grant.expiresAt()).isEqualTo(clock.instant().plus(AdPlatformConstants.META_LONG_LIVED_TOKEN_TTL));
        assertThat(query(requests.get(2), "fb_exchange_token")).isEqualTo("EAAB-current");
    }

    @Test
    void refreshKeepsAHealthyToken() {
        long inThirtyDays = clock.instant().plus(Duration.ofDays(30)).getEpochSecond();
        graph = request -> request.url().getPath().endsWith("/debug_token")
                ? json(HttpStatus.OK, "{\"data\": {\"is_valid\": true, \"type\": \"USER\", \"expires_at\": " + inThirtyDays + "}}")
                : json(HttpStatus.OK, "{\"access_token\": \"1234567890|app\"}");

        AuthGrant grant = authenticator.refresh(credentials, "EAAB-current");

        assertThat(grant.accessToken()).isEqualTo("EAAB-current");
        assertThat(grant.expiresAt()).isEqualTo(Instant.ofEpochSecond(inThirtyDays));
        assertThat(requests).hasSize(2);
    }

    @Test
    @DisplayName("Graph errors on the token endpoint are classified")
    void graphErrorIsClassified() {
        graph = request -> json(HttpStatus.BAD_REQUEST,
                "{\"error\": {\"code\": 190, \"message\": \"Error validating client secret\"}}");

        PlatformApiException ex = catchThrowableOfType(
                () -> authenticator.authenticate(credentials), PlatformApiException.class);

        assertThat(ex.getDetail().getCode()).isEqualTo("META_190");
        assertThat(ex.getDetail().getType()).isEqualTo(ErrorType.AUTH);
        assertThat(requests).hasSize(1);
    }

    private static String query(ClientRequest request, String name) {
        String value = UriComponentsBuilder.fromUri(request.url()).build(true).getQueryParams().getFirst(name);
        return value != null ? UriUtils.decode(value, StandardCharsets.UTF_8) : null;
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
