package com.adflux.services.adplatforms.auth;

import com.adflux.services.adplatforms.auth.credentials.SnapchatCredentials;
import com.adflux.services.adplatforms.classifier.ErrorClassifier;
import com.adflux.services.adplatforms.exception.AuthenticationException;
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
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@DisplayName("SnapchatAuthenticator")
class SnapchatAuthenticatorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
    private final Deque<ClientResponse> responses = new ArrayDeque<>();
    private final List<ClientRequest> requests = new ArrayList<>();

    private SnapchatAuthenticator authenticator;
    private final SnapchatCredentials credentials = SnapchatCredentials.builder()
            .clientId("snap-client").clientSecret("snap-secret")
            .accessToken("snap-token").refreshToken("snap-refresh")
            .adAccountId("acc-1")
            .build();

    @BeforeEach
    void setUp() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(responses.removeFirst());
                })
                .build();
        authenticator = new SnapchatAuthenticator(webClient, new ErrorClassifier(new ObjectMapper()), clock);
    }

    @Test
    @DisplayName("With a refresh token, authentication mints a fresh access token")
    void authenticateRefreshesWhenPossible() {
        responses.add(json("{\"access_token\": \"snap-fresh\", \"expires_in\": 1800, \"refresh_token\": \"snap-refresh\"}"));

        AuthGrant grant = authenticator.authenticate(credentials);

        assertThat(grant.accessToken()).isEqualTo("snap-fresh");
        assertThat(grant.expiresAt()).isEqualTo(clock.instant().plusSeconds(1800));
        assertThat(requests.get(0).url().toString()).isEqualTo(SnapchatAuthenticator.TOKEN_URL);
    }

    @Test
    void withoutRefreshTokenTheSuppliedTokenIsTrustedForADay() {
        AuthGrant grant = authenticator.authenticate(credentials.toBuilder().refreshToken(null).build());

        assertThat(grant.accessToken()).isEqualTo("snap-token");
        assertThat(grant.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofHours(24)));
        assertThat(requests).isEmpty();
    }

    @Test
    void refreshWithoutRefreshTokenFails() {
        AuthenticationException ex = catchThrowableOfType(
                () -> authenticator.refresh(credentials.toBuilder().clientSecret(" ").build(), "snap-token"),
                AuthenticationException.class);

        assertThat(ex.getErrorCode()).isEqualTo("SNAPCHAT_TOKEN_EXPIRED");
        assertThat(requests).isEmpty();
    }

    private static ClientResponse json(String body) {
        return ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
