package com.adflux.services.adplatforms.auth;

import com.adflux.services.adplatforms.auth.credentials.MetaCredentials;
import com.adflux.services.adplatforms.auth.credentials.PlatformCredentials;
import com.adflux.services.adplatforms.classifier.ErrorClassifier;
import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.exception.AuthenticationException;
import com.adflux.services.adplatforms.exception.PlatformApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Meta Graph API token lifecycle.
 *
 * authenticate:
 *   1. app token      GET /oauth/access_token?grant_type=client_credentials
 *   2. verify         GET /debug_token?input_token=...&access_token={app token}
 *   3. extend         GET /oauth/access_token?grant_type=fb_exchange_token  (user tokens not yet long-lived)
 *
 * refresh: re-verify; a user token that is invalid or within 7 days of expiry is
 * exchanged again. expires_at = 0 on a system-user token means it never expires.
 */
@Component
@Slf4j
public class MetaAuthenticator extends AbstractPlatformAuthenticator {

    static final String GRAPH_BASE_URL = "https://graph.facebook.com/v18.0";

    public MetaAuthenticator(@Qualifier("authWebClient") WebClient webClient,
                             ErrorClassifier errorClassifier,
                             Clock clock) {
        super(webClient, errorClassifier, clock);
    }

    @Override
    public Platform platform() {
        return Platform.META;
    }

    @Override
    public AuthGrant authenticate(PlatformCredentials credentials) {
        MetaCredentials meta = cast(credentials, MetaCredentials.class);
        String appToken = fetchAppToken(meta);
        TokenInfo info = debugToken(meta.getAccessToken(), appToken);

        if (!info.valid()) {
            throw new AuthenticationException("Meta access token is not valid", "META_TOKEN_INVALID");
        }

        AuthGrant grant = new AuthGrant(meta.getAccessToken(), info.expiresAt(clock.instant(), meta.isLongLivedToken()));
        if (!meta.isLongLivedToken() && info.isUserToken()) {
            try {
                grant = exchangeForLongLived(meta, meta.getAccessToken());
            } catch (PlatformApiException ex) {
                log.warn("Could not extend Meta token, keeping the short-lived one: {}", ex.getMessage());
            }
        }
        log.info("Meta token verified: type={}, expiresAt={}", info.type(), grant.expiresAt());
        return grant;
    }

    @Override
    public AuthGrant refresh(PlatformCredentials credentials, String currentToken) {
        MetaCredentials meta = cast(credentials, MetaCredentials.class);
        String token = currentToken != null ? currentToken : meta.getAccessToken();
        String appToken = fetchAppToken(meta);
        TokenInfo info = debugToken(token, appToken);

        Instant now = clock.instant();
        Instant expiresAt = info.expiresAt(now, true);
        boolean expiringSoon = expiresAt != null
                && expiresAt.isBefore(now.plus(AdPlatformConstants.META_REEXCHANGE_WINDOW));

        if (info.valid() && !expiringSoon) {
            return new AuthGrant(token, expiresAt);
        }
        if (info.isUserToken()) {
            log.info("Meta user token {} - exchanging for a new long-lived token",
                    info.valid() ? "expires within 7 days" : "is no longer valid");
            return exchangeForLongLived(meta, token);
        }
        throw new AuthenticationException("Meta token is invalid and cannot be extended", "META_TOKEN_INVALID");
    }

    /** GET /oauth/access_token?grant_type=fb_exchange_token */
    public AuthGrant exchangeForLongLived(MetaCredentials meta, String token) {
        URI uri = UriComponentsBuilder.fromHttpUrl(GRAPH_BASE_URL).path("/oauth/access_token")
                .queryParam("grant_type", "fb_exchange_token")
                .queryParam("client_id", meta.getAppId())
                .queryParam("client_secret", meta.getAppSecret())
                .queryParam("fb_exchange_token", token)
                .build().encode().toUri();
        Map<String, Object> body = getJson(uri);
        String longLived = requiredString(body, "access_token", "META_EXCHANGE_FAILED");
        Long expiresIn = optionalLong(body, "expires_in");
        Instant expiresAt = clock.instant().plus(expiresIn != null && expiresIn > 0
                ? java.time.Duration.ofSeconds(expiresIn)
                : AdPlatformConstants.META_LONG_LIVED_TOKEN_TTL);
        return new AuthGrant(longLived, expiresAt);
    }

    private String fetchAppToken(MetaCredentials meta) {
        URI uri = UriComponentsBuilder.fromHttpUrl(GRAPH_BASE_URL).path("/oauth/access_token")
                .queryParam("client_id", meta.getAppId())
                .queryParam("client_secret", meta.getAppSecret())
                .queryParam("grant_type", "client_credentials")
                .build().encode().toUri();
        return requiredString(getJson(uri), "access_token", "META_APP_TOKEN_FAILED");
    }

    @SuppressWarnings("unchecked")
    private TokenInfo debugToken(String inputToken, String appToken) {
        URI uri = UriComponentsBuilder.fromHttpUrl(GRAPH_BASE_URL).path("/debug_token")
                .queryParam("input_token", inputToken)
                .queryParam("access_token", appToken)
                .build().encode().toUri();
        Map<String, Object> body = getJson(uri);
        Object data = body.get("data");
        if (!(data instanceof Map)) {
            throw new AuthenticationException("debug_token response has no data", "META_TOKEN_INVALID");
        }
        Map<String, Object> info = (Map<String, Object>) data;
        return new TokenInfo(
                Boolean.TRUE.equals(info.get("is_valid")),
                optionalLong(info, "expires_at"),
                info.get("type") != null ? String.valueOf(info.get("type")) : null);
    }

    private record TokenInfo(boolean valid, Long expiresAtEpoch, String type) {

        boolean isUserToken() {
            return type == null || "USER".equalsIgnoreCase(type);
        }

        Instant expiresAt(Instant now, boolean longLived) {
            if (expiresAtEpoch != null && expiresAtEpoch > 0) {
                return Instant.ofEpochSecond(expiresAtEpoch);
            }
            if (expiresAtEpoch != null && !isUserToken()) {
                return null;
            }
            return now.plus(longLived
                    ? AdPlatformConstants.META_LONG_LIVED_TOKEN_TTL
                    : AdPlatformConstants.META_SHORT_LIVED_TOKEN_TTL);
        }
    }
}
