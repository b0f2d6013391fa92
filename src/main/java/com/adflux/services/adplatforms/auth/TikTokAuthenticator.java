package com.adflux.services.adplatforms.auth;

import com.adflux.services.adplatforms.auth.credentials.PlatformCredentials;
import com.adflux.services.adplatforms.auth.credentials.TikTokCredentials;
import com.adflux.services.adplatforms.classifier.ErrorClassifier;
import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.exception.AuthenticationException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * TikTok Marketing API tokens. The supplied access token is trusted for 24h;
 * refresh needs app id, secret and refresh token.
 */
@Component
public class TikTokAuthenticator extends AbstractPlatformAuthenticator {

    static final String REFRESH_URL = "https://business-api.tiktok.com/open_api/v1.3/oauth2/refresh_token/";

    public TikTokAuthenticator(@Qualifier("authWebClient") WebClient webClient,
                               ErrorClassifier errorClassifier,
                               Clock clock) {
        super(webClient, errorClassifier, clock);
    }

    @Override
    public Platform platform() {
        return Platform.TIKTOK;
    }

    @Override
    public AuthGrant authenticate(PlatformCredentials credentials) {
        TikTokCredentials tiktok = cast(credentials, TikTokCredentials.class);
        if (tiktok.getAccessToken() == null || tiktok.getAccessToken().isBlank()) {
            throw new AuthenticationException("TikTok access token is required", "TIKTOK_INVALID_CREDENTIALS");
        }
        return new AuthGrant(tiktok.getAccessToken(),
                clock.instant().plus(AdPlatformConstants.DEFAULT_PLATFORM_TOKEN_TTL));
    }

    @Override
    @SuppressWarnings("unchecked")
    public AuthGrant refresh(PlatformCredentials credentials, String currentToken) {
        TikTokCredentials tiktok = cast(credentials, TikTokCredentials.class);
        if (isBlank(tiktok.getRefreshToken()) || isBlank(tiktok.getAppId()) || isBlank(tiktok.getSecret())) {
            throw new AuthenticationException(
                    "TikTok token expired and no refresh token is configured; authorize the advertiser again",
                    "TIKTOK_TOKEN_EXPIRED");
        }

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("app_id", tiktok.getAppId());
        request.put("secret", tiktok.getSecret());
        request.put("refresh_token", tiktok.getRefreshToken());
        request.put("grant_type", "refresh_token");

        Map<String, Object> body = postJson(REFRESH_URL, request);
        Object data = body.get("data");
        Map<String, Object> payload = data instanceof Map ? (Map<String, Object>) data : Map.of();
        String token = requiredString(payload, "access_token", "TIKTOK_TOKEN_EXPIRED");
        Long expiresIn = optionalLong(payload, "expires_in");
        Duration ttl = expiresIn != null && expiresIn > 0
                ? Duration.ofSeconds(expiresIn) : AdPlatformConstants.DEFAULT_PLATFORM_TOKEN_TTL;
        return new AuthGrant(token, clock.instant().plus(ttl));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
