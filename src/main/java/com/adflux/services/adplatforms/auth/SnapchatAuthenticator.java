package com.adflux.services.adplatforms.auth;

import com.adflux.services.adplatforms.auth.credentials.PlatformCredentials;
import com.adflux.services.adplatforms.auth.credentials.SnapchatCredentials;
import com.adflux.services.adplatforms.classifier.ErrorClassifier;
import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.exception.AuthenticationException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Snapchat Marketing API OAuth2. With a refresh token every authentication mints
 * a fresh access token; without one the supplied token is trusted for 24h.
 */
@Component
public class SnapchatAuthenticator extends AbstractPlatformAuthenticator {

    static final String TOKEN_URL = "https://accounts.snapchat.com/login/oauth2/access_token";

    public SnapchatAuthenticator(@Qualifier("authWebClient") WebClient webClient,
                                 ErrorClassifier errorClassifier,
                                 Clock clock) {
        super(webClient, errorClassifier, clock);
    }

    @Override
    public Platform platform() {
        return Platform.SNAPCHAT;
    }

    @Override
    public AuthGrant authenticate(PlatformCredentials credentials) {
        SnapchatCredentials snap = cast(credentials, SnapchatCredentials.class);
        if (canRefresh(snap)) {
            return refreshGrant(snap);
        }
        if (snap.getAccessToken() == null || snap.getAccessToken().isBlank()) {
            throw new AuthenticationException("Snapchat access token is required", "SNAPCHAT_INVALID_CREDENTIALS");
        }
        return new AuthGrant(snap.getAccessToken(),
                clock.instant().plus(AdPlatformConstants.DEFAULT_PLATFORM_TOKEN_TTL));
    }

    @Override
    public AuthGrant refresh(PlatformCredentials credentials, String currentToken) {
        SnapchatCredentials snap = cast(credentials, SnapchatCredentials.class);
        if (!canRefresh(snap)) {
            throw new AuthenticationException(
                    "Snapchat token expired and no refresh token is configured; authorize the account again",
                    "SNAPCHAT_TOKEN_EXPIRED");
        }
        return refreshGrant(snap);
    }

    private AuthGrant refreshGrant(SnapchatCredentials snap) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("client_id", snap.getClientId());
        form.add("client_secret", snap.getClientSecret());
        form.add("refresh_token", snap.getRefreshToken());

        Map<String, Object> body = postForm(TOKEN_URL, form);
        String token = requiredString(body, "access_token", "SNAPCHAT_TOKEN_EXPIRED");
        Long expiresIn = optionalLong(body, "expires_in");
        Duration ttl = expiresIn != null && expiresIn > 0
                ? Duration.ofSeconds(expiresIn) : AdPlatformConstants.DEFAULT_PLATFORM_TOKEN_TTL;
        return new AuthGrant(token, clock.instant().plus(ttl));
    }

    private boolean canRefresh(SnapchatCredentials snap) {
        return notBlank(snap.getRefreshToken()) && notBlank(snap.getClientId()) && notBlank(snap.getClientSecret());
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
