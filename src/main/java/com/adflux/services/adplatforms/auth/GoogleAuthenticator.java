package com.adflux.services.adplatforms.auth;

import com.adflux.services.adplatforms.auth.credentials.GoogleCredentials;
import com.adflux.services.adplatforms.auth.credentials.PlatformCredentials;
import com.adflux.services.adplatforms.classifier.ErrorClassifier;
import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.Platform;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Google OAuth2: every access token (1h) is minted from the stored refresh token.
 */
@Component
public class GoogleAuthenticator extends AbstractPlatformAuthenticator {

    static final String TOKEN_URL = "https://oauth2.googleapis.com/token";

    public GoogleAuthenticator(@Qualifier("authWebClient") WebClient webClient,
                               ErrorClassifier errorClassifier,
                               Clock clock) {
        super(webClient, errorClassifier, clock);
    }

    @Override
    public Platform platform() {
        return Platform.GOOGLE;
    }

    @Override
    public AuthGrant authenticate(PlatformCredentials credentials) {
        return mintAccessToken(cast(credentials, GoogleCredentials.class));
    }

    @Override
    public AuthGrant refresh(PlatformCredentials credentials, String currentToken) {
        return mintAccessToken(cast(credentials, GoogleCredentials.class));
    }

    private AuthGrant mintAccessToken(GoogleCredentials google) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("client_id", google.getClientId());
        form.add("client_secret", google.getClientSecret());
        form.add("refresh_token", google.getRefreshToken());

        Map<String, Object> body = postForm(TOKEN_URL, form);
        String token = requiredString(body, "access_token", "GOOGLE_TOKEN_FAILED");
        Long expiresIn = optionalLong(body, "expires_in");
        Duration ttl = expiresIn != null && expiresIn > 0 ? Duration.ofSeconds(expiresIn) : AdPlatformConstants.GOOGLE_TOKEN_TTL;
        return new AuthGrant(token, clock.instant().plus(ttl));
    }
}
