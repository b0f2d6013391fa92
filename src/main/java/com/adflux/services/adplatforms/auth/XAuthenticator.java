package com.adflux.services.adplatforms.auth;

import com.adflux.services.adplatforms.auth.credentials.PlatformCredentials;
import com.adflux.services.adplatforms.auth.credentials.XCredentials;
import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.exception.AuthenticationException;
import org.springframework.stereotype.Component;

/**
 * X uses OAuth 1.0a user tokens: no expiry, nothing to refresh.
 * Requests are signed per call by OAuth1Signer.
 */
@Component
public class XAuthenticator implements PlatformAuthenticator {

    @Override
    public Platform platform() {
        return Platform.X;
    }

    @Override
    public AuthGrant authenticate(PlatformCredentials credentials) {
        if (!(credentials instanceof XCredentials)) {
            throw new AuthenticationException("Expected XCredentials for x", "X_INVALID_CREDENTIALS");
        }
        XCredentials x = (XCredentials) credentials;
        if (!x.missingFields().isEmpty()) {
            throw new AuthenticationException("Missing X credentials: " + x.missingFields(), "X_INVALID_CREDENTIALS");
        }
        return new AuthGrant(x.getAccessToken(), null);
    }

    @Override
    public AuthGrant refresh(PlatformCredentials credentials, String currentToken) {
        throw new AuthenticationException("X tokens cannot be refreshed", AdPlatformConstants.ERROR_REFRESH_NOT_SUPPORTED);
    }

    @Override
    public boolean supportsRefresh() {
        return false;
    }
}
