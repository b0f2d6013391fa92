package com.adflux.services.adplatforms.auth;

import com.adflux.services.adplatforms.auth.credentials.PlatformCredentials;
import com.adflux.services.adplatforms.constants.Platform;

/**
 * Platform-specific token acquisition used by {@link AuthManager}.
 * Implementations throw PlatformApiException or AuthenticationException on failure.
 */
public interface PlatformAuthenticator {

    Platform platform();

    AuthGrant authenticate(PlatformCredentials credentials);

    AuthGrant refresh(PlatformCredentials credentials, String currentToken);

    default boolean supportsRefresh() {
        return true;
    }
}
