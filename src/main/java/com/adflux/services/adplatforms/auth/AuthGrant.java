package com.adflux.services.adplatforms.auth;

import java.time.Instant;

/**
 * Token issued by a platform. A null expiry means the token does not expire.
 */
public record AuthGrant(String accessToken, Instant expiresAt) {

    @Override
    public String toString() {
        return "AuthGrant[expiresAt=" + expiresAt + "]";
    }
}
