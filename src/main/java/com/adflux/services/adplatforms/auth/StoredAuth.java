package com.adflux.services.adplatforms.auth;

/**
 * What a token store keeps per platform.
 */
public record StoredAuth(AuthState state, String token) {

    public StoredAuth withState(AuthState newState) {
        return new StoredAuth(newState, token);
    }

    @Override
    public String toString() {
        return "StoredAuth[state=" + state + "]";
    }
}
