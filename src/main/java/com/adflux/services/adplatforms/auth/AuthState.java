package com.adflux.services.adplatforms.auth;

import com.adflux.services.adplatforms.constants.Platform;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Authentication state of one platform.
 * authenticated=true holds only while expiresAt is absent or in the future;
 * {@link AuthManager} flips it lazily on read.
 */
@Getter
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Authentication state of a platform")
public class AuthState {

    private final Platform platform;

    @JsonProperty("isAuthenticated")
    private final boolean authenticated;

    @Schema(description = "Token expiry; absent when the token never expires")
    private final Instant expiresAt;

    private final Instant lastRefreshed;

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public AuthState expired() {
        return toBuilder().authenticated(false).build();
    }
}
