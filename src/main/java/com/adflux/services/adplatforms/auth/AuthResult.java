package com.adflux.services.adplatforms.auth;

import com.adflux.services.adplatforms.dto.response.ApiErrorDetail;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of authenticate or refresh: either the new state or the reason it failed.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthResult {

    private final boolean success;
    private final AuthState state;
    private final ApiErrorDetail error;

    public static AuthResult success(AuthState state) {
        return new AuthResult(true, state, null);
    }

    public static AuthResult failure(ApiErrorDetail error) {
        return new AuthResult(false, null, error);
    }
}
