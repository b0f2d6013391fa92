package com.adflux.services.adplatforms.exception;

import lombok.Getter;

/**
 * Thrown when a platform refuses or cannot issue a token. Never retried automatically.
 */
@Getter
public class AuthenticationException extends AdPlatformException {

    public AuthenticationException(String message, String errorCode) {
        super(message, errorCode);
    }
}
