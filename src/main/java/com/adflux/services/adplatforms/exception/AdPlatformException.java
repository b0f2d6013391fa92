package com.adflux.services.adplatforms.exception;

import lombok.Getter;

/**
 * Base exception for all ad platform service exceptions
 */
@Getter
public class AdPlatformException extends RuntimeException {

    private final String errorCode;

    public AdPlatformException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public AdPlatformException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
