package com.adflux.services.adplatforms.exception;

import lombok.Getter;

import java.util.Map;

/**
 * Raised by the transport when a platform answers with a success status but the
 * body describes an application error (TikTok code != 0, Meta error object).
 * Never leaves the transport: it is classified like any other failed response.
 */
@Getter
public class PlatformErrorBodyException extends RuntimeException {

    private final int statusCode;
    private final transient Map<String, Object> body;

    public PlatformErrorBodyException(int statusCode, Map<String, Object> body) {
        super("Platform reported an error in a " + statusCode + " response");
        this.statusCode = statusCode;
        this.body = body;
    }
}
