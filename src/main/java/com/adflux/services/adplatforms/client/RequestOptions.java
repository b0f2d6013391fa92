package com.adflux.services.adplatforms.client;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Duration;
import java.util.Map;

/**
 * Per-request overrides. Unset values fall back to the client settings.
 */
@Getter
@Builder
public class RequestOptions {

    @Singular
    private final Map<String, String> queryParams;

    @Singular
    private final Map<String, String> headers;

    private final Duration timeout;

    private final Integer retries;

    public static RequestOptions none() {
        return RequestOptions.builder().build();
    }

    public static RequestOptions query(Map<String, String> params) {
        return RequestOptions.builder().queryParams(params).build();
    }
}
