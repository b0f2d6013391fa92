package com.adflux.services.adplatforms.middleware;

import com.adflux.services.adplatforms.constants.Platform;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * Per-attempt request record threaded through the request middleware.
 * Middleware returns a modified copy rather than mutating it.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "body")
public class RequestContext {

    private final Platform platform;
    private final String method;
    private final String endpoint;
    private final String requestId;
    private final Instant startTime;
    private final Object body;
    @Singular
    private final Map<String, String> headers;
    private final int retryCount;
}
