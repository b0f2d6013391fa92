package com.adflux.services.adplatforms.middleware;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

@Getter
@Builder(toBuilder = true)
@ToString(exclude = "body")
public class ResponseContext {

    private final int statusCode;
    private final Map<String, Object> body;
    private final long durationMs;
    private final int retryCount;
}
