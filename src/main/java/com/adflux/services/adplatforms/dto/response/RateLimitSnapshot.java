package com.adflux.services.adplatforms.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.time.Instant;

/**
 * Point-in-time view of a client's rate-limit counter
 */
@Getter
@AllArgsConstructor
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RateLimitSnapshot {

    private final int limit;
    private final int used;
    private final Instant resetAt;
    private final boolean nearExhaustion;

    public int getRemaining() {
        return Math.max(0, limit - used);
    }
}
