package com.adflux.services.adplatforms.event;

import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.constants.PlatformEventType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * Application event describing one observable step of a platform interaction.
 * The payload is sanitized before the event is built.
 */
@Getter
@Builder
@ToString
public class PlatformEvent {

    private final PlatformEventType type;
    private final Platform platform;
    private final Instant timestamp;
    private final String requestId;
    private final Long durationMs;
    private final Map<String, Object> payload;
}
