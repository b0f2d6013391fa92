package com.adflux.services.adplatforms.event;

import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.constants.PlatformEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Fire-and-forget emitter for platform events.
 * A failing listener never breaks the platform call that produced the event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlatformEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public void publish(PlatformEventType type, Platform platform, Map<String, ?> payload) {
        publish(type, platform, null, null, payload);
    }

    public void publish(PlatformEventType type, Platform platform, String requestId,
                        Long durationMs, Map<String, ?> payload) {
        PlatformEvent event = PlatformEvent.builder()
                .type(type)
                .platform(platform)
                .timestamp(clock.instant())
                .requestId(requestId)
                .durationMs(durationMs)
                .payload(PayloadSanitizer.sanitize(payload))
                .build();
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException ex) {
            log.warn("Dropping {} event for {}: listener failed: {}", type.getValue(),
                    platform != null ? platform.getValue() : "-", ex.getMessage());
        }
    }
}
