package com.adflux.services.adplatforms.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Logging sink for platform events. Runs on the event executor so slow
 * appenders never hold up a platform call.
 */
@Component
@Slf4j
public class PlatformEventLogListener {

    @Async("eventTaskExecutor")
    @EventListener
    public void onPlatformEvent(PlatformEvent event) {
        String platform = event.getPlatform() != null ? event.getPlatform().getValue() : "-";
        switch (event.getType()) {
            case API_ERROR, RATE_LIMIT ->
                    log.warn("[event] type={} platform={} requestId={} durationMs={} payload={}",
                            event.getType().getValue(), platform, event.getRequestId(),
                            event.getDurationMs(), event.getPayload());
            case AUTHENTICATION, AD_CREATED, AD_UPDATED, AD_DELETED ->
                    log.info("[event] type={} platform={} payload={}",
                            event.getType().getValue(), platform, event.getPayload());
            default ->
                    log.debug("[event] type={} platform={} requestId={} durationMs={}",
                            event.getType().getValue(), platform, event.getRequestId(), event.getDurationMs());
        }
    }
}
