package com.adflux.services.adplatforms.middleware;

import com.adflux.services.adplatforms.constants.PlatformEventType;
import com.adflux.services.adplatforms.event.PlatformEventPublisher;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@Order(10)
@RequiredArgsConstructor
public class RateLimitErrorMiddleware implements ErrorMiddleware {

    private final PlatformEventPublisher eventPublisher;

    @Override
    public ErrorContext onError(RequestContext request, ErrorContext error) {
        if (!error.getDetail().isRateLimited()) {
            return error;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("endpoint", request.getEndpoint());
        payload.put("code", error.getDetail().getCode());
        payload.put("retryCount", error.getRetryCount());
        eventPublisher.publish(PlatformEventType.RATE_LIMIT, request.getPlatform(),
                request.getRequestId(), error.getDurationMs(), payload);

        error.setMessage("Rate limit reached on " + request.getPlatform().getDisplayName()
                + ": " + error.getMessage() + ". Wait for the limit window to reset.");
        return error;
    }
}
