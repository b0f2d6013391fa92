package com.adflux.services.adplatforms.middleware;

import com.adflux.services.adplatforms.constants.PlatformEventType;
import com.adflux.services.adplatforms.event.PlatformEventPublisher;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flags authentication failures. Does not refresh the token: callers that want
 * a second attempt re-initialize the adapter first.
 */
@Component
@Order(20)
@RequiredArgsConstructor
public class AuthErrorMiddleware implements ErrorMiddleware {

    private final PlatformEventPublisher eventPublisher;

    @Override
    public ErrorContext onError(RequestContext request, ErrorContext error) {
        if (!error.getDetail().isAuthError()) {
            return error;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", false);
        payload.put("code", error.getDetail().getCode());
        payload.put("endpoint", request.getEndpoint());
        eventPublisher.publish(PlatformEventType.AUTHENTICATION, request.getPlatform(),
                request.getRequestId(), error.getDurationMs(), payload);

        error.setMessage("Authentication with " + request.getPlatform().getDisplayName()
                + " failed: " + error.getMessage() + ". Reconnect the account.");
        return error;
    }
}
