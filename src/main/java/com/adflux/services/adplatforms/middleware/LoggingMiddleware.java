package com.adflux.services.adplatforms.middleware;

import com.adflux.services.adplatforms.constants.PlatformEventType;
import com.adflux.services.adplatforms.event.PlatformEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logs every attempt and emits the matching analytics event.
 */
@Component
@Order(0)
@RequiredArgsConstructor
@Slf4j
public class LoggingMiddleware implements RequestMiddleware, ResponseMiddleware, ErrorMiddleware {

    private final PlatformEventPublisher eventPublisher;

    @Override
    public RequestContext onRequest(RequestContext request) {
        log.info("-> {} {} {} [{}] attempt={}", request.getPlatform().getValue(), request.getMethod(),
                request.getEndpoint(), request.getRequestId(), request.getRetryCount() + 1);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("method", request.getMethod());
        payload.put("endpoint", request.getEndpoint());
        payload.put("retryCount", request.getRetryCount());
        eventPublisher.publish(PlatformEventType.API_REQUEST, request.getPlatform(),
                request.getRequestId(), null, payload);
        return request;
    }

    @Override
    public ResponseContext onResponse(RequestContext request, ResponseContext response) {
        log.info("<- {} {} {} [{}] status={} in {}ms", request.getPlatform().getValue(), request.getMethod(),
                request.getEndpoint(), request.getRequestId(), response.getStatusCode(), response.getDurationMs());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("method", request.getMethod());
        payload.put("endpoint", request.getEndpoint());
        payload.put("status", response.getStatusCode());
        eventPublisher.publish(PlatformEventType.API_RESPONSE, request.getPlatform(),
                request.getRequestId(), response.getDurationMs(), payload);
        return response;
    }

    @Override
    public ErrorContext onError(RequestContext request, ErrorContext error) {
        log.warn("x- {} {} {} [{}] failed after {}ms: code={}, type={}, retryable={}",
                request.getPlatform().getValue(), request.getMethod(), request.getEndpoint(),
                request.getRequestId(), error.getDurationMs(), error.getDetail().getCode(),
                error.getDetail().getType(), error.getDetail().isRetryable());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("method", request.getMethod());
        payload.put("endpoint", request.getEndpoint());
        payload.put("code", error.getDetail().getCode());
        payload.put("type", String.valueOf(error.getDetail().getType()));
        payload.put("status", error.getDetail().getHttpStatus());
        payload.put("message", error.getMessage());
        payload.put("retryCount", error.getRetryCount());
        eventPublisher.publish(PlatformEventType.API_ERROR, request.getPlatform(),
                request.getRequestId(), error.getDurationMs(), payload);
        return error;
    }
}
