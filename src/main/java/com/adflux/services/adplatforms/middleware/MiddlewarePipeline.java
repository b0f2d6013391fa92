package com.adflux.services.adplatforms.middleware;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered request, response and error interceptors shared by every platform client.
 *
 * Built-in middleware is discovered as Spring beans and ordered by {@code @Order};
 * extra middleware can be appended at runtime.
 */
@Component
@Slf4j
public class MiddlewarePipeline {

    private final List<RequestMiddleware> requestMiddleware = new CopyOnWriteArrayList<>();
    private final List<ResponseMiddleware> responseMiddleware = new CopyOnWriteArrayList<>();
    private final List<ErrorMiddleware> errorMiddleware = new CopyOnWriteArrayList<>();

    public MiddlewarePipeline(List<RequestMiddleware> requestMiddleware,
                              List<ResponseMiddleware> responseMiddleware,
                              List<ErrorMiddleware> errorMiddleware) {
        this.requestMiddleware.addAll(requestMiddleware);
        this.responseMiddleware.addAll(responseMiddleware);
        this.errorMiddleware.addAll(errorMiddleware);
        log.info("Middleware pipeline ready: {} request, {} response, {} error",
                requestMiddleware.size(), responseMiddleware.size(), errorMiddleware.size());
    }

    public void addRequestMiddleware(RequestMiddleware middleware) {
        requestMiddleware.add(middleware);
    }

    public void addResponseMiddleware(ResponseMiddleware middleware) {
        responseMiddleware.add(middleware);
    }

    public void addErrorMiddleware(ErrorMiddleware middleware) {
        errorMiddleware.add(middleware);
    }

    public RequestContext processRequest(RequestContext request) {
        RequestContext current = request;
        for (RequestMiddleware middleware : requestMiddleware) {
            current = middleware.onRequest(current);
        }
        return current;
    }

    public ResponseContext processResponse(RequestContext request, ResponseContext response) {
        ResponseContext current = response;
        for (ResponseMiddleware middleware : responseMiddleware) {
            current = middleware.onResponse(request, current);
        }
        return current;
    }

    /**
     * @return the error to surface, or {@code null} when a middleware handled it
     */
    public ErrorContext processError(RequestContext request, ErrorContext error) {
        ErrorContext current = error;
        for (ErrorMiddleware middleware : errorMiddleware) {
            current = middleware.onError(request, current);
            if (current == null) {
                log.debug("Error for {} handled by {}", request.getRequestId(), middleware.getClass().getSimpleName());
                return null;
            }
        }
        return current;
    }
}
