package com.adflux.services.adplatforms.middleware;

/**
 * Error interceptor. Returning {@code null} marks the error as handled:
 * the chain stops and the transport retries the request instead of surfacing it.
 */
@FunctionalInterface
public interface ErrorMiddleware {

    ErrorContext onError(RequestContext request, ErrorContext error);
}
