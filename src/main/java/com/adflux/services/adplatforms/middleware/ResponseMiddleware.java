package com.adflux.services.adplatforms.middleware;

@FunctionalInterface
public interface ResponseMiddleware {

    ResponseContext onResponse(RequestContext request, ResponseContext response);
}
