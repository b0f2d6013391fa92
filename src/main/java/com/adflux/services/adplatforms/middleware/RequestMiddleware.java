package com.adflux.services.adplatforms.middleware;

@FunctionalInterface
public interface RequestMiddleware {

    RequestContext onRequest(RequestContext request);
}
