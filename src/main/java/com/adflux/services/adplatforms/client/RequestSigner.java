package com.adflux.services.adplatforms.client;

import org.springframework.http.HttpMethod;

import java.net.URI;
import java.util.Map;

/**
 * Supplies the authorization headers of one attempt. Called again on every
 * retry so refreshed tokens and fresh nonces are picked up.
 */
@FunctionalInterface
public interface RequestSigner {

    RequestSigner NONE = (method, uri) -> Map.of();

    Map<String, String> sign(HttpMethod method, URI uri);
}
