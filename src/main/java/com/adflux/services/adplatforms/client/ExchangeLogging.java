package com.adflux.services.adplatforms.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Debug logging filters shared by every WebClient the service builds.
 *
 * Only host and path are logged. Token endpoints and some platform APIs carry
 * secrets in the query string.
 */
@Slf4j
public final class ExchangeLogging {

    private ExchangeLogging() {
    }

    /** Request and response logging, in that order */
    public static ExchangeFilterFunction filter(String label) {
        return logRequest(label).andThen(logResponse(label));
    }

    static ExchangeFilterFunction logRequest(String label) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            if (log.isDebugEnabled()) {
                log.debug("-> {} Request: {}", label, describe(clientRequest));
            }
            return Mono.just(clientRequest);
        });
    }

    static ExchangeFilterFunction logResponse(String label) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            log.debug("<- {} Response: {}", label, clientResponse.statusCode());
            return Mono.just(clientResponse);
        });
    }

    static String describe(ClientRequest request) {
        URI url = request.url();
        return request.method() + " " + (url.getHost() != null ? url.getHost() : "") + url.getRawPath();
    }
}
