package com.adflux.services.adplatforms.client;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.util.function.Predicate;

/**
 * Circuit-breaker failure predicate: only platform outages count against the breaker,
 * never validation or authentication errors.
 * Referenced from resilience4j.circuitbreaker.configs.default.record-failure-predicate.
 */
public class TransientFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        Throwable ex = Exceptions.unwrap(throwable);
        if (ex instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) ex).getStatusCode().value();
            return status >= 500;
        }
        return ex instanceof WebClientRequestException
                || ex instanceof java.util.concurrent.TimeoutException;
    }
}
