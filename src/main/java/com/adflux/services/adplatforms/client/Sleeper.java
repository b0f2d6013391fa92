package com.adflux.services.adplatforms.client;

/**
 * Waiting abstraction used between retry attempts
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;
}
