package com.adflux.services.adplatforms.middleware;

import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.ErrorType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Marks network and timeout failures as handled while attempts remain,
 * so the transport retries them instead of surfacing the error.
 */
@Component
@Order(30)
@Slf4j
public class NetworkRetryMiddleware implements ErrorMiddleware {

    @Override
    public ErrorContext onError(RequestContext request, ErrorContext error) {
        ErrorType type = error.getDetail().getType();
        boolean transientFailure = type == ErrorType.NETWORK || type == ErrorType.TIMEOUT;
        if (transientFailure && error.getRetryCount() < AdPlatformConstants.NETWORK_RETRY_CEILING) {
            log.debug("Network failure on {} [{}], retry {} of {}", request.getEndpoint(), request.getRequestId(),
                    error.getRetryCount() + 1, AdPlatformConstants.NETWORK_RETRY_CEILING);
            return null;
        }
        return error;
    }
}
