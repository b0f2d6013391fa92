package com.adflux.services.adplatforms.exception;

import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a multi-step creation stops before the final ad exists.
 *
 * Resources created by earlier steps are NOT removed from the platform;
 * their ids travel with the exception so the caller can clean up.
 */
@Getter
public class ResourceCreationException extends AdPlatformException {

    private final String step;
    private final Map<String, String> partialIds;

    public ResourceCreationException(String message, String step, Map<String, String> partialIds) {
        super(message, AdPlatformConstants.ERROR_RESOURCE_CREATION);
        this.step = step;
        this.partialIds = Collections.unmodifiableMap(new LinkedHashMap<>(partialIds));
    }

    public ResourceCreationException(String message, String step, Map<String, String> partialIds, Throwable cause) {
        super(message, AdPlatformConstants.ERROR_RESOURCE_CREATION, cause);
        this.step = step;
        this.partialIds = Collections.unmodifiableMap(new LinkedHashMap<>(partialIds));
    }
}
