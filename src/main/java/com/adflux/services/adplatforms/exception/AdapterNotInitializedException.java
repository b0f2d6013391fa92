package com.adflux.services.adplatforms.exception;

import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.Platform;
import lombok.Getter;

/**
 * Thrown when an operation targets a platform whose adapter was never registered
 */
@Getter
public class AdapterNotInitializedException extends AdPlatformException {

    private final Platform platform;

    public AdapterNotInitializedException(Platform platform) {
        super("API not initialized for platform " + platform.getValue()
                        + ". Configure adplatforms.platforms." + platform.getValue() + " or register credentials first.",
                AdPlatformConstants.ERROR_NOT_INITIALIZED);
        this.platform = platform;
    }
}
