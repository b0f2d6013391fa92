package com.adflux.services.adplatforms.exception;

import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.Platform;
import lombok.Getter;

/**
 * Thrown when a token is requested for a platform that holds no valid authentication
 */
@Getter
public class NotAuthenticatedException extends AdPlatformException {

    private final Platform platform;

    public NotAuthenticatedException(Platform platform) {
        super("No valid authentication for platform " + platform.getValue(),
                AdPlatformConstants.ERROR_NOT_AUTHENTICATED);
        this.platform = platform;
    }
}
