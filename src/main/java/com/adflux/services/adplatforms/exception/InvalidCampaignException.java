package com.adflux.services.adplatforms.exception;

import com.adflux.services.adplatforms.constants.AdPlatformConstants;

/**
 * Thrown when a campaign or update cannot be translated for a platform
 */
public class InvalidCampaignException extends AdPlatformException {

    public InvalidCampaignException(String message) {
        super(message, AdPlatformConstants.ERROR_INVALID_CAMPAIGN);
    }
}
