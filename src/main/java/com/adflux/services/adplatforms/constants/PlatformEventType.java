package com.adflux.services.adplatforms.constants;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One-way events emitted to logging and analytics collaborators.
 */
public enum PlatformEventType {
    API_REQUEST("api_request"),
    API_RESPONSE("api_response"),
    API_ERROR("api_error"),
    AD_CREATED("ad_created"),
    AD_UPDATED("ad_updated"),
    AD_DELETED("ad_deleted"),
    AUTHENTICATION("authentication"),
    RATE_LIMIT("rate_limit");

    private final String value;

    PlatformEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
