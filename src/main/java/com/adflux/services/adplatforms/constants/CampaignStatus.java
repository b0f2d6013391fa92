package com.adflux.services.adplatforms.constants;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Campaign lifecycle status. Part of the wire contract: callers depend on
 * exactly these six values.
 */
public enum CampaignStatus {
    DRAFT("draft"),
    PENDING("pending"),
    ACTIVE("active"),
    PAUSED("paused"),
    COMPLETED("completed"),
    ERROR("error");

    private final String value;

    CampaignStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static CampaignStatus fromValue(String value) {
        for (CampaignStatus status : CampaignStatus.values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Invalid campaign status: " + value);
    }
}
