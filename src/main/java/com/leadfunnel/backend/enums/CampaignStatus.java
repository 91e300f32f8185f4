package com.leadfunnel.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CampaignStatus {
    DRAFT("draft"),
    ACTIVE("active"),
    PAUSED("paused"),
    COMPLETED("completed");

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
        if (value != null) {
            for (CampaignStatus status : values()) {
                if (status.value.equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Invalid campaign status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
