package com.leadfunnel.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LeadStatus {
    NEW("new"),
    CONTACTED("contacted"),
    QUALIFIED("qualified"),
    NOT_QUALIFIED("not_qualified");

    private final String value;

    LeadStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static LeadStatus fromValue(String value) {
        if (value != null) {
            for (LeadStatus status : values()) {
                if (status.value.equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Invalid lead status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
