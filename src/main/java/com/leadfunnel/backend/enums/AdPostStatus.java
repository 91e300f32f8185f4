package com.leadfunnel.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AdPostStatus {
    SCHEDULED("scheduled"),
    POSTED("posted"),
    FAILED("failed");

    private final String value;

    AdPostStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isScheduled() {
        return this == SCHEDULED;
    }

    public boolean isTerminal() {
        return this == POSTED || this == FAILED;
    }

    @JsonCreator
    public static AdPostStatus fromValue(String value) {
        if (value != null) {
            for (AdPostStatus status : values()) {
                if (status.value.equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Invalid ad post status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
