package com.leadfunnel.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LeadSource {
    WEBSITE("website", 20),
    LANDING_PAGE("landing_page", 18),
    REFERRAL("referral", 15),
    FACEBOOK("facebook", 12),
    INSTAGRAM("instagram", 12),
    WHATSAPP("whatsapp", 10),
    TELEGRAM("telegram", 10),
    COLLEGE("college", 10),
    TWITTER("twitter", 8),
    OTHER("other", 5);

    private final String value;
    private final int score;

    LeadSource(String value, int score) {
        this.value = value;
        this.score = score;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Contribution of this source to the lead quality score.
     */
    public int getScore() {
        return score;
    }

    @JsonCreator
    public static LeadSource fromValue(String value) {
        if (value != null) {
            for (LeadSource source : values()) {
                if (source.value.equalsIgnoreCase(value.trim())) {
                    return source;
                }
            }
        }
        throw new IllegalArgumentException("Invalid lead source: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
