package com.leadfunnel.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Platforms ads are posted to. Scheduling and performance breakdowns iterate
 * every value.
 */
public enum SocialPlatform {
    FACEBOOK("facebook", "Facebook"),
    INSTAGRAM("instagram", "Instagram"),
    TWITTER("twitter", "Twitter"),
    WHATSAPP("whatsapp", "WhatsApp"),
    TELEGRAM("telegram", "Telegram");

    private final String value;
    private final String displayName;

    SocialPlatform(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static SocialPlatform fromValue(String value) {
        if (value != null) {
            for (SocialPlatform platform : values()) {
                if (platform.value.equalsIgnoreCase(value.trim())) {
                    return platform;
                }
            }
        }
        throw new IllegalArgumentException("Invalid platform: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
