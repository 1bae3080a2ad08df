package com.pulsarr.quota;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Window over which a quota counts accepted requests.
 */
public enum QuotaType {
    /** Requests made today, reset at local midnight. */
    DAILY("daily", "Daily"),
    /** Requests made in the trailing seven days including today. */
    WEEKLY_ROLLING("weekly_rolling", "Weekly"),
    /** Requests made in the current calendar month. */
    MONTHLY("monthly", "Monthly");

    private final String value;
    private final String displayName;

    QuotaType(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String displayName() {
        return displayName;
    }

    @JsonCreator
    public static QuotaType fromValue(String value) {
        for (QuotaType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown quota type: " + value);
    }
}
