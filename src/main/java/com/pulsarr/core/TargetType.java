package com.pulsarr.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Download-manager family a rule or instance belongs to.
 */
public enum TargetType {
    RADARR("radarr"),
    SONARR("sonarr");

    private final String value;

    TargetType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TargetType fromValue(String value) {
        for (TargetType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown target type: " + value);
    }
}
