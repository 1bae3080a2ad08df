package com.pulsarr.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of watchlist content. Each kind is acquired by exactly one download-manager type.
 */
public enum ContentType {
    MOVIE("movie", TargetType.RADARR),
    SHOW("show", TargetType.SONARR);

    private final String value;
    private final TargetType targetType;

    ContentType(String value, TargetType targetType) {
        this.value = value;
        this.targetType = targetType;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public TargetType targetType() {
        return targetType;
    }

    @JsonCreator
    public static ContentType fromValue(String value) {
        for (ContentType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown content type: " + value);
    }
}
