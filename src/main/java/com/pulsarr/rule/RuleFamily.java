package com.pulsarr.rule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Criterion family of a router rule. Each family is matched by one evaluator.
 */
public enum RuleFamily {
    GENRE("genre"),
    YEAR("year"),
    LANGUAGE("language"),
    CERTIFICATION("certification"),
    SEASON("season"),
    USER("user"),
    CONDITIONAL("conditional");

    private final String value;

    RuleFamily(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static RuleFamily fromValue(String value) {
        for (RuleFamily family : values()) {
            if (family.value.equalsIgnoreCase(value)) {
                return family;
            }
        }
        throw new IllegalArgumentException("Unknown rule family: " + value);
    }
}
