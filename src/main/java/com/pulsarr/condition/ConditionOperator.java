package com.pulsarr.condition;

import java.util.Optional;

/**
 * Leaf comparison operators, by their stored wire names.
 */
public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("notEquals"),
    CONTAINS("contains"),
    NOT_CONTAINS("notContains"),
    IN("in"),
    NOT_IN("notIn"),
    REGEX("regex"),
    GREATER_THAN("greaterThan"),
    LESS_THAN("lessThan"),
    BETWEEN("between");

    private final String value;

    ConditionOperator(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolve a wire name. Unknown names yield empty instead of failing so evaluation can
     * treat them as non-matching.
     */
    public static Optional<ConditionOperator> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ConditionOperator op : values()) {
            if (op.value.equals(value)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
