package com.pulsarr.condition;

/**
 * Combinators for {@link ConditionGroup}.
 */
public enum LogicalOperator {
    AND,
    OR;

    public static LogicalOperator fromValue(String value) {
        for (LogicalOperator op : values()) {
            if (op.name().equalsIgnoreCase(value)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown logical operator: " + value);
    }
}
