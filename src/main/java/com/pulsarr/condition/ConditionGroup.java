package com.pulsarr.condition;

import java.util.List;

/**
 * Composite node combining children with AND or OR.
 *
 * @param operator   Logical combinator
 * @param conditions Ordered children
 * @param negate     Invert the combined result
 */
public record ConditionGroup(LogicalOperator operator, List<ConditionNode> conditions, boolean negate)
        implements ConditionNode {

    public ConditionGroup {
        if (operator == null) {
            throw new IllegalArgumentException("Group operator is required");
        }
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }

    public static ConditionGroup and(ConditionNode... conditions) {
        return new ConditionGroup(LogicalOperator.AND, List.of(conditions), false);
    }

    public static ConditionGroup or(ConditionNode... conditions) {
        return new ConditionGroup(LogicalOperator.OR, List.of(conditions), false);
    }

    public ConditionGroup negated() {
        return new ConditionGroup(operator, conditions, !negate);
    }
}
