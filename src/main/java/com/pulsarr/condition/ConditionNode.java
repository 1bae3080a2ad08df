package com.pulsarr.condition;

/**
 * Node of a boolean condition tree: either a {@link Condition} leaf or a {@link ConditionGroup}.
 */
public sealed interface ConditionNode permits Condition, ConditionGroup {

    /**
     * Whether the node's own result is inverted after evaluation.
     */
    boolean negate();
}
