package com.pulsarr.condition;

import com.pulsarr.core.ContentItem;
import com.pulsarr.core.RoutingContext;

/**
 * Evaluates leaf conditions for the fields it claims.
 */
public interface FieldConditionEvaluator {

    /**
     * Dispatch order when several evaluators claim a field. Higher first.
     */
    int priority();

    boolean canEvaluateConditionField(String field);

    /**
     * Evaluate a leaf without applying {@link Condition#negate()}; the interpreter applies it.
     * Unknown operators return false.
     */
    boolean evaluateCondition(Condition condition, ContentItem item, RoutingContext context);
}
