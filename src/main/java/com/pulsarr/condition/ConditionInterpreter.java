package com.pulsarr.condition;

import com.pulsarr.core.ContentItem;
import com.pulsarr.core.RoutingContext;

/**
 * Evaluates condition trees against content.
 * Implementations are pure: no I/O and no mutation of the item or context.
 */
public interface ConditionInterpreter {

    /**
     * Evaluate a condition tree.
     *
     * @param node    Root of the tree
     * @param item    Content being routed
     * @param context Request attribution
     * @return true if the tree matches
     */
    boolean evaluate(ConditionNode node, ContentItem item, RoutingContext context);
}
