package com.pulsarr.resolver;

import com.pulsarr.core.ContentItem;
import com.pulsarr.core.RoutingContext;

/**
 * Runs every evaluator and plugin for an item and merges their decisions.
 * Called once per watchlist item; the result does not depend on evaluator completion order.
 */
public interface DecisionResolver {

    /**
     * Resolve where an item should be acquired.
     *
     * @param item    Content to route
     * @param context Request attribution and hints
     * @return one {@code route} decision per target instance, highest priority first
     */
    ResolutionResult resolve(ContentItem item, RoutingContext context);
}
