package com.pulsarr.plugin;

import com.pulsarr.core.ContentItem;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.decision.RoutingDecision;

import java.util.List;

/**
 * Evaluator-like stage that needs an external metadata lookup before it can match.
 * Never throws: lookup failures yield no decision.
 */
public interface RouterPlugin {

    String name();

    int priority();

    /**
     * @return one decision per matching rule, or null to skip
     */
    List<RoutingDecision> evaluateRouting(ContentItem item, RoutingContext context);

    /**
     * Whether this plugin only adds a metadata lookup in front of an evaluator.
     */
    default boolean performsLookup() {
        return false;
    }
}
