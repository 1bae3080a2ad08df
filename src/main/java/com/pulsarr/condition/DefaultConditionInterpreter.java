package com.pulsarr.condition;

import com.pulsarr.core.ContentItem;
import com.pulsarr.core.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Default implementation of ConditionInterpreter.
 * <p>
 * Empty groups follow the boolean identities: an empty AND is true, an empty OR is false.
 * {@code negate} is applied once per node after its children are combined.
 */
public class DefaultConditionInterpreter implements ConditionInterpreter {

    private static final Logger log = LoggerFactory.getLogger(DefaultConditionInterpreter.class);

    private final List<FieldConditionEvaluator> evaluators;

    public DefaultConditionInterpreter(List<? extends FieldConditionEvaluator> evaluators) {
        List<FieldConditionEvaluator> sorted = new ArrayList<>(evaluators);
        sorted.sort(Comparator.comparingInt(FieldConditionEvaluator::priority).reversed());
        this.evaluators = List.copyOf(sorted);
    }

    @Override
    public boolean evaluate(ConditionNode node, ContentItem item, RoutingContext context) {
        Set<ConditionNode> path = Collections.newSetFromMap(new IdentityHashMap<>());
        return evaluateNode(node, item, context, path);
    }

    private boolean evaluateNode(ConditionNode node, ContentItem item, RoutingContext context,
                                 Set<ConditionNode> path) {
        if (node == null) {
            return false;
        }
        if (!path.add(node)) {
            log.warn("Cycle detected in condition tree at {}, treating as non-matching", node);
            return false;
        }
        try {
            boolean result;
            if (node instanceof Condition condition) {
                result = evaluateLeaf(condition, item, context);
            } else if (node instanceof ConditionGroup group) {
                result = evaluateGroup(group, item, context, path);
            } else {
                throw new IllegalStateException("Unsupported condition node: " + node.getClass());
            }
            return node.negate() != result;
        } finally {
            path.remove(node);
        }
    }

    private boolean evaluateGroup(ConditionGroup group, ContentItem item, RoutingContext context,
                                  Set<ConditionNode> path) {
        if (group.operator() == LogicalOperator.AND) {
            for (ConditionNode child : group.conditions()) {
                if (!evaluateNode(child, item, context, path)) {
                    return false;
                }
            }
            return true;
        }
        for (ConditionNode child : group.conditions()) {
            if (evaluateNode(child, item, context, path)) {
                return true;
            }
        }
        return false;
    }

    private boolean evaluateLeaf(Condition condition, ContentItem item, RoutingContext context) {
        for (FieldConditionEvaluator evaluator : evaluators) {
            if (!evaluator.canEvaluateConditionField(condition.field())) {
                continue;
            }
            try {
                return evaluator.evaluateCondition(condition, item, context);
            } catch (RuntimeException e) {
                log.error("Evaluator {} failed on condition {}, trying next evaluator",
                        evaluator.getClass().getSimpleName(), condition, e);
            }
        }
        log.debug("No evaluator handled field '{}', condition is false", condition.field());
        return false;
    }
}
