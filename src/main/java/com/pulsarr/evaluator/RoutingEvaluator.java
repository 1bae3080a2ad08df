package com.pulsarr.evaluator;

import com.pulsarr.condition.Condition;
import com.pulsarr.condition.FieldConditionEvaluator;
import com.pulsarr.core.ContentItem;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.decision.RoutingDecision;
import com.pulsarr.rule.RuleFamily;

import java.util.List;
import java.util.Map;

/**
 * Matches the rules of one criterion family against content.
 * <p>
 * Implementations are stateless per call and safe to run concurrently. Storage failures inside
 * {@link #canEvaluate} and {@link #evaluate} are logged and reported as "no rules apply".
 */
public interface RoutingEvaluator extends FieldConditionEvaluator {

    RuleFamily family();

    default String name() {
        return family().value();
    }

    String description();

    /**
     * Cheap precondition, e.g. whether the item carries the data this family matches on.
     */
    boolean canEvaluate(ContentItem item, RoutingContext context);

    /**
     * Match every enabled rule of this family for the context's content type.
     *
     * @return one decision per matching rule, or null if none match
     */
    List<RoutingDecision> evaluate(ContentItem item, RoutingContext context);

    List<FieldInfo> supportedFields();

    /**
     * Operators accepted per field.
     */
    Map<String, List<OperatorInfo>> supportedOperators();

    /**
     * Check a leaf condition for one of this evaluator's fields at rule-save time.
     *
     * @throws com.pulsarr.exception.ConfigurationException if the operator or value is invalid
     */
    void validateCondition(Condition condition);

    /**
     * Check a rule's family-specific criteria at rule-save time.
     *
     * @throws com.pulsarr.exception.ConfigurationException if the criteria are malformed
     */
    void validateCriteria(Map<String, Object> criteria);

    default EvaluatorMetadata metadata() {
        return new EvaluatorMetadata(name(), family(), priority(), description(), supportedFields(),
                supportedOperators());
    }
}
