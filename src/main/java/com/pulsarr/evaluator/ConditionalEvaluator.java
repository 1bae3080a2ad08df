package com.pulsarr.evaluator;

import com.pulsarr.condition.Condition;
import com.pulsarr.condition.ConditionInterpreter;
import com.pulsarr.condition.ConditionOperator;
import com.pulsarr.config.ConditionParser;
import com.pulsarr.core.ContentItem;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.exception.ConfigurationException;
import com.pulsarr.rule.RouterRule;
import com.pulsarr.rule.RouterRuleRepository;
import com.pulsarr.rule.RuleFamily;

import java.util.List;
import java.util.Map;

/**
 * Routes by a condition tree combining the other families' fields.
 * Evaluated first; it claims no condition field of its own.
 */
public class ConditionalEvaluator extends AbstractRuleEvaluator {

    public static final int PRIORITY = 100;

    private final ConditionInterpreter interpreter;

    public ConditionalEvaluator(RouterRuleRepository rules, ConditionInterpreter interpreter) {
        super(RuleFamily.CONDITIONAL, PRIORITY, rules);
        this.interpreter = interpreter;
    }

    @Override
    public String description() {
        return "Routes content when a rule's condition tree matches";
    }

    @Override
    public boolean canEvaluate(ContentItem item, RoutingContext context) {
        return true;
    }

    @Override
    protected boolean matchesRule(RouterRule rule, ContentItem item, RoutingContext context) {
        if (rule.condition() == null) {
            throw new ConfigurationException("Conditional rule has no valid condition tree");
        }
        return interpreter.evaluate(rule.condition(), item, context);
    }

    @Override
    protected Condition criteriaCondition(Map<String, Object> criteria) {
        throw new ConfigurationException("Conditional rules are matched by their condition tree");
    }

    @Override
    protected boolean matches(ConditionOperator operator, Object value,
                              ContentItem item, RoutingContext context) {
        return false;
    }

    @Override
    public boolean canEvaluateConditionField(String field) {
        return false;
    }

    @Override
    public boolean evaluateCondition(Condition condition, ContentItem item, RoutingContext context) {
        return false;
    }

    @Override
    public void validateCondition(Condition condition) {
        throw new ConfigurationException("Field '" + condition.field() + "' is not handled by the conditional evaluator");
    }

    /**
     * Checks the tree's structure; leaf fields are checked by {@link RuleValidator}.
     */
    @Override
    public void validateCriteria(Map<String, Object> criteria) {
        if (!criteria.containsKey("condition")) {
            throw new ConfigurationException("Conditional rule criteria require 'condition'");
        }
        ConditionParser.parse(criteria.get("condition"));
    }

    @Override
    public List<FieldInfo> supportedFields() {
        return List.of();
    }

    @Override
    public Map<String, List<OperatorInfo>> supportedOperators() {
        return Map.of();
    }
}
