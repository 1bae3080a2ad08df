package com.pulsarr.evaluator;

import com.pulsarr.condition.Condition;
import com.pulsarr.condition.ConditionGroup;
import com.pulsarr.condition.ConditionNode;
import com.pulsarr.config.ConditionParser;
import com.pulsarr.exception.ConfigurationException;
import com.pulsarr.rule.RouterRule;

/**
 * Checks rules when they are saved so evaluation never has to re-validate shape.
 */
public class RuleValidator {

    private final EvaluatorRegistry registry;

    public RuleValidator(EvaluatorRegistry registry) {
        this.registry = registry;
    }

    /**
     * @throws ConfigurationException describing the first problem found
     */
    public void validate(RouterRule rule) {
        if (rule.name() == null || rule.name().isBlank()) {
            throw new ConfigurationException("Rule name is required");
        }
        if (rule.type() == null || rule.targetType() == null) {
            throw new ConfigurationException("Rule '" + rule.name() + "' requires a type and a target type");
        }
        if (rule.priority() < 0) {
            throw new ConfigurationException("Rule '" + rule.name() + "' priority must not be negative");
        }
        RoutingEvaluator evaluator = registry.find(rule.type())
                .orElseThrow(() -> new ConfigurationException("No evaluator for rule family: " + rule.type().value()));
        evaluator.validateCriteria(rule.criteria());
        if (rule.condition() != null) {
            validateTree(rule.condition());
        } else if (rule.criteria().containsKey("condition")) {
            validateTree(ConditionParser.parse(rule.criteria().get("condition")));
        }
    }

    /**
     * Every leaf must name a field some evaluator claims, with an operator and value it accepts.
     */
    public void validateTree(ConditionNode node) {
        if (node instanceof Condition condition) {
            RoutingEvaluator evaluator = registry.forField(condition.field())
                    .orElseThrow(() -> new ConfigurationException("Unknown condition field: " + condition.field()));
            evaluator.validateCondition(condition);
        } else if (node instanceof ConditionGroup group) {
            for (ConditionNode child : group.conditions()) {
                validateTree(child);
            }
        }
    }
}
