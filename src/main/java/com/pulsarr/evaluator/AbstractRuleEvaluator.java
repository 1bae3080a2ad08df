package com.pulsarr.evaluator;

import com.pulsarr.condition.Condition;
import com.pulsarr.condition.ConditionOperator;
import com.pulsarr.core.ContentItem;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.decision.RoutingDecision;
import com.pulsarr.exception.ConfigurationException;
import com.pulsarr.rule.RouterRule;
import com.pulsarr.rule.RouterRuleRepository;
import com.pulsarr.rule.RuleFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Base for family evaluators: loads the family's enabled rules, keeps those for the context's
 * target type and matches each through {@link #matchesRule}. Malformed rules are skipped.
 */
public abstract class AbstractRuleEvaluator implements RoutingEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AbstractRuleEvaluator.class);

    private final RuleFamily family;
    private final int priority;
    protected final RouterRuleRepository rules;

    protected AbstractRuleEvaluator(RuleFamily family, int priority, RouterRuleRepository rules) {
        this.family = family;
        this.priority = priority;
        this.rules = rules;
    }

    @Override
    public RuleFamily family() {
        return family;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public List<RoutingDecision> evaluate(ContentItem item, RoutingContext context) {
        List<RouterRule> candidates;
        try {
            candidates = rules.findByFamily(family, true);
        } catch (RuntimeException e) {
            log.error("Failed to load {} rules, skipping evaluator: {}", family.value(), e.getMessage(), e);
            return null;
        }

        List<RoutingDecision> decisions = new ArrayList<>();
        for (RouterRule rule : candidates) {
            if (rule.targetType() != context.targetType()) {
                continue;
            }
            try {
                if (matchesRule(rule, item, context)) {
                    log.debug("Rule '{}' ({}) matched '{}'", rule.name(), family.value(), item.title());
                    decisions.add(rule.toDecision());
                }
            } catch (ConfigurationException e) {
                log.warn("Skipping malformed {} rule '{}' (id {}): {}",
                        family.value(), rule.name(), rule.id(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Skipping {} rule '{}' (id {}) after evaluation error: {}",
                        family.value(), rule.name(), rule.id(), e.getMessage(), e);
            }
        }
        return decisions.isEmpty() ? null : decisions;
    }

    /**
     * Match one rule. The default turns the family shorthand into a leaf condition.
     *
     * @throws ConfigurationException if the rule's criteria are malformed
     */
    protected boolean matchesRule(RouterRule rule, ContentItem item, RoutingContext context) {
        return evaluateCondition(criteriaCondition(rule.criteria()), item, context);
    }

    /**
     * Leaf condition equivalent to a rule's family shorthand criteria.
     *
     * @throws ConfigurationException if the criteria lack this family's key
     */
    protected abstract Condition criteriaCondition(Map<String, Object> criteria);

    @Override
    public boolean evaluateCondition(Condition condition, ContentItem item, RoutingContext context) {
        Optional<ConditionOperator> operator = ConditionOperator.fromValue(condition.operator());
        if (operator.isEmpty() || !supportsOperator(condition.field(), operator.get())) {
            log.warn("Operator '{}' is not supported for field '{}', condition is false",
                    condition.operator(), condition.field());
            return false;
        }
        return matches(condition.field(), operator.get(), condition.value(), item, context);
    }

    /**
     * Apply an operator to one of this evaluator's fields. The default ignores the field.
     */
    protected boolean matches(String field, ConditionOperator operator, Object value, ContentItem item,
                              RoutingContext context) {
        return matches(operator, value, item, context);
    }

    /**
     * Apply an operator. Never applies negation.
     */
    protected abstract boolean matches(ConditionOperator operator, Object value, ContentItem item,
                                       RoutingContext context);

    @Override
    public boolean canEvaluateConditionField(String field) {
        return field != null && supportedOperators().containsKey(field);
    }

    protected boolean supportsOperator(String field, ConditionOperator operator) {
        List<OperatorInfo> operators = supportedOperators().get(field);
        return operators != null && operators.stream().anyMatch(info -> info.operator() == operator);
    }

    @Override
    public void validateCondition(Condition condition) {
        ConditionOperator operator = ConditionOperator.fromValue(condition.operator())
                .orElseThrow(() -> new ConfigurationException(
                        "Unknown operator '" + condition.operator() + "' on field '" + condition.field() + "'"));
        if (!supportsOperator(condition.field(), operator)) {
            throw new ConfigurationException("Operator '" + operator.value() + "' is not supported for field '"
                    + condition.field() + "'");
        }
        if (condition.value() == null) {
            throw new ConfigurationException("Condition on '" + condition.field() + "' requires a value");
        }
        if (operator == ConditionOperator.REGEX
                && RegexSafety.compile(String.valueOf(condition.value())).isEmpty()) {
            throw new ConfigurationException("Regex for '" + condition.field() + "' is invalid or unsafe: "
                    + condition.value());
        }
        validateValue(operator, condition.value());
    }

    @Override
    public void validateCriteria(Map<String, Object> criteria) {
        validateCondition(criteriaCondition(criteria));
    }

    /**
     * Family-specific value checks.
     */
    protected void validateValue(ConditionOperator operator, Object value) {
    }

    /**
     * Operator named by the criteria, or the default for the value's shape.
     */
    protected static String criteriaOperator(Map<String, Object> criteria, String defaultOperator) {
        Object operator = criteria.get("operator");
        return operator != null ? operator.toString() : defaultOperator;
    }

    /**
     * Operator table shared by all fields of an evaluator.
     */
    protected static Map<String, List<OperatorInfo>> sameOperators(List<FieldInfo> fields,
                                                                   List<OperatorInfo> operators) {
        Map<String, List<OperatorInfo>> result = new LinkedHashMap<>();
        for (FieldInfo field : fields) {
            result.put(field.name(), operators);
        }
        return Collections.unmodifiableMap(result);
    }
}
