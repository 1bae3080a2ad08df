package com.pulsarr.evaluator;

import com.pulsarr.condition.Condition;
import com.pulsarr.condition.ConditionOperator;
import com.pulsarr.core.ContentItem;
import com.pulsarr.core.ContentMetadata;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.exception.ConfigurationException;
import com.pulsarr.rule.RouterRuleRepository;
import com.pulsarr.rule.RuleFamily;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes by original language name (e.g. "Japanese"), compared case-insensitively.
 * Items whose metadata lacks a language are resolved by {@link com.pulsarr.plugin.LanguageRoutePlugin}.
 */
public class LanguageEvaluator extends AbstractRuleEvaluator {

    public static final int PRIORITY = 65;

    private static final List<FieldInfo> FIELDS = List.of(
            new FieldInfo("language", "Original language of the content", List.of("string", "string[]")),
            new FieldInfo("originalLanguage", "Original language of the content", List.of("string", "string[]"))
    );

    private static final List<OperatorInfo> OPERATORS = List.of(
            new OperatorInfo(ConditionOperator.EQUALS, "Language is", "string"),
            new OperatorInfo(ConditionOperator.NOT_EQUALS, "Language is not", "string"),
            new OperatorInfo(ConditionOperator.CONTAINS, "Language name contains", "string"),
            new OperatorInfo(ConditionOperator.IN, "Language is one of", "string[]"),
            new OperatorInfo(ConditionOperator.NOT_IN, "Language is none of", "string[]")
    );

    private static final Map<String, List<OperatorInfo>> OPERATORS_BY_FIELD = sameOperators(FIELDS, OPERATORS);

    public LanguageEvaluator(RouterRuleRepository rules) {
        super(RuleFamily.LANGUAGE, PRIORITY, rules);
    }

    @Override
    public String description() {
        return "Routes content based on its original language";
    }

    @Override
    public boolean canEvaluate(ContentItem item, RoutingContext context) {
        return language(item).isPresent();
    }

    @Override
    protected Condition criteriaCondition(Map<String, Object> criteria) {
        Object language = criteria.containsKey("originalLanguage")
                ? criteria.get("originalLanguage") : criteria.get("language");
        if (language == null) {
            throw new ConfigurationException("Language rule criteria require 'originalLanguage'");
        }
        String defaultOperator = language instanceof List<?>
                ? ConditionOperator.IN.value() : ConditionOperator.EQUALS.value();
        return new Condition("language", criteriaOperator(criteria, defaultOperator), language, false);
    }

    @Override
    protected boolean matches(ConditionOperator operator, Object value, ContentItem item, RoutingContext context) {
        Optional<String> language = language(item).map(Values::normalize);
        if (language.isEmpty()) {
            return false;
        }
        String actual = language.get();
        return switch (operator) {
            case EQUALS, IN -> Values.toNormalizedSet(value).contains(actual);
            case NOT_EQUALS, NOT_IN -> !Values.toNormalizedSet(value).contains(actual);
            case CONTAINS -> Values.toNormalizedSet(value).stream().anyMatch(actual::contains);
            default -> false;
        };
    }

    private static Optional<String> language(ContentItem item) {
        return item.metadataOptional()
                .map(ContentMetadata::originalLanguage)
                .filter(name -> !name.isBlank());
    }

    @Override
    protected void validateValue(ConditionOperator operator, Object value) {
        if (Values.toNormalizedSet(value).isEmpty()) {
            throw new ConfigurationException("Language condition requires at least one language");
        }
    }

    @Override
    public List<FieldInfo> supportedFields() {
        return FIELDS;
    }

    @Override
    public Map<String, List<OperatorInfo>> supportedOperators() {
        return OPERATORS_BY_FIELD;
    }
}
