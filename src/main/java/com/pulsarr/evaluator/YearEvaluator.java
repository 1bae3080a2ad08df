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
 * Routes by release year taken from the item's metadata.
 * Values are a number, a number list, or an inclusive {@code {min, max}} range with open bounds.
 * Items whose metadata lacks a year are resolved by {@link com.pulsarr.plugin.YearRoutePlugin}.
 */
public class YearEvaluator extends AbstractRuleEvaluator {

    public static final int PRIORITY = 70;

    private static final List<FieldInfo> FIELDS = List.of(
            new FieldInfo("year", "Release year", List.of("number", "number[]", "range"))
    );

    private static final List<OperatorInfo> OPERATORS = List.of(
            new OperatorInfo(ConditionOperator.EQUALS, "Year is the value, in the list, or in the range",
                    "number | number[] | range"),
            new OperatorInfo(ConditionOperator.NOT_EQUALS, "Year is not the value", "number | number[] | range"),
            new OperatorInfo(ConditionOperator.GREATER_THAN, "Year is after", "number"),
            new OperatorInfo(ConditionOperator.LESS_THAN, "Year is before", "number"),
            new OperatorInfo(ConditionOperator.IN, "Year is one of", "number[]"),
            new OperatorInfo(ConditionOperator.NOT_IN, "Year is none of", "number[]"),
            new OperatorInfo(ConditionOperator.BETWEEN, "Year is within the inclusive range", "range")
    );

    private static final Map<String, List<OperatorInfo>> OPERATORS_BY_FIELD = sameOperators(FIELDS, OPERATORS);

    public YearEvaluator(RouterRuleRepository rules) {
        super(RuleFamily.YEAR, PRIORITY, rules);
    }

    @Override
    public String description() {
        return "Routes content based on its release year";
    }

    @Override
    public boolean canEvaluate(ContentItem item, RoutingContext context) {
        return year(item).isPresent();
    }

    @Override
    protected Condition criteriaCondition(Map<String, Object> criteria) {
        Object year = criteria.get("year");
        if (year == null) {
            throw new ConfigurationException("Year rule criteria require 'year'");
        }
        String defaultOperator = Values.isRange(year) ? ConditionOperator.BETWEEN.value()
                : year instanceof List<?> ? ConditionOperator.IN.value()
                : ConditionOperator.EQUALS.value();
        return new Condition("year", criteriaOperator(criteria, defaultOperator), year, false);
    }

    @Override
    protected boolean matches(ConditionOperator operator, Object value, ContentItem item, RoutingContext context) {
        Optional<Integer> year = year(item);
        if (year.isEmpty()) {
            return false;
        }
        int actual = year.get();
        return switch (operator) {
            case EQUALS -> matchesAny(actual, value);
            case NOT_EQUALS -> !matchesAny(actual, value);
            case GREATER_THAN -> Values.toInteger(value).map(v -> actual > v).orElse(false);
            case LESS_THAN -> Values.toInteger(value).map(v -> actual < v).orElse(false);
            case IN -> Values.toIntegers(value).map(list -> list.contains(actual)).orElse(false);
            case NOT_IN -> Values.toIntegers(value).map(list -> !list.contains(actual)).orElse(false);
            case BETWEEN -> YearRange.from(value).map(range -> range.contains(actual)).orElse(false);
            default -> false;
        };
    }

    private static boolean matchesAny(int actual, Object value) {
        if (Values.isRange(value)) {
            return YearRange.from(value).map(range -> range.contains(actual)).orElse(false);
        }
        return Values.toIntegers(value).map(list -> list.contains(actual)).orElse(false);
    }

    private static Optional<Integer> year(ContentItem item) {
        return item.metadataOptional().map(ContentMetadata::year);
    }

    @Override
    protected void validateValue(ConditionOperator operator, Object value) {
        boolean valid = switch (operator) {
            case BETWEEN -> YearRange.from(value).isPresent();
            case GREATER_THAN, LESS_THAN -> Values.toInteger(value).isPresent();
            case EQUALS, NOT_EQUALS -> Values.isRange(value)
                    ? YearRange.from(value).isPresent()
                    : Values.toIntegers(value).isPresent();
            default -> Values.toIntegers(value).isPresent();
        };
        if (!valid) {
            throw new ConfigurationException("Invalid year value for '" + operator.value() + "': " + value);
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
