package com.pulsarr.evaluator;

import com.pulsarr.condition.Condition;
import com.pulsarr.condition.ConditionOperator;
import com.pulsarr.core.ContentItem;
import com.pulsarr.core.ContentMetadata;
import com.pulsarr.core.ContentType;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.exception.ConfigurationException;
import com.pulsarr.rule.RouterRuleRepository;
import com.pulsarr.rule.RuleFamily;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Routes shows by the season numbers Sonarr reports for them.
 * <p>
 * A show matches when any of its seasons satisfies the operator, except {@code notEquals} and
 * {@code notIn}, which require that none does. {@code between} matches when the span from the
 * first to the last season overlaps the range. Movies and shows without season data never match.
 */
public class SeasonEvaluator extends AbstractRuleEvaluator {

    public static final int PRIORITY = 68;

    private static final List<FieldInfo> FIELDS = List.of(
            new FieldInfo("season", "Season numbers of a show", List.of("number", "number[]", "range"))
    );

    private static final List<OperatorInfo> OPERATORS = List.of(
            new OperatorInfo(ConditionOperator.EQUALS, "Show has the season", "number | number[] | range"),
            new OperatorInfo(ConditionOperator.NOT_EQUALS, "Show does not have the season", "number | number[] | range"),
            new OperatorInfo(ConditionOperator.GREATER_THAN, "Show has a season above", "number"),
            new OperatorInfo(ConditionOperator.LESS_THAN, "Show has a season below", "number"),
            new OperatorInfo(ConditionOperator.IN, "Show has one of the seasons", "number[]"),
            new OperatorInfo(ConditionOperator.NOT_IN, "Show has none of the seasons", "number[]"),
            new OperatorInfo(ConditionOperator.BETWEEN, "Show's seasons overlap the inclusive range", "range")
    );

    private static final Map<String, List<OperatorInfo>> OPERATORS_BY_FIELD = sameOperators(FIELDS, OPERATORS);

    public SeasonEvaluator(RouterRuleRepository rules) {
        super(RuleFamily.SEASON, PRIORITY, rules);
    }

    @Override
    public String description() {
        return "Routes shows based on their season numbers";
    }

    @Override
    public boolean canEvaluate(ContentItem item, RoutingContext context) {
        return context.contentType() == ContentType.SHOW && !seasons(item).isEmpty();
    }

    @Override
    protected Condition criteriaCondition(Map<String, Object> criteria) {
        Object season = criteria.get("season");
        if (season == null) {
            throw new ConfigurationException("Season rule criteria require 'season'");
        }
        String defaultOperator = Values.isRange(season) ? ConditionOperator.BETWEEN.value()
                : season instanceof List<?> ? ConditionOperator.IN.value()
                : ConditionOperator.EQUALS.value();
        return new Condition("season", criteriaOperator(criteria, defaultOperator), season, false);
    }

    @Override
    protected boolean matches(ConditionOperator operator, Object value, ContentItem item, RoutingContext context) {
        if (context.contentType() != ContentType.SHOW) {
            return false;
        }
        List<Integer> seasons = seasons(item);
        if (seasons.isEmpty()) {
            return false;
        }
        return switch (operator) {
            case EQUALS -> hasAny(seasons, value);
            case NOT_EQUALS -> !hasAny(seasons, value);
            case GREATER_THAN -> Values.toInteger(value)
                    .map(v -> seasons.stream().anyMatch(season -> season > v)).orElse(false);
            case LESS_THAN -> Values.toInteger(value)
                    .map(v -> seasons.stream().anyMatch(season -> season < v)).orElse(false);
            case IN -> Values.toIntegers(value)
                    .map(list -> seasons.stream().anyMatch(list::contains)).orElse(false);
            case NOT_IN -> Values.toIntegers(value)
                    .map(list -> seasons.stream().noneMatch(list::contains)).orElse(false);
            case BETWEEN -> YearRange.from(value).map(range -> overlaps(range, seasons)).orElse(false);
            default -> false;
        };
    }

    private static boolean hasAny(List<Integer> seasons, Object value) {
        if (Values.isRange(value)) {
            return YearRange.from(value).map(range -> overlaps(range, seasons)).orElse(false);
        }
        return Values.toIntegers(value).map(list -> seasons.stream().anyMatch(list::contains)).orElse(false);
    }

    private static boolean overlaps(YearRange range, List<Integer> seasons) {
        int first = Collections.min(seasons);
        int last = Collections.max(seasons);
        return (range.min() == null || last >= range.min()) && (range.max() == null || first <= range.max());
    }

    private static List<Integer> seasons(ContentItem item) {
        return item.metadataOptional().map(ContentMetadata::seasons).orElse(List.of());
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
            throw new ConfigurationException("Invalid season value for '" + operator.value() + "': " + value);
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
