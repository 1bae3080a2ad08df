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
import java.util.regex.Pattern;

/**
 * Routes by content rating from the item's metadata. Comparisons ignore case.
 */
public class CertificationEvaluator extends AbstractRuleEvaluator {

    public static final int PRIORITY = 60;

    private static final List<FieldInfo> FIELDS = List.of(
            new FieldInfo("certification", "Content rating (e.g. R, PG-13, TV-MA)", List.of("string", "string[]"))
    );

    private static final List<OperatorInfo> OPERATORS = List.of(
            new OperatorInfo(ConditionOperator.EQUALS, "Rating is", "string"),
            new OperatorInfo(ConditionOperator.NOT_EQUALS, "Rating is not", "string"),
            new OperatorInfo(ConditionOperator.CONTAINS, "Rating contains", "string"),
            new OperatorInfo(ConditionOperator.NOT_CONTAINS, "Rating does not contain", "string"),
            new OperatorInfo(ConditionOperator.IN, "Rating is one of", "string[]"),
            new OperatorInfo(ConditionOperator.NOT_IN, "Rating is none of", "string[]"),
            new OperatorInfo(ConditionOperator.REGEX, "Rating matches the pattern", "string")
    );

    private static final Map<String, List<OperatorInfo>> OPERATORS_BY_FIELD = sameOperators(FIELDS, OPERATORS);

    public CertificationEvaluator(RouterRuleRepository rules) {
        super(RuleFamily.CERTIFICATION, PRIORITY, rules);
    }

    @Override
    public String description() {
        return "Routes content based on its content rating";
    }

    @Override
    public boolean canEvaluate(ContentItem item, RoutingContext context) {
        return certification(item).isPresent();
    }

    @Override
    protected Condition criteriaCondition(Map<String, Object> criteria) {
        Object certification = criteria.get("certification");
        if (certification == null) {
            throw new ConfigurationException("Certification rule criteria require 'certification'");
        }
        String defaultOperator = certification instanceof List<?>
                ? ConditionOperator.IN.value() : ConditionOperator.EQUALS.value();
        return new Condition("certification", criteriaOperator(criteria, defaultOperator), certification, false);
    }

    @Override
    protected boolean matches(ConditionOperator operator, Object value, ContentItem item, RoutingContext context) {
        Optional<String> certification = certification(item);
        if (certification.isEmpty()) {
            return false;
        }
        String actual = Values.normalize(certification.get());
        return switch (operator) {
            case EQUALS, IN -> Values.toNormalizedSet(value).contains(actual);
            case NOT_EQUALS, NOT_IN -> !Values.toNormalizedSet(value).contains(actual);
            case CONTAINS -> Values.toNormalizedSet(value).stream().anyMatch(actual::contains);
            case NOT_CONTAINS -> Values.toNormalizedSet(value).stream().noneMatch(actual::contains);
            case REGEX -> {
                Pattern pattern = RegexSafety.compile(String.valueOf(value)).orElse(null);
                yield pattern != null && RegexSafety.find(pattern, certification.get());
            }
            default -> false;
        };
    }

    private static Optional<String> certification(ContentItem item) {
        return item.metadataOptional()
                .map(ContentMetadata::certification)
                .filter(rating -> !rating.isBlank());
    }

    @Override
    protected void validateValue(ConditionOperator operator, Object value) {
        if (operator != ConditionOperator.REGEX && Values.toNormalizedSet(value).isEmpty()) {
            throw new ConfigurationException("Certification condition requires at least one rating");
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
