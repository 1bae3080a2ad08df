package com.pulsarr.evaluator;

import com.pulsarr.condition.Condition;
import com.pulsarr.condition.ConditionOperator;
import com.pulsarr.core.ContentItem;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.exception.ConfigurationException;
import com.pulsarr.rule.RouterRuleRepository;
import com.pulsarr.rule.RuleFamily;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Routes by genre. Genres are compared trimmed and lower-cased.
 * <ul>
 *   <li>{@code contains}/{@code in}: any overlap</li>
 *   <li>{@code notContains}/{@code notIn}: no overlap</li>
 *   <li>{@code equals}: the item's genre set equals the rule's</li>
 *   <li>{@code regex}: any genre matches</li>
 * </ul>
 * Items without genre data never match.
 */
public class GenreEvaluator extends AbstractRuleEvaluator {

    public static final int PRIORITY = 80;

    private static final List<FieldInfo> FIELDS = List.of(
            new FieldInfo("genre", "Genres of the content", List.of("string", "string[]")),
            new FieldInfo("genres", "Genres of the content", List.of("string", "string[]"))
    );

    private static final List<OperatorInfo> OPERATORS = List.of(
            new OperatorInfo(ConditionOperator.CONTAINS, "Has any of the genres", "string | string[]"),
            new OperatorInfo(ConditionOperator.IN, "Has any of the genres", "string | string[]"),
            new OperatorInfo(ConditionOperator.NOT_CONTAINS, "Has none of the genres", "string | string[]"),
            new OperatorInfo(ConditionOperator.NOT_IN, "Has none of the genres", "string | string[]"),
            new OperatorInfo(ConditionOperator.EQUALS, "Has exactly these genres", "string | string[]"),
            new OperatorInfo(ConditionOperator.REGEX, "Any genre matches the pattern", "string")
    );

    private static final Map<String, List<OperatorInfo>> OPERATORS_BY_FIELD = sameOperators(FIELDS, OPERATORS);

    public GenreEvaluator(RouterRuleRepository rules) {
        super(RuleFamily.GENRE, PRIORITY, rules);
    }

    @Override
    public String description() {
        return "Routes content based on its genres";
    }

    @Override
    public boolean canEvaluate(ContentItem item, RoutingContext context) {
        return !item.genres().isEmpty();
    }

    @Override
    protected Condition criteriaCondition(Map<String, Object> criteria) {
        Object genre = criteria.containsKey("genre") ? criteria.get("genre") : criteria.get("genres");
        if (genre == null) {
            throw new ConfigurationException("Genre rule criteria require 'genre'");
        }
        return new Condition("genre", criteriaOperator(criteria, ConditionOperator.IN.value()), genre, false);
    }

    @Override
    protected boolean matches(ConditionOperator operator, Object value, ContentItem item, RoutingContext context) {
        Set<String> itemGenres = Values.toNormalizedSet(item.genres());
        if (itemGenres.isEmpty()) {
            return false;
        }
        return switch (operator) {
            case CONTAINS, IN -> overlaps(itemGenres, Values.toNormalizedSet(value));
            case NOT_CONTAINS, NOT_IN -> !overlaps(itemGenres, Values.toNormalizedSet(value));
            case EQUALS -> itemGenres.equals(Values.toNormalizedSet(value));
            case REGEX -> matchesPattern(item.genres(), String.valueOf(value));
            default -> false;
        };
    }

    private static boolean overlaps(Set<String> itemGenres, Set<String> ruleGenres) {
        for (String genre : ruleGenres) {
            if (itemGenres.contains(genre)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesPattern(List<String> genres, String regex) {
        Pattern pattern = RegexSafety.compile(regex).orElse(null);
        if (pattern == null) {
            return false;
        }
        return genres.stream().anyMatch(genre -> RegexSafety.find(pattern, genre));
    }

    @Override
    protected void validateValue(ConditionOperator operator, Object value) {
        if (operator != ConditionOperator.REGEX && Values.toNormalizedSet(value).isEmpty()) {
            throw new ConfigurationException("Genre condition requires at least one genre");
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
