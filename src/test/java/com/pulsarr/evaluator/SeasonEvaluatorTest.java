package com.pulsarr.evaluator;

import com.pulsarr.condition.Condition;
import com.pulsarr.condition.ConditionOperator;
import com.pulsarr.core.ContentItem;
import com.pulsarr.core.ContentMetadata;
import com.pulsarr.core.ContentType;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.core.TargetType;
import com.pulsarr.exception.ConfigurationException;
import com.pulsarr.rule.RouterRule;
import com.pulsarr.rule.RuleFamily;
import com.pulsarr.support.InMemoryRouterRuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SeasonEvaluatorTest {

    private InMemoryRouterRuleRepository rules;
    private SeasonEvaluator evaluator;
    private RoutingContext shows;

    @BeforeEach
    void setUp() {
        rules = new InMemoryRouterRuleRepository();
        evaluator = new SeasonEvaluator(rules);
        shows = RoutingContext.builder(ContentType.SHOW).build();
    }

    private static ContentItem withSeasons(Integer... seasons) {
        return ContentItem.builder().title("Sample Show")
                .metadata(new ContentMetadata(2008, "English", "TV-MA", List.of(seasons))).build();
    }

    @ParameterizedTest(name = "{0} {1} against seasons 0-5 -> {2}")
    @CsvSource({
            "equals, 3, true",
            "equals, 6, false",
            "notEquals, 6, true",
            "notEquals, 0, false",
            "greaterThan, 4, true",
            "greaterThan, 5, false",
            "lessThan, 1, true",
            "lessThan, 0, false"
    })
    @DisplayName("Should match when any season satisfies a scalar comparison")
    void scalarOperators(String operator, int value, boolean expected) {
        Condition condition = new Condition("season", operator, value, false);

        assertEquals(expected, evaluator.evaluateCondition(condition, withSeasons(0, 1, 2, 3, 4, 5), shows));
    }

    @Test
    @DisplayName("Should match list operators against any season")
    void listOperators() {
        ContentItem show = withSeasons(1, 2, 3);

        assertTrue(evaluator.evaluateCondition(Condition.of("season", ConditionOperator.IN, List.of(3, 7)), show, shows));
        assertFalse(evaluator.evaluateCondition(Condition.of("season", ConditionOperator.IN, List.of(7, 8)), show, shows));
        assertTrue(evaluator.evaluateCondition(Condition.of("season", ConditionOperator.NOT_IN, List.of(7, 8)), show, shows));
        assertFalse(evaluator.evaluateCondition(Condition.of("season", ConditionOperator.NOT_IN, List.of(2)), show, shows));
    }

    @Test
    @DisplayName("Should match a range overlapping the span of seasons")
    void rangeOverlap() {
        ContentItem show = withSeasons(4, 5, 6);

        assertTrue(evaluator.evaluateCondition(
                Condition.of("season", ConditionOperator.BETWEEN, Map.of("min", 1, "max", 4)), show, shows));
        assertTrue(evaluator.evaluateCondition(
                Condition.of("season", ConditionOperator.BETWEEN, Map.of("min", 6)), show, shows));
        assertFalse(evaluator.evaluateCondition(
                Condition.of("season", ConditionOperator.BETWEEN, Map.of("min", 7, "max", 9)), show, shows));
    }

    @Test
    @DisplayName("Should route Sonarr rules with the operator derived from the value shape")
    void routesByCriteria() {
        rules.add(RouterRule.builder("Long runners", RuleFamily.SEASON).target(TargetType.SONARR, 10)
                .criterion("season", Map.of("min", 10)).build());
        rules.add(RouterRule.builder("Has specials", RuleFamily.SEASON).target(TargetType.SONARR, 11)
                .criterion("season", 0).build());

        assertEquals(10, evaluator.evaluate(withSeasons(1, 12), shows).get(0).instanceId());
        assertEquals(11, evaluator.evaluate(withSeasons(0, 1), shows).get(0).instanceId());
        assertNull(evaluator.evaluate(withSeasons(1, 2), shows));
    }

    @Test
    @DisplayName("Should not evaluate movies or shows without season data")
    void requiresShowWithSeasons() {
        RoutingContext movies = RoutingContext.builder(ContentType.MOVIE).build();
        Condition first = Condition.of("season", ConditionOperator.EQUALS, 1);

        assertFalse(evaluator.canEvaluate(withSeasons(1), movies));
        assertFalse(evaluator.evaluateCondition(first, withSeasons(1), movies));
        assertFalse(evaluator.canEvaluate(withSeasons(), shows));
        assertFalse(evaluator.evaluateCondition(first, withSeasons(), shows));
        assertTrue(evaluator.canEvaluate(withSeasons(1), shows));
    }

    @Test
    @DisplayName("Should reject malformed season values at validation")
    void validation() {
        assertThrows(ConfigurationException.class,
                () -> evaluator.validateCondition(Condition.of("season", ConditionOperator.GREATER_THAN, "late")));
        assertThrows(ConfigurationException.class,
                () -> evaluator.validateCondition(Condition.of("season", ConditionOperator.REGEX, "1.*")));
        assertThrows(ConfigurationException.class,
                () -> evaluator.validateCriteria(Map.of("operator", "equals")));
        assertDoesNotThrow(
                () -> evaluator.validateCondition(Condition.of("season", ConditionOperator.BETWEEN, Map.of("max", 3))));
    }
}
