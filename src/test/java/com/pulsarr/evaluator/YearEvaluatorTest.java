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

class YearEvaluatorTest {

    private InMemoryRouterRuleRepository rules;
    private YearEvaluator evaluator;
    private RoutingContext context;

    @BeforeEach
    void setUp() {
        rules = new InMemoryRouterRuleRepository();
        evaluator = new YearEvaluator(rules);
        context = RoutingContext.builder(ContentType.MOVIE).build();
    }

    private static ContentItem released(Integer year) {
        return ContentItem.builder().title("Sample").metadata(new ContentMetadata(year, null, null)).build();
    }

    @ParameterizedTest(name = "{0} in 2000-2009 -> {1}")
    @CsvSource({
            "1999, false",
            "2000, true",
            "2005, true",
            "2009, true",
            "2010, false"
    })
    @DisplayName("Should treat range criteria as inclusive on both ends")
    void inclusiveRange(int year, boolean expected) {
        rules.add(RouterRule.builder("2000s", RuleFamily.YEAR).target(TargetType.RADARR, 2)
                .criterion("year", Map.of("min", 2000, "max", 2009)).build());

        assertEquals(expected, evaluator.evaluate(released(year), context) != null);
    }

    @Test
    @DisplayName("Should support open-ended ranges")
    void openEndedRange() {
        Condition from2020 = new Condition("year", "between", Map.of("min", 2020), false);

        assertTrue(evaluator.evaluateCondition(from2020, released(2024), context));
        assertFalse(evaluator.evaluateCondition(from2020, released(2019), context));
    }

    @Test
    @DisplayName("Should derive the operator from the criteria value shape")
    void defaultOperatorByShape() {
        rules.add(RouterRule.builder("Exact", RuleFamily.YEAR).target(TargetType.RADARR, 2)
                .criterion("year", 1999).build());
        rules.add(RouterRule.builder("Listed", RuleFamily.YEAR).target(TargetType.RADARR, 3)
                .criterion("year", List.of(1984, 2001)).build());

        assertEquals(2, evaluator.evaluate(released(1999), context).get(0).instanceId());
        assertEquals(3, evaluator.evaluate(released(2001), context).get(0).instanceId());
        assertNull(evaluator.evaluate(released(2000), context));
    }

    @Test
    @DisplayName("Should compare with greaterThan and lessThan strictly")
    void strictComparisons() {
        assertTrue(evaluator.evaluateCondition(Condition.of("year", ConditionOperator.GREATER_THAN, 2000),
                released(2001), context));
        assertFalse(evaluator.evaluateCondition(Condition.of("year", ConditionOperator.GREATER_THAN, 2000),
                released(2000), context));
        assertTrue(evaluator.evaluateCondition(Condition.of("year", ConditionOperator.LESS_THAN, "1980"),
                released(1979), context));
    }

    @Test
    @DisplayName("Should not match or evaluate items without a year")
    void missingYear() {
        assertFalse(evaluator.canEvaluate(released(null), context));
        assertFalse(evaluator.evaluateCondition(Condition.of("year", ConditionOperator.EQUALS, 2000),
                released(null), context));
    }

    @Test
    @DisplayName("Should reject malformed year values at validation")
    void validation() {
        assertThrows(ConfigurationException.class,
                () -> evaluator.validateCondition(Condition.of("year", ConditionOperator.BETWEEN, "recent")));
        assertThrows(ConfigurationException.class,
                () -> evaluator.validateCondition(Condition.of("year", ConditionOperator.REGEX, "19.*")));
        assertDoesNotThrow(
                () -> evaluator.validateCondition(Condition.of("year", ConditionOperator.IN, List.of(1999, 2000))));
    }
}
