package com.pulsarr.evaluator;

import com.pulsarr.condition.Condition;
import com.pulsarr.condition.ConditionOperator;
import com.pulsarr.core.ContentItem;
import com.pulsarr.core.ContentMetadata;
import com.pulsarr.core.ContentType;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.core.TargetType;
import com.pulsarr.rule.RouterRule;
import com.pulsarr.rule.RuleFamily;
import com.pulsarr.support.InMemoryRouterRuleRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CertificationEvaluatorTest {

    private final CertificationEvaluator evaluator = new CertificationEvaluator(new InMemoryRouterRuleRepository());
    private final RoutingContext context = RoutingContext.builder(ContentType.MOVIE).build();

    private static ContentItem rated(String certification) {
        return ContentItem.builder().title("Sample").metadata(new ContentMetadata(2010, null, certification)).build();
    }

    @ParameterizedTest(name = "{0} {1} {2} on {3} -> {4}")
    @CsvSource({
            "certification, equals,      R,      R,     true",
            "certification, equals,      r,      R,     true",
            "certification, notEquals,   R,      PG,    true",
            "certification, contains,    PG,     PG-13, true",
            "certification, notContains, PG,     R,     true",
            "certification, regex,       ^TV-,   TV-MA, true",
            "certification, regex,       ^TV-,   R,     false",
            "certification, in,          G,      PG,    false"
    })
    @DisplayName("Should apply each certification operator")
    void operators(String field, String operator, String value, String actual, boolean expected) {
        assertEquals(expected,
                evaluator.evaluateCondition(new Condition(field, operator, value, false), rated(actual), context));
    }

    @Test
    @DisplayName("Should route a list of ratings with the in operator by default")
    void listCriteria() {
        InMemoryRouterRuleRepository rules = new InMemoryRouterRuleRepository();
        rules.add(RouterRule.builder("Kids", RuleFamily.CERTIFICATION).target(TargetType.RADARR, 4)
                .criterion("certification", List.of("G", "PG")).build());
        CertificationEvaluator withRules = new CertificationEvaluator(rules);

        assertNotNull(withRules.evaluate(rated("PG"), context));
        assertNull(withRules.evaluate(rated("R"), context));
    }

    @Test
    @DisplayName("Should treat an unsafe regex as non-matching")
    void unsafeRegex() {
        assertFalse(evaluator.evaluateCondition(Condition.of("certification", ConditionOperator.REGEX, "(a+)+$"),
                rated("aaaaaaaaaaaaaaaaaaaaaaaaaaaa!"), context));
    }
}
