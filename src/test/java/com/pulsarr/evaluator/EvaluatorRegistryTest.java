package com.pulsarr.evaluator;

import com.pulsarr.exception.ConfigurationException;
import com.pulsarr.rule.RuleFamily;
import com.pulsarr.support.InMemoryRouterRuleRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvaluatorRegistryTest {

    private final InMemoryRouterRuleRepository rules = new InMemoryRouterRuleRepository();

    @Test
    @DisplayName("Should order evaluators by descending priority")
    void ordersByPriority() {
        EvaluatorRegistry registry = EvaluatorRegistry.create(rules);

        assertEquals(List.of(RuleFamily.CONDITIONAL, RuleFamily.GENRE, RuleFamily.USER, RuleFamily.YEAR,
                        RuleFamily.SEASON, RuleFamily.LANGUAGE, RuleFamily.CERTIFICATION),
                registry.evaluators().stream().map(RoutingEvaluator::family).toList());
    }

    @Test
    @DisplayName("Should reject two evaluators for one family")
    void rejectsDuplicateFamily() {
        assertThrows(ConfigurationException.class,
                () -> new EvaluatorRegistry(List.of(new GenreEvaluator(rules), new GenreEvaluator(rules))));
    }

    @Test
    @DisplayName("Should find the evaluator claiming a condition field")
    void findsByField() {
        EvaluatorRegistry registry = EvaluatorRegistry.create(rules);

        assertEquals(RuleFamily.LANGUAGE, registry.forField("originalLanguage").orElseThrow().family());
        assertEquals(RuleFamily.USER, registry.forField("userName").orElseThrow().family());
        assertEquals(RuleFamily.SEASON, registry.forField("season").orElseThrow().family());
        assertTrue(registry.forField("studio").isEmpty());
        assertEquals(7, registry.metadata().size());
    }
}
