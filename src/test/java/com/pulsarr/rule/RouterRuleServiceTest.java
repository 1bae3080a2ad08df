package com.pulsarr.rule;

import com.pulsarr.condition.Condition;
import com.pulsarr.condition.ConditionGroup;
import com.pulsarr.condition.ConditionOperator;
import com.pulsarr.core.TargetType;
import com.pulsarr.evaluator.EvaluatorRegistry;
import com.pulsarr.evaluator.RuleValidator;
import com.pulsarr.exception.ConfigurationException;
import com.pulsarr.exception.ReferentialIntegrityException;
import com.pulsarr.instance.Instance;
import com.pulsarr.support.InMemoryInstanceRepository;
import com.pulsarr.support.InMemoryRouterRuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RouterRuleServiceTest {

    private InMemoryRouterRuleRepository repository;
    private RouterRuleService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRouterRuleRepository();
        InMemoryInstanceRepository instances = new InMemoryInstanceRepository(
                Instance.of(1, TargetType.RADARR, "Radarr", true),
                Instance.of(10, TargetType.SONARR, "Sonarr", true));
        service = new RouterRuleService(repository, instances, new RuleValidator(EvaluatorRegistry.create(repository)));
    }

    private static RouterRule.Builder genreRule(TargetType type, int instanceId) {
        return RouterRule.builder("Drama", RuleFamily.GENRE).target(type, instanceId).criterion("genre", "Drama");
    }

    @Test
    @DisplayName("Should save a valid rule")
    void savesValidRule() {
        RouterRule saved = service.save(genreRule(TargetType.RADARR, 1).build());

        assertNotNull(saved.id());
        assertEquals(List.of(saved), repository.findAll());
    }

    @Test
    @DisplayName("Should refuse a rule targeting an unknown instance")
    void unknownInstance() {
        assertThrows(ReferentialIntegrityException.class, () -> service.save(genreRule(TargetType.RADARR, 2).build()));
        assertTrue(repository.findAll().isEmpty());
    }

    @Test
    @DisplayName("Should refuse a rule whose target type differs from the instance type")
    void typeMismatch() {
        ReferentialIntegrityException e = assertThrows(ReferentialIntegrityException.class,
                () -> service.save(genreRule(TargetType.RADARR, 10).build()));

        assertTrue(e.getMessage().contains("sonarr"));
    }

    @Test
    @DisplayName("Should refuse invalid rules before touching storage")
    void invalidRules() {
        assertThrows(ConfigurationException.class, () -> service.save(genreRule(TargetType.RADARR, 1)
                .priority(-1).build()));
        assertThrows(ConfigurationException.class, () -> service.save(
                RouterRule.builder("No genre", RuleFamily.GENRE).target(TargetType.RADARR, 1).build()));
        assertThrows(ConfigurationException.class, () -> service.save(
                RouterRule.builder("Bad operator", RuleFamily.YEAR).target(TargetType.RADARR, 1)
                        .criterion("year", 1999).criterion("operator", "regex").build()));
        assertThrows(ConfigurationException.class, () -> service.save(
                RouterRule.builder("Unknown field", RuleFamily.CONDITIONAL).target(TargetType.RADARR, 1)
                        .condition(ConditionGroup.and(Condition.of("studio", ConditionOperator.EQUALS, "A24")))
                        .build()));
        assertTrue(repository.findAll().isEmpty());
    }

    @Test
    @DisplayName("Should save several rules and delete them by id")
    void saveAllAndDelete() {
        List<RouterRule> saved = service.saveAll(List.of(
                genreRule(TargetType.RADARR, 1).build(),
                RouterRule.builder("Kids shows", RuleFamily.CERTIFICATION).target(TargetType.SONARR, 10)
                        .criterion("certification", List.of("TV-Y", "TV-G")).build()));

        assertEquals(2, saved.size());
        assertTrue(service.delete(saved.get(0).id()));
        assertFalse(service.delete(saved.get(0).id()));
        assertEquals(1, repository.findAll().size());
    }
}
