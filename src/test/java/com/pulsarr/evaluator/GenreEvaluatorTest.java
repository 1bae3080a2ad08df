package com.pulsarr.evaluator;

import com.pulsarr.core.ContentItem;
import com.pulsarr.core.ContentType;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.core.TargetType;
import com.pulsarr.decision.RoutingDecision;
import com.pulsarr.rule.RouterRule;
import com.pulsarr.rule.RuleFamily;
import com.pulsarr.support.InMemoryRouterRuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GenreEvaluatorTest {

    private InMemoryRouterRuleRepository rules;
    private GenreEvaluator evaluator;
    private RoutingContext movieContext;

    @BeforeEach
    void setUp() {
        rules = new InMemoryRouterRuleRepository();
        evaluator = new GenreEvaluator(rules);
        movieContext = RoutingContext.builder(ContentType.MOVIE).build();
    }

    private static ContentItem withGenres(String... genres) {
        return ContentItem.builder().title("Sample").genres(List.of(genres)).build();
    }

    @Test
    @DisplayName("Should route items whose genres overlap the rule's genres")
    void matchesOverlap() {
        RouterRule anime = rules.add(RouterRule.builder("Anime", RuleFamily.GENRE)
                .target(TargetType.RADARR, 2)
                .criterion("genre", List.of("Anime", "Animation"))
                .qualityProfile("Anime-1080p")
                .priority(80)
                .build());

        List<RoutingDecision> decisions = evaluator.evaluate(withGenres("animation", "Fantasy"), movieContext);

        assertNotNull(decisions);
        assertEquals(1, decisions.size());
        assertEquals(2, decisions.get(0).instanceId());
        assertEquals("Anime-1080p", decisions.get(0).qualityProfile());
        assertEquals(anime.id(), decisions.get(0).ruleId());
    }

    @Test
    @DisplayName("Should return null when no rule matches")
    void noMatchIsNull() {
        rules.add(RouterRule.builder("Horror", RuleFamily.GENRE)
                .target(TargetType.RADARR, 2)
                .criterion("genre", "Horror")
                .build());

        assertNull(evaluator.evaluate(withGenres("Comedy"), movieContext));
    }

    @Test
    @DisplayName("Should ignore rules for the other download manager type")
    void filtersByTargetType() {
        rules.add(RouterRule.builder("Anime shows", RuleFamily.GENRE)
                .target(TargetType.SONARR, 10)
                .criterion("genre", "Anime")
                .build());

        assertNull(evaluator.evaluate(withGenres("Anime"), movieContext));
    }

    @Test
    @DisplayName("Should keep one decision per matching rule across instances")
    void keepsAllMatches() {
        rules.add(RouterRule.builder("Kids", RuleFamily.GENRE).target(TargetType.RADARR, 2)
                .criterion("genre", "Family").build());
        rules.add(RouterRule.builder("Kids mirror", RuleFamily.GENRE).target(TargetType.RADARR, 3)
                .criterion("genre", "Family").build());

        List<RoutingDecision> decisions = evaluator.evaluate(withGenres("Family"), movieContext);

        assertEquals(List.of(2, 3), decisions.stream().map(RoutingDecision::instanceId).sorted().toList());
    }

    @Test
    @DisplayName("Should honour notIn and skip disabled rules")
    void notInAndDisabled() {
        rules.add(RouterRule.builder("Not horror", RuleFamily.GENRE).target(TargetType.RADARR, 2)
                .criterion("genre", List.of("Horror")).criterion("operator", "notIn").build());
        rules.add(RouterRule.builder("Disabled", RuleFamily.GENRE).target(TargetType.RADARR, 3)
                .criterion("genre", "Comedy").enabled(false).build());

        List<RoutingDecision> decisions = evaluator.evaluate(withGenres("Comedy"), movieContext);

        assertEquals(1, decisions.size());
        assertEquals(2, decisions.get(0).instanceId());
    }

    @Test
    @DisplayName("Should skip a malformed rule and still evaluate the rest")
    void skipsMalformedRule() {
        rules.add(RouterRule.builder("Broken", RuleFamily.GENRE).target(TargetType.RADARR, 2)
                .criterion("something", "else").build());
        rules.add(RouterRule.builder("Drama", RuleFamily.GENRE).target(TargetType.RADARR, 3)
                .criterion("genre", "Drama").build());

        List<RoutingDecision> decisions = evaluator.evaluate(withGenres("Drama"), movieContext);

        assertEquals(1, decisions.size());
        assertEquals(3, decisions.get(0).instanceId());
    }

    @Test
    @DisplayName("Should return null instead of throwing when rules cannot be loaded")
    void storageFailure() {
        rules.add(RouterRule.builder("Drama", RuleFamily.GENRE).target(TargetType.RADARR, 3)
                .criterion("genre", "Drama").build());
        rules.setFailing(true);

        assertNull(evaluator.evaluate(withGenres("Drama"), movieContext));
    }

    @Test
    @DisplayName("Should match genres by a safe regex")
    void regexOperator() {
        rules.add(RouterRule.builder("Sci", RuleFamily.GENRE).target(TargetType.RADARR, 2)
                .criterion("genre", "^sci").criterion("operator", "regex").build());

        assertNotNull(evaluator.evaluate(withGenres("Science Fiction"), movieContext));
        assertNull(evaluator.evaluate(withGenres("Drama"), movieContext));
    }

    @Test
    @DisplayName("Should not evaluate items without genres")
    void cannotEvaluateWithoutGenres() {
        assertFalse(evaluator.canEvaluate(withGenres(), movieContext));
        assertTrue(evaluator.canEvaluate(withGenres("Drama"), movieContext));
    }
}
