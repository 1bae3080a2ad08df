package com.pulsarr.plugin;

import com.pulsarr.core.ContentItem;
import com.pulsarr.core.ContentMetadata;
import com.pulsarr.core.ContentType;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.core.TargetType;
import com.pulsarr.decision.RoutingDecision;
import com.pulsarr.evaluator.LanguageEvaluator;
import com.pulsarr.evaluator.YearEvaluator;
import com.pulsarr.rule.RouterRule;
import com.pulsarr.rule.RuleFamily;
import com.pulsarr.support.InMemoryRouterRuleRepository;
import com.pulsarr.support.StubLookupClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LookupPluginTest {

    private InMemoryRouterRuleRepository rules;
    private StubLookupClient lookup;
    private YearRoutePlugin yearPlugin;
    private LanguageRoutePlugin languagePlugin;
    private final RoutingContext movieContext = RoutingContext.builder(ContentType.MOVIE).build();

    @BeforeEach
    void setUp() {
        rules = new InMemoryRouterRuleRepository();
        lookup = new StubLookupClient()
                .movie(603, new ContentMetadata(1999, "English", "R"))
                .series(81189, new ContentMetadata(2008, "English", "TV-MA"));
        yearPlugin = new YearRoutePlugin(new YearEvaluator(rules), rules, lookup);
        languagePlugin = new LanguageRoutePlugin(new LanguageEvaluator(rules), rules, lookup);
    }

    @Test
    @DisplayName("Should look up a missing year and route on the enriched item")
    void routesAfterLookup() {
        rules.add(RouterRule.builder("90s", RuleFamily.YEAR).target(TargetType.RADARR, 5)
                .criterion("year", Map.of("min", 1990, "max", 1999)).build());
        ContentItem matrix = ContentItem.builder().title("The Matrix").guid("imdb:tt0133093").guid("tmdb://603").build();

        List<RoutingDecision> decisions = yearPlugin.evaluateRouting(matrix, movieContext);

        assertEquals(1, decisions.size());
        assertEquals(5, decisions.get(0).instanceId());
        assertEquals(1, lookup.calls());
    }

    @Test
    @DisplayName("Should look up shows by their tvdb id")
    void showsUseTvdb() {
        rules.add(RouterRule.builder("English shows", RuleFamily.LANGUAGE).target(TargetType.SONARR, 10)
                .criterion("originalLanguage", "English").build());
        ContentItem show = ContentItem.builder().title("Breaking Bad").guid("tvdb:81189").build();

        List<RoutingDecision> decisions =
                languagePlugin.evaluateRouting(show, RoutingContext.builder(ContentType.SHOW).build());

        assertEquals(10, decisions.get(0).instanceId());
    }

    @Test
    @DisplayName("Should not call out when the item already has the field")
    void skipsWhenFieldPresent() {
        rules.add(RouterRule.builder("90s", RuleFamily.YEAR).target(TargetType.RADARR, 5)
                .criterion("year", 1999).build());
        ContentItem known = ContentItem.builder().title("The Matrix").guid("tmdb:603")
                .metadata(new ContentMetadata(1999, null, null)).build();

        assertNull(yearPlugin.evaluateRouting(known, movieContext));
        assertEquals(0, lookup.calls());
    }

    @Test
    @DisplayName("Should not call out when no enabled rules exist for the content type")
    void skipsWithoutRules() {
        rules.add(RouterRule.builder("Shows only", RuleFamily.YEAR).target(TargetType.SONARR, 10)
                .criterion("year", 1999).build());
        rules.add(RouterRule.builder("Disabled", RuleFamily.YEAR).target(TargetType.RADARR, 5)
                .criterion("year", 1999).enabled(false).build());

        assertNull(yearPlugin.evaluateRouting(ContentItem.builder().title("M").guid("tmdb:603").build(),
                movieContext));
        assertEquals(0, lookup.calls());
    }

    @Test
    @DisplayName("Should yield no decision when the item has no usable id or the lookup finds nothing")
    void noIdOrNoResult() {
        rules.add(RouterRule.builder("90s", RuleFamily.YEAR).target(TargetType.RADARR, 5)
                .criterion("year", 1999).build());

        assertNull(yearPlugin.evaluateRouting(ContentItem.builder().title("X").guid("imdb:tt1").build(),
                movieContext));
        assertEquals(0, lookup.calls());
        assertNull(yearPlugin.evaluateRouting(ContentItem.builder().title("Y").guid("tmdb:1").build(),
                movieContext));
        assertEquals(1, lookup.calls());
    }
}
