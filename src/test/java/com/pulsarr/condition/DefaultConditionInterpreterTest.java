package com.pulsarr.condition;

import com.pulsarr.core.ContentItem;
import com.pulsarr.core.ContentMetadata;
import com.pulsarr.core.ContentType;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.evaluator.GenreEvaluator;
import com.pulsarr.evaluator.LanguageEvaluator;
import com.pulsarr.evaluator.YearEvaluator;
import com.pulsarr.support.InMemoryRouterRuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultConditionInterpreterTest {

    private DefaultConditionInterpreter interpreter;
    private RoutingContext context;

    @BeforeEach
    void setUp() {
        InMemoryRouterRuleRepository rules = new InMemoryRouterRuleRepository();
        interpreter = new DefaultConditionInterpreter(List.of(
                new GenreEvaluator(rules), new YearEvaluator(rules), new LanguageEvaluator(rules)));
        context = RoutingContext.builder(ContentType.MOVIE).user(1, "alice").build();
    }

    private static ContentItem movie(List<String> genres, Integer year) {
        return ContentItem.builder()
                .title("Sample")
                .guid("tmdb:1")
                .genres(genres)
                .metadata(new ContentMetadata(year, "English", "PG"))
                .build();
    }

    @Test
    @DisplayName("Should invert a negated leaf")
    void negatedLeaf() {
        Condition notHorror = Condition.not("genre", ConditionOperator.IN, List.of("Horror"));

        assertTrue(interpreter.evaluate(notHorror, movie(List.of("Comedy"), 2001), context));
        assertFalse(interpreter.evaluate(notHorror, movie(List.of("Horror"), 2001), context));
    }

    @Test
    @DisplayName("Should treat an empty AND as true and an empty OR as false")
    void emptyGroups() {
        ContentItem item = movie(List.of("Drama"), 2001);

        assertTrue(interpreter.evaluate(ConditionGroup.and(), item, context));
        assertFalse(interpreter.evaluate(ConditionGroup.or(), item, context));
        assertFalse(interpreter.evaluate(ConditionGroup.and().negated(), item, context));
        assertTrue(interpreter.evaluate(ConditionGroup.or().negated(), item, context));
    }

    @Test
    @DisplayName("Should evaluate nested groups")
    void nestedGroups() {
        ConditionNode tree = ConditionGroup.and(
                Condition.of("genre", ConditionOperator.IN, List.of("Animation")),
                ConditionGroup.or(
                        Condition.of("year", ConditionOperator.LESS_THAN, 1990),
                        Condition.of("language", ConditionOperator.EQUALS, "Japanese")));

        ContentItem ghibli = ContentItem.builder().title("Totoro").genre("Animation")
                .metadata(new ContentMetadata(1988, "Japanese", "G")).build();
        ContentItem modern = ContentItem.builder().title("Cars").genre("Animation")
                .metadata(new ContentMetadata(2006, "English", "G")).build();

        assertTrue(interpreter.evaluate(tree, ghibli, context));
        assertFalse(interpreter.evaluate(tree, modern, context));
    }

    @Test
    @DisplayName("Should apply group negation after combining children")
    void negatedGroup() {
        ConditionNode notOldHorror = ConditionGroup.and(
                Condition.of("genre", ConditionOperator.IN, List.of("Horror")),
                Condition.of("year", ConditionOperator.LESS_THAN, 1980)).negated();

        assertFalse(interpreter.evaluate(notOldHorror, movie(List.of("Horror"), 1975), context));
        assertTrue(interpreter.evaluate(notOldHorror, movie(List.of("Horror"), 2010), context));
    }

    @Test
    @DisplayName("Should match a year range inclusively")
    void betweenBoundaries() {
        Condition decade = Condition.of("year", ConditionOperator.BETWEEN, Map.of("min", 2000, "max", 2009));

        assertTrue(interpreter.evaluate(decade, movie(List.of(), 2000), context));
        assertTrue(interpreter.evaluate(decade, movie(List.of(), 2005), context));
        assertTrue(interpreter.evaluate(decade, movie(List.of(), 2009), context));
        assertFalse(interpreter.evaluate(decade, movie(List.of(), 1999), context));
        assertFalse(interpreter.evaluate(decade, movie(List.of(), 2010), context));
    }

    @Test
    @DisplayName("Should treat unknown fields and operators as non-matching")
    void unknownFieldOrOperator() {
        ContentItem item = movie(List.of("Drama"), 2001);

        assertFalse(interpreter.evaluate(new Condition("studio", "equals", "A24", false), item, context));
        assertFalse(interpreter.evaluate(new Condition("genre", "startsWith", "Dra", false), item, context));
        assertTrue(interpreter.evaluate(new Condition("genre", "startsWith", "Dra", true), item, context));
    }

    @Test
    @DisplayName("Should evaluate a node that appears twice among siblings")
    void repeatedSibling() {
        ConditionNode same = Condition.of("genre", ConditionOperator.IN, List.of("Drama"));

        assertTrue(interpreter.evaluate(ConditionGroup.and(same, same), movie(List.of("Drama"), 2001), context));
    }

    @Test
    @DisplayName("Should fall through to the next evaluator when one throws")
    void failingEvaluatorFallsThrough() {
        FieldConditionEvaluator broken = new FieldConditionEvaluator() {
            @Override
            public int priority() {
                return 1000;
            }

            @Override
            public boolean canEvaluateConditionField(String field) {
                return "genre".equals(field);
            }

            @Override
            public boolean evaluateCondition(Condition condition, ContentItem item, RoutingContext ctx) {
                throw new IllegalStateException("boom");
            }
        };
        DefaultConditionInterpreter withBroken = new DefaultConditionInterpreter(
                List.of(broken, new GenreEvaluator(new InMemoryRouterRuleRepository())));

        assertTrue(withBroken.evaluate(Condition.of("genre", ConditionOperator.CONTAINS, "Drama"),
                movie(List.of("Drama"), 2001), context));
    }
}
