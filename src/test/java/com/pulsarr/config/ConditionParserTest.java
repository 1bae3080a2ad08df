package com.pulsarr.config;

import com.pulsarr.condition.Condition;
import com.pulsarr.condition.ConditionGroup;
import com.pulsarr.condition.ConditionNode;
import com.pulsarr.condition.ConditionOperator;
import com.pulsarr.condition.LogicalOperator;
import com.pulsarr.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConditionParserTest {

    @Test
    @DisplayName("Should parse nested groups with negation")
    void parsesNestedGroups() {
        Map<String, Object> raw = Map.of(
                "operator", "and",
                "conditions", List.of(
                        Map.of("field", "genre", "operator", "in", "value", List.of("Horror")),
                        Map.of("operator", "OR", "negate", "true", "conditions", List.of(
                                Map.of("field", "certification", "operator", "equals", "value", "R")))));

        ConditionNode node = ConditionParser.parse(raw);

        ConditionGroup root = assertInstanceOf(ConditionGroup.class, node);
        assertEquals(LogicalOperator.AND, root.operator());
        assertFalse(root.negate());
        assertEquals(new Condition("genre", "in", List.of("Horror"), false), root.conditions().get(0));
        ConditionGroup inner = assertInstanceOf(ConditionGroup.class, root.conditions().get(1));
        assertEquals(LogicalOperator.OR, inner.operator());
        assertTrue(inner.negate());
    }

    @Test
    @DisplayName("Should keep unknown operators so the leaf simply never matches")
    void keepsUnknownOperator() {
        ConditionNode node = ConditionParser.parse(Map.of("field", "year", "operator", "around", "value", 1999));

        assertEquals(new Condition("year", "around", 1999, false), node);
    }

    @Test
    @DisplayName("Should reject leaves missing a field, operator or value")
    void rejectsIncompleteLeaves() {
        assertThrows(ConfigurationException.class,
                () -> ConditionParser.parse(Map.of("operator", "equals", "value", "R")));
        assertThrows(ConfigurationException.class,
                () -> ConditionParser.parse(Map.of("field", "certification", "value", "R")));
        assertThrows(ConfigurationException.class,
                () -> ConditionParser.parse(Map.of("field", "certification", "operator", "equals")));
    }

    @Test
    @DisplayName("Should reject malformed groups")
    void rejectsMalformedGroups() {
        assertThrows(ConfigurationException.class,
                () -> ConditionParser.parse(Map.of("conditions", List.of())));
        assertThrows(ConfigurationException.class,
                () -> ConditionParser.parse(Map.of("operator", "XOR", "conditions", List.of())));
        assertThrows(ConfigurationException.class,
                () -> ConditionParser.parse(Map.of("operator", "AND", "conditions", "genre")));
        assertThrows(ConfigurationException.class, () -> ConditionParser.parse("genre = Horror"));
    }

    @Test
    @DisplayName("Should parse its own map form back into the same tree")
    void mapFormParsesBack() {
        ConditionNode tree = ConditionGroup.or(
                Condition.of("language", ConditionOperator.EQUALS, "Japanese"),
                Condition.not("year", ConditionOperator.LESS_THAN, 1990));

        Map<String, Object> map = ConditionParser.toMap(tree);

        assertEquals("OR", map.get("operator"));
        assertEquals(tree, ConditionParser.parse(map));
    }
}
