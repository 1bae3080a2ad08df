package com.pulsarr.config;

import com.pulsarr.condition.Condition;
import com.pulsarr.condition.ConditionGroup;
import com.pulsarr.condition.ConditionNode;
import com.pulsarr.condition.LogicalOperator;
import com.pulsarr.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts stored condition maps into condition trees and back.
 * <p>
 * Leaf: {@code {field, operator, value, negate?}}. Group: {@code {operator: AND|OR, conditions: [...], negate?}}.
 */
public final class ConditionParser {

    private ConditionParser() {
    }

    public static ConditionNode parse(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) {
            throw new ConfigurationException("Condition must be an object, got: " + raw);
        }
        if (map.containsKey("conditions")) {
            return parseGroup(map);
        }
        return parseLeaf(map);
    }

    private static ConditionNode parseGroup(Map<?, ?> map) {
        Object operator = map.get("operator");
        if (operator == null) {
            throw new ConfigurationException("Condition group requires an operator (AND or OR)");
        }
        LogicalOperator logical;
        try {
            logical = LogicalOperator.fromValue(operator.toString());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Condition group operator must be AND or OR, got: " + operator, e);
        }
        if (!(map.get("conditions") instanceof List<?> children)) {
            throw new ConfigurationException("Condition group 'conditions' must be a list");
        }
        List<ConditionNode> nodes = new ArrayList<>();
        for (Object child : children) {
            nodes.add(parse(child));
        }
        return new ConditionGroup(logical, nodes, isNegated(map));
    }

    private static ConditionNode parseLeaf(Map<?, ?> map) {
        Object field = map.get("field");
        if (field == null || field.toString().isBlank()) {
            throw new ConfigurationException("Condition requires a field");
        }
        Object operator = map.get("operator");
        if (operator == null || operator.toString().isBlank()) {
            throw new ConfigurationException("Condition on '" + field + "' requires an operator");
        }
        if (!map.containsKey("value") || map.get("value") == null) {
            throw new ConfigurationException("Condition on '" + field + "' requires a value");
        }
        return new Condition(field.toString(), operator.toString(), map.get("value"), isNegated(map));
    }

    private static boolean isNegated(Map<?, ?> map) {
        Object negate = map.get("negate");
        if (negate == null) {
            return false;
        }
        if (negate instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(negate.toString());
    }

    /**
     * Map form of a tree, suitable for JSON or YAML storage.
     */
    public static Map<String, Object> toMap(ConditionNode node) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (node instanceof Condition condition) {
            map.put("field", condition.field());
            map.put("operator", condition.operator());
            map.put("value", condition.value());
        } else if (node instanceof ConditionGroup group) {
            map.put("operator", group.operator().name());
            List<Map<String, Object>> children = new ArrayList<>();
            for (ConditionNode child : group.conditions()) {
                children.add(toMap(child));
            }
            map.put("conditions", children);
        }
        if (node.negate()) {
            map.put("negate", true);
        }
        return map;
    }
}
