package com.pulsarr.condition;

/**
 * Leaf comparison of one field against a value.
 *
 * @param field    Field key claimed by a field evaluator (e.g. "genre", "year")
 * @param operator Operator wire name (e.g. "in", "between"); kept raw so stored trees with an
 *                 operator unknown to this build still load and simply fail to match
 * @param value    String, number, list, or range map {@code {min, max}}
 * @param negate   Invert the leaf result
 */
public record Condition(String field, String operator, Object value, boolean negate) implements ConditionNode {

    public static Condition of(String field, ConditionOperator operator, Object value) {
        return new Condition(field, operator.value(), value, false);
    }

    public static Condition not(String field, ConditionOperator operator, Object value) {
        return new Condition(field, operator.value(), value, true);
    }

    @Override
    public String toString() {
        return (negate ? "NOT " : "") + field + " " + operator + " " + value;
    }
}
