package com.pulsarr.evaluator;

import com.pulsarr.condition.ConditionOperator;

/**
 * Describes an operator a field accepts.
 *
 * @param operator    Operator
 * @param description Text for rule-authoring screens
 * @param valueTypes  Accepted value shapes
 */
public record OperatorInfo(ConditionOperator operator, String description, String valueTypes) {

    public String name() {
        return operator.value();
    }
}
