package com.pulsarr.evaluator;

import com.pulsarr.rule.RuleFamily;

import java.util.List;
import java.util.Map;

/**
 * Read-only capability description of one evaluator.
 */
public record EvaluatorMetadata(
        String name,
        RuleFamily family,
        int priority,
        String description,
        List<FieldInfo> supportedFields,
        Map<String, List<OperatorInfo>> supportedOperators
) {
}
