package com.pulsarr.evaluator;

import java.util.List;

/**
 * Describes a condition field an evaluator understands.
 *
 * @param name        Field key used in conditions
 * @param description Text for rule-authoring screens
 * @param valueTypes  Accepted value shapes (string, number, string[], number[], range)
 */
public record FieldInfo(String name, String description, List<String> valueTypes) {
}
