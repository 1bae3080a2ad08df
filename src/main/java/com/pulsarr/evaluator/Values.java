package com.pulsarr.evaluator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Coercion of loosely typed criterion values.
 */
final class Values {

    private Values() {
    }

    static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * A scalar becomes a one-element list; lists are flattened to their string forms.
     */
    static List<String> toStrings(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element != null) {
                    result.add(String.valueOf(element));
                }
            }
        } else if (value != null && !(value instanceof Map)) {
            result.add(String.valueOf(value));
        }
        return result;
    }

    static Set<String> toNormalizedSet(Object value) {
        Set<String> result = new LinkedHashSet<>();
        for (String s : toStrings(value)) {
            String normalized = normalize(s);
            if (!normalized.isEmpty()) {
                result.add(normalized);
            }
        }
        return result;
    }

    static Optional<Integer> toInteger(Object value) {
        if (value instanceof Number n) {
            return Optional.of(n.intValue());
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Optional.of(Integer.parseInt(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    static Optional<List<Integer>> toIntegers(Object value) {
        if (!(value instanceof Collection<?> collection)) {
            return toInteger(value).map(List::of);
        }
        List<Integer> result = new ArrayList<>();
        for (Object element : collection) {
            Optional<Integer> number = toInteger(element);
            if (number.isEmpty()) {
                return Optional.empty();
            }
            result.add(number.get());
        }
        return Optional.of(result);
    }

    static boolean isRange(Object value) {
        return value instanceof Map<?, ?> map && (map.containsKey("min") || map.containsKey("max"));
    }
}
