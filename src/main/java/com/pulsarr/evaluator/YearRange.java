package com.pulsarr.evaluator;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Inclusive year range; a missing bound is open.
 */
record YearRange(Integer min, Integer max) {

    boolean contains(int year) {
        return (min == null || year >= min) && (max == null || year <= max);
    }

    /**
     * Parse {@code {min?, max?}} or a two-element list {@code [min, max]}.
     */
    static Optional<YearRange> from(Object value) {
        if (value instanceof Map<?, ?> map) {
            Optional<Integer> min = Values.toInteger(map.get("min"));
            Optional<Integer> max = Values.toInteger(map.get("max"));
            if ((map.get("min") != null && min.isEmpty()) || (map.get("max") != null && max.isEmpty())) {
                return Optional.empty();
            }
            if (min.isEmpty() && max.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new YearRange(min.orElse(null), max.orElse(null)));
        }
        if (value instanceof List<?> list && list.size() == 2) {
            Optional<Integer> min = Values.toInteger(list.get(0));
            Optional<Integer> max = Values.toInteger(list.get(1));
            if (min.isPresent() && max.isPresent()) {
                return Optional.of(new YearRange(min.get(), max.get()));
            }
        }
        return Optional.empty();
    }
}
