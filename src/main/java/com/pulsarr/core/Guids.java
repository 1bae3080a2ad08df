package com.pulsarr.core;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Helpers for typed external identifiers ({@code tmdb:603}, {@code tvdb://81189}).
 */
public final class Guids {

    private Guids() {
    }

    /**
     * Find the numeric id for a provider prefix, accepting both {@code prefix:id} and
     * {@code prefix://id}.
     */
    public static Optional<Integer> extractId(List<String> guids, String provider) {
        if (guids == null) {
            return Optional.empty();
        }
        String prefix = provider.toLowerCase(Locale.ROOT) + ":";
        for (String guid : guids) {
            if (guid == null) {
                continue;
            }
            String normalized = guid.trim().toLowerCase(Locale.ROOT);
            if (!normalized.startsWith(prefix)) {
                continue;
            }
            String id = normalized.substring(prefix.length());
            if (id.startsWith("//")) {
                id = id.substring(2);
            }
            if (!id.isEmpty() && id.length() <= 9 && id.chars().allMatch(Character::isDigit)) {
                return Optional.of(Integer.parseInt(id));
            }
        }
        return Optional.empty();
    }

    public static Optional<Integer> tmdbId(List<String> guids) {
        return extractId(guids, "tmdb");
    }

    public static Optional<Integer> tvdbId(List<String> guids) {
        return extractId(guids, "tvdb");
    }

    /**
     * Key identifying an item across requests: the context's item key when present,
     * otherwise the first GUID.
     */
    public static Optional<String> contentKey(ContentItem item, RoutingContext context) {
        if (context.itemKey() != null && !context.itemKey().isBlank()) {
            return Optional.of(context.itemKey());
        }
        return item.guids().isEmpty() ? Optional.empty() : Optional.of(item.guids().get(0));
    }
}
