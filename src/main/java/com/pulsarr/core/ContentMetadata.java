package com.pulsarr.core;

import java.util.List;

/**
 * Provider lookup payload attached to a content item.
 * Any field may be null when the provider does not report it.
 *
 * @param year             Release year (first air year for shows)
 * @param originalLanguage Display name of the original language, e.g. "English"
 * @param certification    Content rating, e.g. "PG-13" or "TV-MA"
 * @param seasons          Season numbers reported by Sonarr, empty for movies or when unknown
 */
public record ContentMetadata(Integer year, String originalLanguage, String certification, List<Integer> seasons) {

    public ContentMetadata {
        seasons = seasons == null ? List.of() : List.copyOf(seasons);
    }

    public ContentMetadata(Integer year, String originalLanguage, String certification) {
        this(year, originalLanguage, certification, List.of());
    }

    public static ContentMetadata empty() {
        return new ContentMetadata(null, null, null);
    }

    /**
     * Fill the fields this instance lacks from another payload.
     */
    public ContentMetadata mergeMissing(ContentMetadata other) {
        if (other == null) {
            return this;
        }
        return new ContentMetadata(
                year != null ? year : other.year(),
                originalLanguage != null ? originalLanguage : other.originalLanguage(),
                certification != null ? certification : other.certification(),
                !seasons.isEmpty() ? seasons : other.seasons()
        );
    }
}
