package com.pulsarr.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of a watchlist item handed to the router.
 *
 * @param title    Display title
 * @param guids    Ordered typed identifiers such as {@code tmdb:603} or {@code tvdb:81189}
 * @param genres   Genre names as reported by the source
 * @param metadata Optional provider payload carrying year, language and certification
 */
public record ContentItem(String title, List<String> guids, List<String> genres, ContentMetadata metadata) {

    public ContentItem {
        guids = guids != null ? List.copyOf(guids) : List.of();
        genres = genres != null ? List.copyOf(genres) : List.of();
    }

    public Optional<ContentMetadata> metadataOptional() {
        return Optional.ofNullable(metadata);
    }

    /**
     * Copy of this item with the given metadata merged over any missing fields.
     * The receiver is left untouched.
     */
    public ContentItem withMetadata(ContentMetadata enriched) {
        ContentMetadata merged = metadata != null ? metadata.mergeMissing(enriched) : enriched;
        return new ContentItem(title, guids, genres, merged);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String title;
        private final List<String> guids = new ArrayList<>();
        private final List<String> genres = new ArrayList<>();
        private ContentMetadata metadata;

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder guid(String guid) {
            this.guids.add(guid);
            return this;
        }

        public Builder guids(List<String> guids) {
            this.guids.addAll(guids);
            return this;
        }

        public Builder genre(String genre) {
            this.genres.add(genre);
            return this;
        }

        public Builder genres(List<String> genres) {
            this.genres.addAll(genres);
            return this;
        }

        public Builder metadata(ContentMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public ContentItem build() {
            return new ContentItem(title, guids, genres, metadata);
        }
    }
}
