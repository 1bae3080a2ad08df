package com.pulsarr.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GuidsTest {

    @ParameterizedTest
    @ValueSource(strings = {"tmdb:603", "tmdb://603", "TMDB:603", " tmdb:603 "})
    @DisplayName("Should read the tmdb id in every accepted form")
    void readsTmdbId(String guid) {
        assertEquals(Optional.of(603), Guids.tmdbId(List.of("imdb:tt0133093", guid)));
    }

    @Test
    @DisplayName("Should skip ids that are not plain numbers")
    void skipsNonNumericIds() {
        assertEquals(Optional.empty(), Guids.tmdbId(List.of("tmdb:abc", "tmdb:", "tmdb://1234567890")));
        assertEquals(Optional.of(81189), Guids.tvdbId(List.of("tvdb:x1", "tvdb:81189")));
    }

    @Test
    @DisplayName("Should not confuse providers")
    void matchesProviderOnly() {
        assertEquals(Optional.empty(), Guids.tvdbId(List.of("tmdb:603")));
        assertEquals(Optional.empty(), Guids.tmdbId(null));
    }

    @Test
    @DisplayName("Should key an item by the context key, then its first guid")
    void contentKey() {
        ContentItem item = ContentItem.builder().title("The Matrix").guid("tmdb:603").guid("imdb:tt0133093").build();
        RoutingContext keyed = RoutingContext.builder(ContentType.MOVIE).itemKey("plex://movie/5d77").build();
        RoutingContext unkeyed = RoutingContext.builder(ContentType.MOVIE).build();

        assertEquals(Optional.of("plex://movie/5d77"), Guids.contentKey(item, keyed));
        assertEquals(Optional.of("tmdb:603"), Guids.contentKey(item, unkeyed));
        assertEquals(Optional.empty(), Guids.contentKey(ContentItem.builder().title("Untracked").build(), unkeyed));
    }
}
