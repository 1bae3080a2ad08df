package com.pulsarr.lookup;

import com.pulsarr.core.ContentItem;
import com.pulsarr.core.ContentMetadata;
import com.pulsarr.core.ContentType;
import com.pulsarr.core.Guids;

import java.util.Optional;

/**
 * Resolves external ids to metadata through a download manager's lookup endpoint.
 * Implementations never throw: failures and timeouts are logged and reported as empty.
 */
public interface ContentLookupClient {

    Optional<ContentMetadata> lookupMovie(int tmdbId);

    Optional<ContentMetadata> lookupSeries(int tvdbId);

    /**
     * Look up an item by its tmdb GUID for movies or its tvdb GUID for shows.
     * Empty without a matching GUID.
     */
    default Optional<ContentMetadata> lookup(ContentItem item, ContentType contentType) {
        if (contentType == ContentType.MOVIE) {
            return Guids.tmdbId(item.guids()).flatMap(this::lookupMovie);
        }
        return Guids.tvdbId(item.guids()).flatMap(this::lookupSeries);
    }
}
