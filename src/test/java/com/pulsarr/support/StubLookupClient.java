package com.pulsarr.support;

import com.pulsarr.core.ContentMetadata;
import com.pulsarr.lookup.ContentLookupClient;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lookup client answering from fixed maps and counting calls.
 */
public class StubLookupClient implements ContentLookupClient {

    private final Map<Integer, ContentMetadata> movies = new HashMap<>();
    private final Map<Integer, ContentMetadata> series = new HashMap<>();
    private final AtomicInteger calls = new AtomicInteger();

    public StubLookupClient movie(int tmdbId, ContentMetadata metadata) {
        movies.put(tmdbId, metadata);
        return this;
    }

    public StubLookupClient series(int tvdbId, ContentMetadata metadata) {
        series.put(tvdbId, metadata);
        return this;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public Optional<ContentMetadata> lookupMovie(int tmdbId) {
        calls.incrementAndGet();
        return Optional.ofNullable(movies.get(tmdbId));
    }

    @Override
    public Optional<ContentMetadata> lookupSeries(int tvdbId) {
        calls.incrementAndGet();
        return Optional.ofNullable(series.get(tvdbId));
    }
}
