package com.pulsarr.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import com.pulsarr.core.ContentMetadata;
import com.pulsarr.core.TargetType;
import com.pulsarr.instance.Instance;
import com.pulsarr.instance.InstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lookup against the default Radarr/Sonarr instance's v3 API.
 * <ul>
 *   <li>Radarr: {@code GET /api/v3/movie/lookup/tmdb?tmdbId={id}}</li>
 *   <li>Sonarr: {@code GET /api/v3/series/lookup?term=tvdb:{id}}</li>
 * </ul>
 * Responses may be a single object or an array; the first element is used. Season numbers
 * come from Sonarr's {@code seasons[].seasonNumber}.
 */
public class ArrLookupClient implements ContentLookupClient {

    private static final Logger log = LoggerFactory.getLogger(ArrLookupClient.class);

    private final RestTemplate rest;
    private final InstanceRepository instances;

    public ArrLookupClient(RestTemplate rest, InstanceRepository instances) {
        this.rest = rest;
        this.instances = instances;
    }

    /**
     * RestTemplate with short timeouts so a slow download manager cannot stall routing.
     */
    public static RestTemplate restTemplate(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());
        return new RestTemplate(factory);
    }

    @Override
    public Optional<ContentMetadata> lookupMovie(int tmdbId) {
        return lookup(TargetType.RADARR, "/api/v3/movie/lookup/tmdb?tmdbId={id}", tmdbId, "tmdb:" + tmdbId);
    }

    @Override
    public Optional<ContentMetadata> lookupSeries(int tvdbId) {
        return lookup(TargetType.SONARR, "/api/v3/series/lookup?term=tvdb:{id}", tvdbId, "tvdb:" + tvdbId);
    }

    private Optional<ContentMetadata> lookup(TargetType type, String path, int id, String guid) {
        Optional<Instance> instance;
        try {
            instance = instances.findDefault(type);
        } catch (RuntimeException e) {
            log.error("Cannot resolve default {} instance for lookup of {}: {}", type.value(), guid, e.getMessage());
            return Optional.empty();
        }
        if (instance.isEmpty() || instance.get().baseUrl() == null) {
            log.warn("No default {} instance with a base URL, cannot look up {}", type.value(), guid);
            return Optional.empty();
        }

        String url = stripTrailingSlash(instance.get().baseUrl()) + path;
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (instance.get().apiKey() != null) {
            headers.set("X-Api-Key", instance.get().apiKey());
        }

        try {
            ResponseEntity<JsonNode> response = rest.exchange(url, HttpMethod.GET, new HttpEntity<>(headers),
                    JsonNode.class, id);
            JsonNode body = response.getBody();
            JsonNode entry = body != null && body.isArray() ? body.path(0) : body;
            if (entry == null || entry.isMissingNode() || entry.isNull() || !entry.isObject()) {
                log.warn("Lookup of {} on {} returned no result", guid, instance.get().name());
                return Optional.empty();
            }
            return Optional.of(toMetadata(entry));
        } catch (RestClientException e) {
            log.error("Lookup of {} on {} failed: {}", guid, instance.get().name(), e.getMessage());
            return Optional.empty();
        }
    }

    static ContentMetadata toMetadata(JsonNode entry) {
        JsonNode year = entry.path("year");
        String language = entry.path("originalLanguage").path("name").asText(null);
        String certification = entry.path("certification").asText(null);
        return new ContentMetadata(
                year.isNumber() && year.asInt() > 0 ? year.asInt() : null,
                language != null && !language.isBlank() ? language : null,
                certification != null && !certification.isBlank() ? certification : null,
                seasons(entry.path("seasons"))
        );
    }

    private static List<Integer> seasons(JsonNode seasons) {
        List<Integer> numbers = new ArrayList<>();
        for (JsonNode season : seasons) {
            JsonNode number = season.path("seasonNumber");
            if (number.isInt()) {
                numbers.add(number.asInt());
            }
        }
        return numbers;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
