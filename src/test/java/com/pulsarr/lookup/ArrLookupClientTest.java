package com.pulsarr.lookup;

import com.pulsarr.core.ContentMetadata;
import com.pulsarr.core.TargetType;
import com.pulsarr.instance.Instance;
import com.pulsarr.support.InMemoryInstanceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ArrLookupClientTest {

    private MockRestServiceServer server;
    private ArrLookupClient client;

    private static Instance instance(int id, TargetType type, String baseUrl, String apiKey) {
        return new Instance(id, type, type.value(), baseUrl, apiKey, true, true, null, null, List.of(), true,
                null, null, null, List.of());
    }

    @BeforeEach
    void setUp() {
        RestTemplate rest = new RestTemplate();
        server = MockRestServiceServer.bindTo(rest).build();
        client = new ArrLookupClient(rest, new InMemoryInstanceRepository(
                instance(1, TargetType.RADARR, "http://radarr:7878/", "radarr-key"),
                instance(10, TargetType.SONARR, "http://sonarr:8989", null)));
    }

    @Test
    @DisplayName("Should look up movies on the default Radarr with its API key")
    void looksUpMovie() {
        server.expect(requestTo("http://radarr:7878/api/v3/movie/lookup/tmdb?tmdbId=603"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("X-Api-Key", "radarr-key"))
                .andRespond(withSuccess("""
                        {"title": "The Matrix", "year": 1999, "certification": "R",
                         "originalLanguage": {"id": 1, "name": "English"}}
                        """, MediaType.APPLICATION_JSON));

        Optional<ContentMetadata> metadata = client.lookupMovie(603);

        assertEquals(Optional.of(new ContentMetadata(1999, "English", "R")), metadata);
        server.verify();
    }

    @Test
    @DisplayName("Should take the first series of an array response")
    void looksUpSeries() {
        server.expect(requestTo("http://sonarr:8989/api/v3/series/lookup?term=tvdb:81189"))
                .andRespond(withSuccess("""
                        [{"title": "Breaking Bad", "year": 2008, "certification": "",
                          "originalLanguage": {"name": "English"}},
                         {"title": "Breaking Bad (Remake)", "year": 2030}]
                        """, MediaType.APPLICATION_JSON));

        Optional<ContentMetadata> metadata = client.lookupSeries(81189);

        assertEquals(Optional.of(new ContentMetadata(2008, "English", null)), metadata);
        server.verify();
    }

    @Test
    @DisplayName("Should read Sonarr season numbers")
    void readsSeasons() {
        server.expect(requestTo("http://sonarr:8989/api/v3/series/lookup?term=tvdb:81189"))
                .andRespond(withSuccess("""
                        [{"title": "Breaking Bad", "year": 2008,
                          "seasons": [{"seasonNumber": 0, "monitored": false},
                                      {"seasonNumber": 1, "monitored": true},
                                      {"seasonNumber": 5, "monitored": true}]}]
                        """, MediaType.APPLICATION_JSON));

        ContentMetadata metadata = client.lookupSeries(81189).orElseThrow();

        assertEquals(List.of(0, 1, 5), metadata.seasons());
        server.verify();
    }

    @Test
    @DisplayName("Should report an empty array as no result")
    void emptyResult() {
        server.expect(requestTo("http://sonarr:8989/api/v3/series/lookup?term=tvdb:1"))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        assertTrue(client.lookupSeries(1).isEmpty());
    }

    @Test
    @DisplayName("Should swallow server errors into an empty result")
    void serverError() {
        server.expect(requestTo("http://radarr:7878/api/v3/movie/lookup/tmdb?tmdbId=603"))
                .andRespond(withServerError());

        assertTrue(client.lookupMovie(603).isEmpty());
        server.verify();
    }

    @Test
    @DisplayName("Should not call out without a default instance or base URL")
    void noDefaultInstance() {
        RestTemplate rest = new RestTemplate();
        MockRestServiceServer idle = MockRestServiceServer.bindTo(rest).build();
        ArrLookupClient unconfigured = new ArrLookupClient(rest, new InMemoryInstanceRepository(
                instance(1, TargetType.RADARR, null, "key")));

        assertTrue(unconfigured.lookupMovie(603).isEmpty());
        assertTrue(unconfigured.lookupSeries(81189).isEmpty());
        idle.verify();
    }
}
