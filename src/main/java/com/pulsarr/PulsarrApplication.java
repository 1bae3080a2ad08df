package com.pulsarr;

import com.pulsarr.core.ContentItem;
import com.pulsarr.core.ContentItemFactory;
import com.pulsarr.core.ContentType;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.routing.ContentRouter;
import com.pulsarr.routing.RoutingOutcome;
import com.pulsarr.spring.EnableContentRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Map;

/**
 * Example Spring Boot application routing a few sample items.
 */
@SpringBootApplication
@EnableContentRouter
@EnableScheduling
public class PulsarrApplication {

    private static final Logger log = LoggerFactory.getLogger(PulsarrApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(PulsarrApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(ContentRouter contentRouter) {
        return args -> {
            log.info("=== Router Demo Started ===");

            String[] movies = {
                    """
                    {"title": "Spirited Away", "guids": ["tmdb:129"], "genres": ["Animation", "Fantasy"],
                     "year": 2001, "originalLanguage": "Japanese", "certification": "PG"}
                    """,
                    """
                    {"title": "The Conjuring", "guids": ["tmdb:138843"], "genres": ["Horror"],
                     "year": 2013, "originalLanguage": "English", "certification": "R"}
                    """,
                    """
                    {"title": "Paddington", "guids": ["tmdb:116149"], "genres": ["Comedy", "Family"],
                     "year": 2014, "originalLanguage": "English", "certification": "PG"}
                    """
            };

            for (String json : movies) {
                ContentItem item = ContentItemFactory.create(json);
                RoutingContext context = ContentItemFactory.createContext(ContentType.MOVIE,
                        Map.of("userId", "1", "userName", "alice"));
                RoutingOutcome outcome = contentRouter.route(item, context);
                log.info("'{}' -> {} (instances {})", item.title(), outcome.status(), outcome.acquiredInstances());
            }

            log.info("=== Router Demo Completed ===");
        };
    }
}
