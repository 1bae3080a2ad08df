package com.pulsarr.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds items and routing contexts from ingestion payloads.
 * <p>
 * Item JSON: {@code {"title", "guids": [...], "genres": [...], "year", "originalLanguage", "certification"}}.
 * Metadata fields may also sit under a {@code "metadata"} object, and {@code originalLanguage} may be
 * a plain string or an object with a {@code name}. {@code seasons} lists season numbers or Sonarr
 * season objects carrying a {@code seasonNumber}.
 */
public class ContentItemFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Create an item from a JSON payload.
     *
     * @param jsonPayload Item JSON
     * @return Parsed item
     * @throws IllegalArgumentException if the payload is not valid JSON or has no title
     */
    public static ContentItem create(String jsonPayload) {
        if (jsonPayload == null || jsonPayload.isBlank()) {
            throw new IllegalArgumentException("Item payload is empty");
        }
        JsonNode root = parseJson(jsonPayload);
        String title = text(root, "title");
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Item payload requires a title");
        }

        JsonNode metadataNode = root.has("metadata") ? root.get("metadata") : root;
        ContentMetadata metadata = new ContentMetadata(
                metadataNode.hasNonNull("year") ? metadataNode.get("year").asInt() : null,
                language(metadataNode.get("originalLanguage")),
                text(metadataNode, "certification"),
                seasons(metadataNode.get("seasons")));

        return ContentItem.builder()
                .title(title)
                .guids(strings(root.get("guids")))
                .genres(strings(root.get("genres")))
                .metadata(metadata.equals(ContentMetadata.empty()) ? null : metadata)
                .build();
    }

    /**
     * Create a routing context from request attributes such as webhook headers.
     * Recognised keys: {@code userId}, {@code userName}, {@code itemKey}, {@code syncing},
     * {@code syncTargetInstanceId}.
     *
     * @param contentType Movie or show
     * @param attributes  Request attributes, can be null
     */
    public static RoutingContext createContext(ContentType contentType, Map<String, String> attributes) {
        RoutingContext.Builder builder = RoutingContext.builder(contentType);
        if (attributes == null) {
            return builder.build();
        }
        String userId = attributes.get("userId");
        if (userId != null && !userId.isBlank()) {
            builder.userId(parseInt("userId", userId));
        }
        String userName = attributes.get("userName");
        if (userName != null && !userName.isBlank()) {
            builder.userName(userName);
        }
        builder.itemKey(attributes.get("itemKey"));
        builder.syncing(Boolean.parseBoolean(attributes.get("syncing")));
        String syncTarget = attributes.get("syncTargetInstanceId");
        if (syncTarget != null && !syncTarget.isBlank()) {
            builder.syncTargetInstanceId(parseInt("syncTargetInstanceId", syncTarget));
        }
        return builder.build();
    }

    private static JsonNode parseJson(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    private static String language(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            return node.hasNonNull("name") ? node.get("name").asText() : null;
        }
        return node.asText();
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            node.forEach(element -> values.add(element.asText()));
        } else {
            values.add(node.asText());
        }
        return values;
    }

    private static List<Integer> seasons(JsonNode node) {
        List<Integer> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode element : node) {
            JsonNode number = element.isObject() ? element.path("seasonNumber") : element;
            if (number.isInt()) {
                values.add(number.asInt());
            }
        }
        return values;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got: " + value, e);
        }
    }
}
