package com.pulsarr.decision;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsarr.exception.PersistenceException;

/**
 * JSON form of a {@link RouterDecision} as stored on approval requests.
 */
public class RouterDecisionCodec {

    private final ObjectMapper objectMapper;

    public RouterDecisionCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public RouterDecisionCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(RouterDecision decision) {
        try {
            return objectMapper.writeValueAsString(decision);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize router decision", e);
        }
    }

    public RouterDecision decode(String json) {
        try {
            return objectMapper.readValue(json, RouterDecision.class);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Stored router decision is unreadable", e);
        }
    }
}
