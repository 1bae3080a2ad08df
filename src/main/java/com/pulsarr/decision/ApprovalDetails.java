package com.pulsarr.decision;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload of a {@code require_approval} verdict.
 *
 * @param reason          Human readable reason shown to admins
 * @param triggeredBy     Trigger category
 * @param data            Trigger specific details (quota numbers, rule id, request id)
 * @param proposedRouting Routing that applies once approved
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApprovalDetails(
        String reason,
        ApprovalTrigger triggeredBy,
        Map<String, Object> data,
        RoutingDecision proposedRouting
) {

    public ApprovalDetails {
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }
}
