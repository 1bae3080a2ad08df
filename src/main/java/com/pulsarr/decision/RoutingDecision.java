package com.pulsarr.decision;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One concrete target produced by a rule match or by the default-instance fallback.
 * Null overrides mean "use the instance's own setting".
 *
 * @param instanceId          Target download-manager instance
 * @param qualityProfile      Quality profile override
 * @param rootFolder          Root folder override
 * @param tags                Tags to apply
 * @param priority            Weight used for conflict resolution, higher wins
 * @param searchOnAdd         Whether to search immediately after adding
 * @param seasonMonitoring    Sonarr season monitoring mode
 * @param seriesType          Sonarr series type (standard, anime, daily)
 * @param minimumAvailability Radarr minimum availability
 * @param ruleId              Rule that produced the decision, null for fallback routing
 * @param ruleName            Name of that rule, for logs and approval reasons
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoutingDecision(
        int instanceId,
        String qualityProfile,
        String rootFolder,
        List<String> tags,
        int priority,
        Boolean searchOnAdd,
        String seasonMonitoring,
        String seriesType,
        String minimumAvailability,
        Long ruleId,
        String ruleName
) {

    public static final int DEFAULT_PRIORITY = 50;

    public RoutingDecision {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public boolean fromRule() {
        return ruleId != null;
    }
}
