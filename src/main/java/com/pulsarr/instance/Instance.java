package com.pulsarr.instance;

import com.pulsarr.core.TargetType;
import com.pulsarr.decision.RoutingDecision;

import java.util.List;

/**
 * A configured Radarr or Sonarr server and its default acquisition settings.
 *
 * @param id                  Instance id, unique across both types
 * @param type                Radarr or Sonarr
 * @param name                Display name
 * @param baseUrl             API base URL, e.g. {@code http://radarr:7878}
 * @param apiKey              API key sent as {@code X-Api-Key}
 * @param enabled             Disabled instances are never targeted
 * @param isDefault           At most one default per type; receives unmatched content
 * @param qualityProfile      Default quality profile
 * @param rootFolder          Default root folder
 * @param tags                Default tags
 * @param searchOnAdd         Default search-on-add
 * @param seasonMonitoring    Default Sonarr season monitoring
 * @param seriesType          Default Sonarr series type
 * @param minimumAvailability Default Radarr minimum availability
 * @param syncedInstances     Instances that mirror the default instance's content
 */
public record Instance(
        int id,
        TargetType type,
        String name,
        String baseUrl,
        String apiKey,
        boolean enabled,
        boolean isDefault,
        String qualityProfile,
        String rootFolder,
        List<String> tags,
        boolean searchOnAdd,
        String seasonMonitoring,
        String seriesType,
        String minimumAvailability,
        List<Integer> syncedInstances
) {

    public Instance {
        tags = tags != null ? List.copyOf(tags) : List.of();
        syncedInstances = syncedInstances != null ? List.copyOf(syncedInstances) : List.of();
    }

    public static Instance of(int id, TargetType type, String name, boolean isDefault) {
        return new Instance(id, type, name, null, null, true, isDefault, null, null, List.of(), true,
                null, null, null, List.of());
    }

    /**
     * Routing that uses this instance's own settings.
     */
    public RoutingDecision toDecision(int priority) {
        return new RoutingDecision(id, qualityProfile, rootFolder, tags, priority, searchOnAdd,
                seasonMonitoring, seriesType, minimumAvailability, null, null);
    }

    public Instance withSyncedInstances(List<Integer> synced) {
        return new Instance(id, type, name, baseUrl, apiKey, enabled, isDefault, qualityProfile, rootFolder,
                tags, searchOnAdd, seasonMonitoring, seriesType, minimumAvailability, synced);
    }

    public Instance withEnabled(boolean value) {
        return new Instance(id, type, name, baseUrl, apiKey, value, isDefault, qualityProfile, rootFolder,
                tags, searchOnAdd, seasonMonitoring, seriesType, minimumAvailability, syncedInstances);
    }
}
