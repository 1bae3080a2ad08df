package com.pulsarr.rule;

import com.pulsarr.condition.ConditionNode;
import com.pulsarr.config.ConditionParser;
import com.pulsarr.core.TargetType;
import com.pulsarr.decision.RoutingDecision;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Admin-authored routing rule.
 *
 * @param id                    Storage id, null before the rule is saved
 * @param name                  Display name
 * @param type                  Criterion family
 * @param targetType            Radarr for movies, Sonarr for shows
 * @param targetInstanceId      Instance that receives matching content
 * @param qualityProfile        Quality profile override
 * @param rootFolder            Root folder override
 * @param tags                  Tags to apply
 * @param priority              Higher is evaluated and preferred first
 * @param enabled               Disabled rules are never evaluated
 * @param criteria              Family shorthand, or {@code {condition: ...}} for conditional rules
 * @param condition             Parsed condition tree for conditional rules, null otherwise or when
 *                              the stored tree is malformed
 * @param searchOnAdd           Search-on-add override
 * @param seasonMonitoring      Sonarr season monitoring override
 * @param seriesType            Sonarr series type override
 * @param minimumAvailability   Radarr minimum availability override
 * @param alwaysRequireApproval Hold matching content for approval
 * @param bypassUserQuotas      Skip the quota check for matching content
 * @param approvalReason        Reason shown when this rule holds content
 */
public record RouterRule(
        Long id,
        String name,
        RuleFamily type,
        TargetType targetType,
        int targetInstanceId,
        String qualityProfile,
        String rootFolder,
        List<String> tags,
        int priority,
        boolean enabled,
        Map<String, Object> criteria,
        ConditionNode condition,
        Boolean searchOnAdd,
        String seasonMonitoring,
        String seriesType,
        String minimumAvailability,
        boolean alwaysRequireApproval,
        boolean bypassUserQuotas,
        String approvalReason
) {

    public RouterRule {
        tags = tags != null ? List.copyOf(tags) : List.of();
        criteria = criteria != null ? criteria : Map.of();
    }

    /**
     * Routing produced when this rule matches.
     */
    public RoutingDecision toDecision() {
        return new RoutingDecision(
                targetInstanceId,
                qualityProfile,
                rootFolder,
                tags,
                priority,
                searchOnAdd,
                seasonMonitoring,
                seriesType,
                minimumAvailability,
                id,
                name
        );
    }

    public RouterRule withId(long newId) {
        return new RouterRule(newId, name, type, targetType, targetInstanceId, qualityProfile, rootFolder,
                tags, priority, enabled, criteria, condition, searchOnAdd, seasonMonitoring, seriesType,
                minimumAvailability, alwaysRequireApproval, bypassUserQuotas, approvalReason);
    }

    public static Builder builder(String name, RuleFamily type) {
        return new Builder(name, type);
    }

    public static class Builder {
        private Long id;
        private final String name;
        private final RuleFamily type;
        private TargetType targetType = TargetType.RADARR;
        private int targetInstanceId;
        private String qualityProfile;
        private String rootFolder;
        private final List<String> tags = new ArrayList<>();
        private int priority = RoutingDecision.DEFAULT_PRIORITY;
        private boolean enabled = true;
        private final Map<String, Object> criteria = new LinkedHashMap<>();
        private ConditionNode condition;
        private Boolean searchOnAdd;
        private String seasonMonitoring;
        private String seriesType;
        private String minimumAvailability;
        private boolean alwaysRequireApproval;
        private boolean bypassUserQuotas;
        private String approvalReason;

        private Builder(String name, RuleFamily type) {
            this.name = name;
            this.type = type;
        }

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder target(TargetType targetType, int instanceId) {
            this.targetType = targetType;
            this.targetInstanceId = instanceId;
            return this;
        }

        public Builder qualityProfile(String qualityProfile) {
            this.qualityProfile = qualityProfile;
            return this;
        }

        public Builder rootFolder(String rootFolder) {
            this.rootFolder = rootFolder;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags.addAll(tags);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder criterion(String key, Object value) {
            this.criteria.put(key, value);
            return this;
        }

        public Builder criteria(Map<String, Object> criteria) {
            this.criteria.putAll(criteria);
            return this;
        }

        /**
         * Set the condition tree of a conditional rule; also stored in the criteria map.
         */
        public Builder condition(ConditionNode condition) {
            this.condition = condition;
            this.criteria.put("condition", ConditionParser.toMap(condition));
            return this;
        }

        public Builder searchOnAdd(Boolean searchOnAdd) {
            this.searchOnAdd = searchOnAdd;
            return this;
        }

        public Builder seasonMonitoring(String seasonMonitoring) {
            this.seasonMonitoring = seasonMonitoring;
            return this;
        }

        public Builder seriesType(String seriesType) {
            this.seriesType = seriesType;
            return this;
        }

        public Builder minimumAvailability(String minimumAvailability) {
            this.minimumAvailability = minimumAvailability;
            return this;
        }

        public Builder requireApproval(String reason) {
            this.alwaysRequireApproval = true;
            this.approvalReason = reason;
            return this;
        }

        public Builder bypassUserQuotas(boolean bypassUserQuotas) {
            this.bypassUserQuotas = bypassUserQuotas;
            return this;
        }

        public RouterRule build() {
            Map<String, Object> frozen = Collections.unmodifiableMap(new LinkedHashMap<>(criteria));
            return new RouterRule(id, name, type, targetType, targetInstanceId, qualityProfile, rootFolder,
                    tags, priority, enabled, frozen, condition, searchOnAdd, seasonMonitoring,
                    seriesType, minimumAvailability, alwaysRequireApproval, bypassUserQuotas, approvalReason);
        }
    }
}
