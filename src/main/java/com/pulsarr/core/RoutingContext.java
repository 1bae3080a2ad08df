package com.pulsarr.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-request attribution and hints built by the ingestion pipeline. Read-only to the router.
 *
 * @param contentType          Movie or show
 * @param userIds              Requesting user ids; several when an item is on multiple watchlists
 * @param userNames            Requesting user names, parallel to {@code userIds} where known
 * @param itemKey              Stable key of the watchlist item, used to deduplicate approvals
 * @param syncing              True when the item is re-added by a sync job rather than requested
 * @param syncTargetInstanceId When set, only this instance may be targeted
 */
public record RoutingContext(
        ContentType contentType,
        List<Integer> userIds,
        List<String> userNames,
        String itemKey,
        boolean syncing,
        Integer syncTargetInstanceId
) {

    public RoutingContext {
        if (contentType == null) {
            throw new IllegalArgumentException("contentType is required");
        }
        userIds = userIds != null ? List.copyOf(userIds) : List.of();
        userNames = userNames != null ? List.copyOf(userNames) : List.of();
    }

    public boolean hasUser() {
        return !userIds.isEmpty() || !userNames.isEmpty();
    }

    /**
     * The user a request is attributed to for quotas and approvals.
     */
    public Optional<Integer> primaryUserId() {
        return userIds.isEmpty() ? Optional.empty() : Optional.of(userIds.get(0));
    }

    public TargetType targetType() {
        return contentType.targetType();
    }

    public static Builder builder(ContentType contentType) {
        return new Builder(contentType);
    }

    public static class Builder {
        private final ContentType contentType;
        private final List<Integer> userIds = new ArrayList<>();
        private final List<String> userNames = new ArrayList<>();
        private String itemKey;
        private boolean syncing;
        private Integer syncTargetInstanceId;

        private Builder(ContentType contentType) {
            this.contentType = contentType;
        }

        public Builder user(int userId, String userName) {
            this.userIds.add(userId);
            if (userName != null) {
                this.userNames.add(userName);
            }
            return this;
        }

        public Builder userId(int userId) {
            this.userIds.add(userId);
            return this;
        }

        public Builder userName(String userName) {
            this.userNames.add(userName);
            return this;
        }

        public Builder itemKey(String itemKey) {
            this.itemKey = itemKey;
            return this;
        }

        public Builder syncing(boolean syncing) {
            this.syncing = syncing;
            return this;
        }

        public Builder syncTargetInstanceId(Integer instanceId) {
            this.syncTargetInstanceId = instanceId;
            return this;
        }

        public RoutingContext build() {
            return new RoutingContext(contentType, userIds, userNames, itemKey, syncing, syncTargetInstanceId);
        }
    }
}
