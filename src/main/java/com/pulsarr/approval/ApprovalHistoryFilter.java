package com.pulsarr.approval;

import com.pulsarr.core.ContentType;
import com.pulsarr.decision.ApprovalTrigger;

/**
 * Criteria for listing approval requests. Null criteria are not applied.
 */
public record ApprovalHistoryFilter(
        Integer userId,
        ApprovalStatus status,
        ContentType contentType,
        ApprovalTrigger triggeredBy,
        int limit,
        int offset
) {

    public static final int DEFAULT_LIMIT = 50;

    public ApprovalHistoryFilter {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        if (offset < 0) {
            offset = 0;
        }
    }

    public static ApprovalHistoryFilter all() {
        return new ApprovalHistoryFilter(null, null, null, null, DEFAULT_LIMIT, 0);
    }

    public static ApprovalHistoryFilter forUser(int userId) {
        return new ApprovalHistoryFilter(userId, null, null, null, DEFAULT_LIMIT, 0);
    }

    public static ApprovalHistoryFilter withStatus(ApprovalStatus status) {
        return new ApprovalHistoryFilter(null, status, null, null, DEFAULT_LIMIT, 0);
    }
}
