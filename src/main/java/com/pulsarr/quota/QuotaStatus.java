package com.pulsarr.quota;

import java.time.Instant;

/**
 * Quota state for one user and content type at a point in time.
 *
 * @param quotaType      Counting window
 * @param quotaLimit     Configured limit
 * @param currentUsage   Accepted requests inside the window
 * @param exceeded       {@code currentUsage >= quotaLimit}; always false when bypassed
 * @param resetDate      When the window next frees capacity; null for a rolling window with no usage
 * @param bypassApproval Admin override in effect
 */
public record QuotaStatus(
        QuotaType quotaType,
        int quotaLimit,
        int currentUsage,
        boolean exceeded,
        Instant resetDate,
        boolean bypassApproval
) {

    public int remaining() {
        return Math.max(0, quotaLimit - currentUsage);
    }
}
