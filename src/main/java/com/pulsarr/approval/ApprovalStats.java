package com.pulsarr.approval;

/**
 * Request counts by status.
 */
public record ApprovalStats(int pending, int approved, int rejected, int expired) {

    public int total() {
        return pending + approved + rejected + expired;
    }
}
