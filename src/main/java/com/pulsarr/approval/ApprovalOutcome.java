package com.pulsarr.approval;

/**
 * Result of an admin action on an approval request.
 *
 * @param requestId    Request acted upon
 * @param status       Status after the action, null if the request does not exist
 * @param transitioned True when this call moved the request out of {@code pending}
 */
public record ApprovalOutcome(long requestId, ApprovalStatus status, boolean transitioned) {

    public static ApprovalOutcome transitioned(long requestId, ApprovalStatus status) {
        return new ApprovalOutcome(requestId, status, true);
    }

    public static ApprovalOutcome unchanged(long requestId, ApprovalStatus status) {
        return new ApprovalOutcome(requestId, status, false);
    }

    public static ApprovalOutcome notFound(long requestId) {
        return new ApprovalOutcome(requestId, null, false);
    }

    public boolean found() {
        return status != null;
    }
}
