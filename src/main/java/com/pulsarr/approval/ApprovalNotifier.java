package com.pulsarr.approval;

/**
 * Receives approval lifecycle events for delivery to admins and requesters.
 * Implementations must not throw; delivery problems are theirs to log.
 */
public interface ApprovalNotifier {

    void onRequestCreated(ApprovalRequest request);

    void onApproved(ApprovalRequest request);

    void onRejected(ApprovalRequest request);

    void onExpired(ApprovalRequest request);
}
