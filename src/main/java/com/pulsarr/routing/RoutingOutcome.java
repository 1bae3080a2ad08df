package com.pulsarr.routing;

import com.pulsarr.approval.ApprovalRequest;
import com.pulsarr.decision.RouterDecision;

import java.util.List;

/**
 * Result of routing one item.
 *
 * @param status            What happened
 * @param decisions         Decisions after the approval gate
 * @param acquiredInstances Instances the item was added to
 * @param failedInstances   Instances whose add call failed
 * @param approvalRequest   Approval request created or found for the item, if any
 * @param fallback          True when the default instance was used because no rule matched
 */
public record RoutingOutcome(
        Status status,
        List<RouterDecision> decisions,
        List<Integer> acquiredInstances,
        List<Integer> failedInstances,
        ApprovalRequest approvalRequest,
        boolean fallback
) {

    public enum Status {
        /** Added to at least one instance. */
        ROUTED,
        /** A new approval request holds the item. */
        PENDING_APPROVAL,
        /** An earlier request for the item is still awaiting an admin. */
        ALREADY_PENDING,
        /** An admin rejected this item for this user. */
        REJECTED,
        /** No rule matched and no default instance is configured. */
        NO_TARGET
    }

    public RoutingOutcome {
        decisions = List.copyOf(decisions);
        acquiredInstances = List.copyOf(acquiredInstances);
        failedInstances = List.copyOf(failedInstances);
    }

    static RoutingOutcome noTarget() {
        return new RoutingOutcome(Status.NO_TARGET, List.of(), List.of(), List.of(), null, false);
    }

    static RoutingOutcome held(Status status, List<RouterDecision> decisions, ApprovalRequest request) {
        return new RoutingOutcome(status, decisions, List.of(), List.of(), request, false);
    }
}
