package com.pulsarr.approval;

import com.pulsarr.decision.RouterDecision;

import java.util.List;

/**
 * What the approval gate lets through for one item.
 *
 * @param decisions       Route decisions to execute, or the single held or rejected verdict
 * @param request         Approval request created or found for the item, if any
 * @param approvedReplay  True when the decisions replay an already approved request
 * @param alreadyPending  True when an earlier request for the item still awaits an admin
 */
public record GateVerdict(List<RouterDecision> decisions, ApprovalRequest request, boolean approvedReplay,
                          boolean alreadyPending) {

    public GateVerdict {
        decisions = List.copyOf(decisions);
    }

    static GateVerdict pass(List<RouterDecision> decisions) {
        return new GateVerdict(decisions, null, false, false);
    }

    static GateVerdict replay(RouterDecision decision, ApprovalRequest request) {
        return new GateVerdict(List.of(decision), request, true, false);
    }

    static GateVerdict held(RouterDecision decision, ApprovalRequest request) {
        return new GateVerdict(List.of(decision), request, false, false);
    }

    /**
     * Held by an existing pending request, reporting that request's stored verdict.
     */
    static GateVerdict alreadyPending(ApprovalRequest request) {
        return new GateVerdict(List.of(request.proposedRouterDecision()), request, false, true);
    }

    /**
     * True when every decision is a {@code route} and acquisition may proceed.
     */
    public boolean isRoutable() {
        return !decisions.isEmpty() && decisions.stream().allMatch(RouterDecision::isRoute);
    }
}
