package com.pulsarr.decision;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;
import java.util.Optional;

/**
 * Final verdict for one target, tagged by {@link DecisionAction}.
 * {@code routing} is set only for {@code route}; {@code approval} only for {@code require_approval}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouterDecision(DecisionAction action, RoutingDecision routing, ApprovalDetails approval) {

    public RouterDecision {
        if (action == null) {
            throw new IllegalArgumentException("action is required");
        }
        if (action == DecisionAction.ROUTE && routing == null) {
            throw new IllegalArgumentException("route decision requires routing");
        }
        if (action == DecisionAction.REQUIRE_APPROVAL && approval == null) {
            throw new IllegalArgumentException("require_approval decision requires approval details");
        }
    }

    public static RouterDecision route(RoutingDecision routing) {
        return new RouterDecision(DecisionAction.ROUTE, routing, null);
    }

    public static RouterDecision requireApproval(String reason, ApprovalTrigger trigger,
                                                 Map<String, Object> data, RoutingDecision proposed) {
        return new RouterDecision(DecisionAction.REQUIRE_APPROVAL, null,
                new ApprovalDetails(reason, trigger, data, proposed));
    }

    public static RouterDecision reject() {
        return new RouterDecision(DecisionAction.REJECT, null, null);
    }

    public static RouterDecision continueEvaluation() {
        return new RouterDecision(DecisionAction.CONTINUE, null, null);
    }

    /**
     * The routing to execute when this decision is replayed: the routing of a {@code route}
     * verdict, or the proposed routing of a {@code require_approval} verdict.
     */
    @JsonIgnore
    public Optional<RoutingDecision> replayableRouting() {
        if (action == DecisionAction.ROUTE) {
            return Optional.of(routing);
        }
        if (action == DecisionAction.REQUIRE_APPROVAL) {
            return Optional.ofNullable(approval.proposedRouting());
        }
        return Optional.empty();
    }

    @JsonIgnore
    public boolean isRoute() {
        return action == DecisionAction.ROUTE;
    }
}
