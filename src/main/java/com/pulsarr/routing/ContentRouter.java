package com.pulsarr.routing;

import com.pulsarr.acquisition.AcquisitionRequest;
import com.pulsarr.acquisition.AcquisitionWorkflow;
import com.pulsarr.approval.ApprovalGate;
import com.pulsarr.approval.GateVerdict;
import com.pulsarr.core.ContentItem;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.decision.DecisionAction;
import com.pulsarr.decision.RouterDecision;
import com.pulsarr.exception.RouterException;
import com.pulsarr.quota.QuotaTracker;
import com.pulsarr.resolver.DecisionResolver;
import com.pulsarr.resolver.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for routing one requested item: resolve decisions, pass them through the
 * approval gate, add the item to each routed instance and record quota usage.
 * <p>
 * Usage is recorded once per item, after at least one add succeeded, and never for sync
 * jobs or replays of an approval that was already counted.
 */
public class ContentRouter {

    private static final Logger log = LoggerFactory.getLogger(ContentRouter.class);

    private final DecisionResolver resolver;
    private final ApprovalGate approvalGate;
    private final AcquisitionWorkflow acquisition;
    private final QuotaTracker quotaTracker;

    public ContentRouter(DecisionResolver resolver, ApprovalGate approvalGate,
                         AcquisitionWorkflow acquisition, QuotaTracker quotaTracker) {
        this.resolver = resolver;
        this.approvalGate = approvalGate;
        this.acquisition = acquisition;
        this.quotaTracker = quotaTracker;
    }

    /**
     * @throws RouterException when every add call failed, so the caller can retry the event
     */
    public RoutingOutcome route(ContentItem item, RoutingContext context) {
        ResolutionResult resolution = resolver.resolve(item, context);
        if (resolution.isEmpty()) {
            log.warn("No routing target for {} '{}'", context.contentType().value(), item.title());
            return RoutingOutcome.noTarget();
        }

        GateVerdict verdict = approvalGate.check(item, context, resolution.decisions());
        if (!verdict.isRoutable()) {
            RoutingOutcome.Status status = verdict.alreadyPending()
                    ? RoutingOutcome.Status.ALREADY_PENDING
                    : heldStatus(verdict.decisions().get(0).action());
            return RoutingOutcome.held(status, verdict.decisions(), verdict.request());
        }

        List<Integer> acquired = new ArrayList<>();
        List<Integer> failed = new ArrayList<>();
        RuntimeException lastFailure = null;
        for (RouterDecision decision : verdict.decisions()) {
            int instanceId = decision.routing().instanceId();
            try {
                acquisition.acquire(AcquisitionRequest.of(item, context, decision.routing()));
                acquired.add(instanceId);
            } catch (RuntimeException e) {
                log.error("Failed to add '{}' to instance {}: {}", item.title(), instanceId, e.getMessage(), e);
                failed.add(instanceId);
                lastFailure = e;
            }
        }
        if (acquired.isEmpty()) {
            throw new RouterException("Failed to add '" + item.title() + "' to any of instances " + failed,
                    lastFailure);
        }

        Optional<Integer> userId = context.primaryUserId();
        if (userId.isPresent() && !context.syncing() && !verdict.approvedReplay()) {
            quotaTracker.recordUsage(userId.get(), context.contentType());
        }
        log.info("Routed '{}' to instances {}{}", item.title(), acquired,
                resolution.fallback() ? " (default fallback)" : "");
        return new RoutingOutcome(RoutingOutcome.Status.ROUTED, verdict.decisions(), acquired, failed,
                verdict.request(), resolution.fallback());
    }

    private static RoutingOutcome.Status heldStatus(DecisionAction action) {
        return switch (action) {
            case REQUIRE_APPROVAL -> RoutingOutcome.Status.PENDING_APPROVAL;
            case REJECT -> RoutingOutcome.Status.REJECTED;
            case ROUTE, CONTINUE -> throw new IllegalStateException(action.value() + " decision reported as held");
        };
    }
}
