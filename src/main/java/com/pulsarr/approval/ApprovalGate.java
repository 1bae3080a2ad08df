package com.pulsarr.approval;

import com.pulsarr.core.ContentItem;
import com.pulsarr.core.Guids;
import com.pulsarr.core.RoutingContext;
import com.pulsarr.decision.ApprovalTrigger;
import com.pulsarr.decision.RouterDecision;
import com.pulsarr.decision.RoutingDecision;
import com.pulsarr.exception.PersistenceException;
import com.pulsarr.exception.ReferentialIntegrityException;
import com.pulsarr.quota.QuotaStatus;
import com.pulsarr.quota.QuotaTracker;
import com.pulsarr.rule.RouterRule;
import com.pulsarr.rule.RouterRuleRepository;
import com.pulsarr.user.RouterUser;
import com.pulsarr.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether resolved route decisions may proceed to acquisition or must wait for
 * an admin.
 * <p>
 * Checks run in this order for a user-attributed, non-sync request:
 * <ol>
 *   <li>an existing request for the same user and item: pending holds, rejected rejects,
 *       approved replays the stored routing, expired is replaced</li>
 *   <li>a matched rule with {@code alwaysRequireApproval}</li>
 *   <li>a user flagged {@code requiresApproval}</li>
 *   <li>the user's quota, unless a matched rule sets {@code bypassUserQuotas}</li>
 * </ol>
 * A held item gets one pending {@link ApprovalRequest} carrying the highest-priority routing.
 * Storage failures propagate; the gate never routes an item it could not check.
 */
public class ApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

    private final ApprovalRepository approvals;
    private final QuotaTracker quotaTracker;
    private final UserRepository users;
    private final RouterRuleRepository rules;
    private final ApprovalNotifier notifier;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Duration defaultExpiration;

    public ApprovalGate(ApprovalRepository approvals, QuotaTracker quotaTracker, UserRepository users,
                        RouterRuleRepository rules, ApprovalNotifier notifier,
                        TransactionTemplate transactionTemplate, Clock clock, Duration defaultExpiration) {
        this.approvals = approvals;
        this.quotaTracker = quotaTracker;
        this.users = users;
        this.rules = rules;
        this.notifier = notifier;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.defaultExpiration = defaultExpiration;
    }

    public GateVerdict check(ContentItem item, RoutingContext context, List<RouterDecision> decisions) {
        if (decisions.isEmpty() || context.syncing() || !decisions.stream().allMatch(RouterDecision::isRoute)) {
            return GateVerdict.pass(decisions);
        }
        Optional<Integer> userId = context.primaryUserId();
        if (userId.isEmpty()) {
            log.debug("No requesting user for '{}', skipping approval checks", item.title());
            return GateVerdict.pass(decisions);
        }
        return check(item, context, decisions, userId.get());
    }

    private GateVerdict check(ContentItem item, RoutingContext context, List<RouterDecision> decisions, int userId) {
        String contentKey = Guids.contentKey(item, context).orElse(item.title());
        Instant now = clock.instant();

        ApprovalRequest replaced = null;
        Optional<ApprovalRequest> existing = approvals.findByUserAndContentKey(userId, contentKey);
        if (existing.isPresent()) {
            ApprovalRequest request = existing.get();
            if (request.isPastDue(now)) {
                request = expire(request, now);
            }
            switch (request.status()) {
                case PENDING -> {
                    log.debug("Approval request {} for '{}' still pending", request.id(), item.title());
                    return GateVerdict.alreadyPending(request);
                }
                case REJECTED -> {
                    log.info("'{}' was rejected for user {} (request {})", item.title(), userId, request.id());
                    return GateVerdict.held(RouterDecision.reject(), request);
                }
                case APPROVED -> {
                    RoutingDecision routing = storedRouting(request);
                    log.info("Replaying approved request {} for '{}'", request.id(), item.title());
                    return GateVerdict.replay(RouterDecision.route(routing), request);
                }
                case EXPIRED -> replaced = request;
                default -> throw new IllegalStateException("Unhandled approval status: " + request.status());
            }
        }

        RoutingDecision primary = primaryRouting(decisions);
        RouterRule approvalRule = null;
        boolean bypassQuota = false;
        for (RouterDecision decision : decisions) {
            Long ruleId = decision.routing().ruleId();
            if (ruleId == null) {
                continue;
            }
            Optional<RouterRule> rule = rules.findById(ruleId);
            if (rule.isEmpty()) {
                continue;
            }
            if (rule.get().alwaysRequireApproval() && approvalRule == null) {
                approvalRule = rule.get();
            }
            bypassQuota |= rule.get().bypassUserQuotas();
        }

        if (approvalRule != null) {
            String reason = approvalRule.approvalReason() != null && !approvalRule.approvalReason().isBlank()
                    ? approvalRule.approvalReason()
                    : "Content matched router rule '" + approvalRule.name() + "' which requires approval";
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("ruleId", approvalRule.id());
            data.put("ruleName", approvalRule.name());
            return hold(item, context, userId, contentKey, primary, ApprovalTrigger.ROUTER_RULE, reason, data,
                    approvalRule.id(), replaced, now);
        }

        RouterUser user = users.findById(userId).orElseThrow(() ->
                new ReferentialIntegrityException("Unknown user " + userId + " for '" + item.title() + "'"));
        if (user.requiresApproval()) {
            return hold(item, context, userId, contentKey, primary, ApprovalTrigger.MANUAL_FLAG,
                    "User " + user.name() + " requires approval for all requests", Map.of(), null, replaced, now);
        }

        if (bypassQuota) {
            log.debug("Matched rule bypasses quotas for '{}'", item.title());
            return GateVerdict.pass(decisions);
        }
        Optional<QuotaStatus> quota = quotaTracker.getQuotaStatus(userId, context.contentType());
        if (quota.isPresent() && quota.get().exceeded()) {
            QuotaStatus status = quota.get();
            String reason = String.format("%s quota exceeded (%d/%d)",
                    status.quotaType().displayName(), status.currentUsage(), status.quotaLimit());
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("quotaType", status.quotaType().value());
            data.put("quotaLimit", status.quotaLimit());
            data.put("currentUsage", status.currentUsage());
            if (status.resetDate() != null) {
                data.put("resetDate", status.resetDate().toString());
            }
            return hold(item, context, userId, contentKey, primary, ApprovalTrigger.QUOTA_EXCEEDED, reason, data,
                    null, replaced, now);
        }
        return GateVerdict.pass(decisions);
    }

    private GateVerdict hold(ContentItem item, RoutingContext context, int userId, String contentKey,
                             RoutingDecision primary, ApprovalTrigger trigger, String reason,
                             Map<String, Object> data, Long ruleId, ApprovalRequest replaced, Instant now) {
        RouterDecision decision = RouterDecision.requireApproval(reason, trigger, data, primary);
        Instant expiresAt = defaultExpiration.isZero() || defaultExpiration.isNegative()
                ? null : now.plus(defaultExpiration);
        ApprovalRequest pending = new ApprovalRequest(null, userId, context.contentType(), item.title(), contentKey,
                item.guids(), decision, ruleId, trigger, reason, ApprovalStatus.PENDING, null, null,
                expiresAt, now, now);

        Optional<ApprovalRequest> created = transactionTemplate.execute(tx -> {
            if (replaced != null) {
                approvals.delete(replaced.id());
            }
            return approvals.insert(pending);
        });
        if (created == null || created.isEmpty()) {
            ApprovalRequest concurrent = approvals.findByUserAndContentKey(userId, contentKey)
                    .orElseThrow(() -> new PersistenceException(
                            "Approval request for '" + item.title() + "' vanished during creation"));
            log.debug("Approval request {} for '{}' created concurrently", concurrent.id(), item.title());
            return GateVerdict.alreadyPending(concurrent);
        }

        ApprovalRequest request = created.get();
        log.info("Holding '{}' for approval (request {}, {}): {}", item.title(), request.id(),
                trigger.value(), reason);
        notifier.onRequestCreated(request);
        return GateVerdict.held(decision, request);
    }

    private ApprovalRequest expire(ApprovalRequest request, Instant now) {
        if (approvals.transitionFromPending(request.id(), ApprovalStatus.EXPIRED, null, null, now)) {
            log.info("Approval request {} for '{}' expired", request.id(), request.contentTitle());
            notifier.onExpired(request);
        }
        return approvals.findById(request.id()).orElse(request);
    }

    private static RoutingDecision primaryRouting(List<RouterDecision> decisions) {
        RoutingDecision primary = null;
        for (RouterDecision decision : decisions) {
            RoutingDecision routing = decision.routing();
            if (primary == null || routing.priority() > primary.priority()) {
                primary = routing;
            }
        }
        return primary;
    }

    static RoutingDecision storedRouting(ApprovalRequest request) {
        return request.proposedRouterDecision().replayableRouting().orElseThrow(() ->
                new PersistenceException("Approval request " + request.id() + " has no stored routing"));
    }
}
