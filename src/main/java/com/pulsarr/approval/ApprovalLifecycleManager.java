package com.pulsarr.approval;

import com.pulsarr.acquisition.AcquisitionRequest;
import com.pulsarr.acquisition.AcquisitionWorkflow;
import com.pulsarr.decision.RoutingDecision;
import com.pulsarr.exception.ApprovalNotFoundException;
import com.pulsarr.exception.RouterException;
import com.pulsarr.quota.QuotaTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Admin actions on approval requests.
 * <p>
 * Every transition is a conditional update that only succeeds while the request is still
 * pending, so of two concurrent approvals (or an approval racing the expiry sweep) exactly
 * one wins. Only the winner replays the stored routing and records quota usage. Acting on a
 * request that already left {@code pending} reports its current status and changes nothing.
 */
public class ApprovalLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(ApprovalLifecycleManager.class);

    private final ApprovalRepository approvals;
    private final AcquisitionWorkflow acquisition;
    private final QuotaTracker quotaTracker;
    private final ApprovalNotifier notifier;
    private final Clock clock;

    public ApprovalLifecycleManager(ApprovalRepository approvals, AcquisitionWorkflow acquisition,
                                    QuotaTracker quotaTracker, ApprovalNotifier notifier, Clock clock) {
        this.approvals = approvals;
        this.acquisition = acquisition;
        this.quotaTracker = quotaTracker;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * Approves a pending request and replays its routing through acquisition.
     * If the acquisition call fails the request stays approved, no usage is recorded and
     * the failure propagates to the caller.
     *
     * @throws ApprovalNotFoundException if no request has this id
     */
    public ApprovalOutcome approve(long requestId, int approvedBy, String notes) {
        ApprovalRequest request = load(requestId);
        if (request.status().isTerminal()) {
            log.debug("Approval request {} already {}", requestId, request.status().value());
            return ApprovalOutcome.unchanged(requestId, request.status());
        }
        Instant now = clock.instant();
        if (request.isPastDue(now)) {
            expireIfPending(request, now);
            return ApprovalOutcome.unchanged(requestId, currentStatus(requestId));
        }
        if (!approvals.transitionFromPending(requestId, ApprovalStatus.APPROVED, approvedBy, notes, now)) {
            ApprovalStatus current = currentStatus(requestId);
            log.debug("Approval request {} was concurrently moved to {}", requestId, current.value());
            return ApprovalOutcome.unchanged(requestId, current);
        }

        RoutingDecision routing = ApprovalGate.storedRouting(request);
        try {
            acquisition.acquire(new AcquisitionRequest(request.contentTitle(), request.contentGuids(),
                    request.contentType(), routing, request.userId()));
        } catch (RuntimeException e) {
            throw new RouterException("Approval request " + requestId + " approved but adding '"
                    + request.contentTitle() + "' to instance " + routing.instanceId() + " failed", e);
        }
        quotaTracker.recordUsage(request.userId(), request.contentType());
        log.info("Approval request {} for '{}' approved by {}", requestId, request.contentTitle(), approvedBy);
        notifier.onApproved(approvals.findById(requestId).orElse(request));
        return ApprovalOutcome.transitioned(requestId, ApprovalStatus.APPROVED);
    }

    /**
     * Rejects a pending request. No acquisition call, no usage.
     *
     * @throws ApprovalNotFoundException if no request has this id
     */
    public ApprovalOutcome reject(long requestId, int rejectedBy, String reason) {
        ApprovalRequest request = load(requestId);
        if (request.status().isTerminal()) {
            return ApprovalOutcome.unchanged(requestId, request.status());
        }
        Instant now = clock.instant();
        if (request.isPastDue(now)) {
            expireIfPending(request, now);
            return ApprovalOutcome.unchanged(requestId, currentStatus(requestId));
        }
        if (!approvals.transitionFromPending(requestId, ApprovalStatus.REJECTED, rejectedBy, reason, now)) {
            return ApprovalOutcome.unchanged(requestId, currentStatus(requestId));
        }
        log.info("Approval request {} for '{}' rejected by {}", requestId, request.contentTitle(), rejectedBy);
        notifier.onRejected(approvals.findById(requestId).orElse(request));
        return ApprovalOutcome.transitioned(requestId, ApprovalStatus.REJECTED);
    }

    /**
     * Permanently removes a request. Recorded quota usage is untouched.
     *
     * @throws ApprovalNotFoundException if no request has this id
     */
    public void delete(long requestId) {
        if (!approvals.delete(requestId)) {
            throw new ApprovalNotFoundException(requestId);
        }
        log.info("Deleted approval request {}", requestId);
    }

    /**
     * Moves every past-due pending request to {@code expired}.
     *
     * @return number of requests this sweep expired
     */
    public int expireSweep() {
        Instant now = clock.instant();
        int expired = 0;
        for (ApprovalRequest request : approvals.findPastDue(now)) {
            if (expireIfPending(request, now)) {
                expired++;
            }
        }
        if (expired > 0) {
            log.info("Expired {} approval requests", expired);
        }
        return expired;
    }

    public List<ApprovalOutcome> batchApprove(List<Long> requestIds, int approvedBy, String notes) {
        List<ApprovalOutcome> outcomes = new ArrayList<>(requestIds.size());
        for (Long requestId : requestIds) {
            try {
                outcomes.add(approve(requestId, approvedBy, notes));
            } catch (ApprovalNotFoundException e) {
                log.warn("Batch approve skipped: {}", e.getMessage());
                outcomes.add(ApprovalOutcome.notFound(requestId));
            }
        }
        return outcomes;
    }

    public List<ApprovalOutcome> batchReject(List<Long> requestIds, int rejectedBy, String reason) {
        List<ApprovalOutcome> outcomes = new ArrayList<>(requestIds.size());
        for (Long requestId : requestIds) {
            try {
                outcomes.add(reject(requestId, rejectedBy, reason));
            } catch (ApprovalNotFoundException e) {
                log.warn("Batch reject skipped: {}", e.getMessage());
                outcomes.add(ApprovalOutcome.notFound(requestId));
            }
        }
        return outcomes;
    }

    /**
     * Pending requests that have not yet expired, oldest first.
     */
    public List<ApprovalRequest> getPendingRequests(Integer userId, int limit, int offset) {
        return approvals.findPending(userId, clock.instant(),
                limit > 0 ? limit : ApprovalHistoryFilter.DEFAULT_LIMIT, Math.max(offset, 0));
    }

    public List<ApprovalRequest> getHistory(ApprovalHistoryFilter filter) {
        return approvals.findHistory(filter);
    }

    public ApprovalStats getStats() {
        return approvals.countByStatus();
    }

    public ApprovalRequest getRequest(long requestId) {
        return load(requestId);
    }

    /**
     * Deletes expired requests older than the retention window.
     */
    public int cleanupExpiredRequests(int retentionDays) {
        if (retentionDays < 1) {
            throw new IllegalArgumentException("retentionDays must be at least 1");
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        int deleted = approvals.deleteUpdatedBefore(ApprovalStatus.EXPIRED, cutoff);
        if (deleted > 0) {
            log.info("Removed {} expired approval requests older than {} days", deleted, retentionDays);
        }
        return deleted;
    }

    private boolean expireIfPending(ApprovalRequest request, Instant now) {
        if (!approvals.transitionFromPending(request.id(), ApprovalStatus.EXPIRED, null, null, now)) {
            return false;
        }
        log.info("Approval request {} for '{}' expired", request.id(), request.contentTitle());
        notifier.onExpired(request);
        return true;
    }

    private ApprovalRequest load(long requestId) {
        return approvals.findById(requestId).orElseThrow(() -> new ApprovalNotFoundException(requestId));
    }

    private ApprovalStatus currentStatus(long requestId) {
        return load(requestId).status();
    }
}
