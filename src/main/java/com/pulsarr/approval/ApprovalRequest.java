package com.pulsarr.approval;

import com.pulsarr.core.ContentType;
import com.pulsarr.decision.ApprovalTrigger;
import com.pulsarr.decision.RouterDecision;

import java.time.Instant;
import java.util.List;

/**
 * A routing decision held until an admin acts on it.
 *
 * @param id                     Storage id, null before insert
 * @param userId                 Requesting user
 * @param contentType            Movie or show
 * @param contentTitle           Title for display
 * @param contentKey             Item key; one request per user and key
 * @param contentGuids           GUIDs of the item, used when the routing is replayed
 * @param proposedRouterDecision Decision replayed verbatim on approval
 * @param routerRuleId           Rule that demanded approval, if any
 * @param triggeredBy            Trigger category
 * @param approvalReason         Reason shown to admins
 * @param status                 Lifecycle state
 * @param approvedBy             Admin who approved or rejected
 * @param approvalNotes          Admin notes or rejection reason
 * @param expiresAt              Pending requests expire after this instant; null never expires
 * @param createdAt              Creation time
 * @param updatedAt              Last transition time
 */
public record ApprovalRequest(
        Long id,
        int userId,
        ContentType contentType,
        String contentTitle,
        String contentKey,
        List<String> contentGuids,
        RouterDecision proposedRouterDecision,
        Long routerRuleId,
        ApprovalTrigger triggeredBy,
        String approvalReason,
        ApprovalStatus status,
        Integer approvedBy,
        String approvalNotes,
        Instant expiresAt,
        Instant createdAt,
        Instant updatedAt
) {

    public ApprovalRequest {
        contentGuids = contentGuids != null ? List.copyOf(contentGuids) : List.of();
    }

    /**
     * Whether a pending request is past its expiry at the given instant.
     */
    public boolean isPastDue(Instant now) {
        return status == ApprovalStatus.PENDING && expiresAt != null && !expiresAt.isAfter(now);
    }
}
