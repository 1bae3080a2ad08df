package com.pulsarr.approval;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for approval requests. Every status change goes through
 * {@link #transitionFromPending} so that only one caller can move a request out of
 * {@code pending}.
 */
public interface ApprovalRepository {

    /**
     * Inserts a new request.
     *
     * @return the stored request, or empty when one already exists for the same user and content key
     */
    Optional<ApprovalRequest> insert(ApprovalRequest request);

    Optional<ApprovalRequest> findById(long id);

    Optional<ApprovalRequest> findByUserAndContentKey(int userId, String contentKey);

    /**
     * Moves a pending request to {@code target}. Approve and reject only succeed while the
     * request is unexpired at {@code now}; expiry only succeeds once it is past due.
     *
     * @return true if this call performed the transition
     */
    boolean transitionFromPending(long id, ApprovalStatus target, Integer actedBy, String notes, Instant now);

    /**
     * Pending requests whose expiry is at or before {@code now}.
     */
    List<ApprovalRequest> findPastDue(Instant now);

    /**
     * Pending, unexpired requests, oldest first.
     */
    List<ApprovalRequest> findPending(Integer userId, Instant now, int limit, int offset);

    List<ApprovalRequest> findHistory(ApprovalHistoryFilter filter);

    ApprovalStats countByStatus();

    boolean delete(long id);

    /**
     * Deletes requests in {@code status} last updated before {@code cutoff}.
     */
    int deleteUpdatedBefore(ApprovalStatus status, Instant cutoff);
}
