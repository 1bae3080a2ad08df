package com.pulsarr.approval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notifier that only logs; used when no delivery channel is configured.
 */
public class LoggingApprovalNotifier implements ApprovalNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingApprovalNotifier.class);

    @Override
    public void onRequestCreated(ApprovalRequest request) {
        log.info("Approval required for '{}' requested by user {} ({}): {}", request.contentTitle(),
                request.userId(), request.triggeredBy().value(), request.approvalReason());
    }

    @Override
    public void onApproved(ApprovalRequest request) {
        log.info("Approval request {} for '{}' approved by {}", request.id(), request.contentTitle(),
                request.approvedBy());
    }

    @Override
    public void onRejected(ApprovalRequest request) {
        log.info("Approval request {} for '{}' rejected by {}", request.id(), request.contentTitle(),
                request.approvedBy());
    }

    @Override
    public void onExpired(ApprovalRequest request) {
        log.info("Approval request {} for '{}' expired", request.id(), request.contentTitle());
    }
}
