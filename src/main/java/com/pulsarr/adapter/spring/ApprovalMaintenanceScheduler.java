package com.pulsarr.adapter.spring;

import com.pulsarr.approval.ApprovalLifecycleManager;
import com.pulsarr.quota.QuotaTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodic approval expiry and retention cleanup. Requires {@code @EnableScheduling}.
 */
public class ApprovalMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(ApprovalMaintenanceScheduler.class);

    private final ApprovalLifecycleManager lifecycleManager;
    private final QuotaTracker quotaTracker;
    private final RouterProperties properties;

    public ApprovalMaintenanceScheduler(ApprovalLifecycleManager lifecycleManager, QuotaTracker quotaTracker,
                                        RouterProperties properties) {
        this.lifecycleManager = lifecycleManager;
        this.quotaTracker = quotaTracker;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${pulsarr.approval.expiry-sweep-interval-ms:3600000}")
    public void expireApprovals() {
        int expired = lifecycleManager.expireSweep();
        log.debug("Approval expiry sweep completed: {} expired", expired);
    }

    @Scheduled(fixedDelayString = "${pulsarr.quota.cleanup-interval-ms:86400000}",
            initialDelayString = "${pulsarr.quota.cleanup-interval-ms:86400000}")
    public void cleanup() {
        int requests = lifecycleManager.cleanupExpiredRequests(properties.getApproval().getRetentionDays());
        int usage = quotaTracker.cleanupOldUsage(properties.getQuota().getUsageRetentionDays());
        log.debug("Retention cleanup completed: approvals={}, usage={}", requests, usage);
    }
}
