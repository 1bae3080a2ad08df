package com.pulsarr.quota;

import com.pulsarr.core.ContentType;
import com.pulsarr.exception.ReferentialIntegrityException;
import com.pulsarr.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Counts accepted requests per user and content type and reports quota state.
 * <p>
 * Storage is the only source of truth; nothing is cached so several processes can share it.
 * Dates are local to the injected clock's zone.
 */
public class QuotaTracker {

    private static final Logger log = LoggerFactory.getLogger(QuotaTracker.class);

    public static final QuotaType DEFAULT_QUOTA_TYPE = QuotaType.MONTHLY;
    public static final int DEFAULT_QUOTA_LIMIT = 10;

    private final QuotaRepository repository;
    private final UserRepository users;
    private final Clock clock;

    public QuotaTracker(QuotaRepository repository, UserRepository users, Clock clock) {
        this.repository = repository;
        this.users = users;
        this.clock = clock;
    }

    /**
     * Current quota state, or empty when the user has no quota for this content type.
     */
    public Optional<QuotaStatus> getQuotaStatus(int userId, ContentType contentType) {
        Optional<UserQuota> quota = repository.findQuota(userId, contentType);
        if (quota.isEmpty()) {
            return Optional.empty();
        }
        UserQuota q = quota.get();
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.now(clock);

        int usage;
        Instant resetDate;
        switch (q.quotaType()) {
            case DAILY -> {
                usage = repository.countUsage(userId, contentType, today, today);
                resetDate = today.plusDays(1).atStartOfDay(zone).toInstant();
            }
            case WEEKLY_ROLLING -> {
                LocalDate from = today.minusDays(6);
                usage = repository.countUsage(userId, contentType, from, today);
                resetDate = repository.oldestUsageDate(userId, contentType, from, today)
                        .map(oldest -> oldest.plusDays(7).atStartOfDay(zone).toInstant())
                        .orElse(null);
            }
            case MONTHLY -> {
                LocalDate from = today.withDayOfMonth(1);
                usage = repository.countUsage(userId, contentType, from, today);
                resetDate = from.plusMonths(1).atStartOfDay(zone).toInstant();
            }
            default -> throw new IllegalStateException("Unhandled quota type: " + q.quotaType());
        }

        boolean exceeded = !q.bypassApproval() && usage >= q.quotaLimit();
        return Optional.of(new QuotaStatus(q.quotaType(), q.quotaLimit(), usage, exceeded, resetDate,
                q.bypassApproval()));
    }

    /**
     * Record one accepted request. Called once per routed or approved item, never for held or
     * rejected ones.
     */
    public void recordUsage(int userId, ContentType contentType) {
        if (!users.exists(userId)) {
            throw new ReferentialIntegrityException("Cannot record quota usage for unknown user " + userId);
        }
        repository.recordUsage(userId, contentType, LocalDate.now(clock), clock.instant());
        log.debug("Recorded {} quota usage for user {}", contentType.value(), userId);
    }

    public boolean wouldExceedQuota(int userId, ContentType contentType) {
        return getQuotaStatus(userId, contentType).map(QuotaStatus::exceeded).orElse(false);
    }

    /**
     * Requests left in the current window, or empty when unlimited.
     */
    public Optional<Integer> getRemainingQuota(int userId, ContentType contentType) {
        return getQuotaStatus(userId, contentType)
                .filter(status -> !status.bypassApproval())
                .map(QuotaStatus::remaining);
    }

    public UserQuota setQuota(UserQuota quota) {
        if (!users.exists(quota.userId())) {
            throw new ReferentialIntegrityException("Cannot set quota for unknown user " + quota.userId());
        }
        repository.saveQuota(quota);
        log.info("Set {} {} quota for user {}: limit {}{}", quota.quotaType().value(), quota.contentType().value(),
                quota.userId(), quota.quotaLimit(), quota.bypassApproval() ? " (bypass)" : "");
        return quota;
    }

    public UserQuota setupDefaultQuota(int userId, ContentType contentType) {
        return setQuota(new UserQuota(userId, contentType, DEFAULT_QUOTA_TYPE, DEFAULT_QUOTA_LIMIT, false));
    }

    /**
     * Apply the same quota to several users.
     *
     * @return number of quotas written
     */
    public int bulkUpdateQuotas(List<Integer> userIds, ContentType contentType, QuotaType quotaType,
                                int quotaLimit, boolean bypassApproval) {
        int written = 0;
        for (Integer userId : userIds) {
            setQuota(new UserQuota(userId, contentType, quotaType, quotaLimit, bypassApproval));
            written++;
        }
        return written;
    }

    public boolean deleteQuota(int userId, ContentType contentType) {
        return repository.deleteQuota(userId, contentType);
    }

    /**
     * Retention sweep. Only rows older than any quota window should be removed.
     *
     * @return rows deleted
     */
    public int cleanupOldUsage(int retentionDays) {
        if (retentionDays < 31) {
            throw new IllegalArgumentException("Retention must cover the longest quota window (31 days)");
        }
        LocalDate cutoff = LocalDate.now(clock).minusDays(retentionDays);
        int deleted = repository.deleteUsageBefore(cutoff);
        if (deleted > 0) {
            log.info("Removed {} quota usage rows older than {}", deleted, cutoff);
        }
        return deleted;
    }
}
