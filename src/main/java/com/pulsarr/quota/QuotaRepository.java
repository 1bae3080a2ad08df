package com.pulsarr.quota;

import com.pulsarr.core.ContentType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Storage of quotas and append-only usage rows.
 */
public interface QuotaRepository {

    Optional<UserQuota> findQuota(int userId, ContentType contentType);

    List<UserQuota> findQuotas(int userId);

    void saveQuota(UserQuota quota);

    boolean deleteQuota(int userId, ContentType contentType);

    void recordUsage(int userId, ContentType contentType, LocalDate requestDate, Instant createdAt);

    /**
     * Usage rows with {@code from <= requestDate <= to}.
     */
    int countUsage(int userId, ContentType contentType, LocalDate from, LocalDate to);

    /**
     * Earliest request date among rows with {@code from <= requestDate <= to}.
     */
    Optional<LocalDate> oldestUsageDate(int userId, ContentType contentType, LocalDate from, LocalDate to);

    /**
     * Retention sweep: remove usage rows dated before the cutoff.
     */
    int deleteUsageBefore(LocalDate cutoff);
}
