package com.pulsarr.quota;

import com.pulsarr.core.ContentType;
import com.pulsarr.exception.PersistenceException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Quotas in {@code user_quotas}, usage in {@code quota_usage}.
 */
public class JdbcQuotaRepository implements QuotaRepository {

    private static final RowMapper<UserQuota> QUOTA_MAPPER = (rs, rowNum) -> new UserQuota(
            rs.getInt("user_id"),
            ContentType.fromValue(rs.getString("content_type")),
            QuotaType.fromValue(rs.getString("quota_type")),
            rs.getInt("quota_limit"),
            rs.getBoolean("bypass_approval")
    );

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcQuotaRepository(NamedParameterJdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public Optional<UserQuota> findQuota(int userId, ContentType contentType) {
        String sql = """
                SELECT user_id, content_type, quota_type, quota_limit, bypass_approval
                FROM user_quotas WHERE user_id = :userId AND content_type = :contentType
                """;
        try {
            return jdbcTemplate.query(sql, params(userId, contentType), QUOTA_MAPPER).stream().findFirst();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load quota for user " + userId, e);
        }
    }

    @Override
    public List<UserQuota> findQuotas(int userId) {
        String sql = """
                SELECT user_id, content_type, quota_type, quota_limit, bypass_approval
                FROM user_quotas WHERE user_id = :userId ORDER BY content_type
                """;
        try {
            return jdbcTemplate.query(sql, new MapSqlParameterSource("userId", userId), QUOTA_MAPPER);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load quotas for user " + userId, e);
        }
    }

    @Override
    public void saveQuota(UserQuota quota) {
        MapSqlParameterSource params = params(quota.userId(), quota.contentType())
                .addValue("quotaType", quota.quotaType().value())
                .addValue("quotaLimit", quota.quotaLimit())
                .addValue("bypassApproval", quota.bypassApproval())
                .addValue("now", Timestamp.from(clock.instant()));
        try {
            int updated = jdbcTemplate.update("""
                    UPDATE user_quotas SET quota_type = :quotaType, quota_limit = :quotaLimit,
                        bypass_approval = :bypassApproval, updated_at = :now
                    WHERE user_id = :userId AND content_type = :contentType
                    """, params);
            if (updated == 0) {
                jdbcTemplate.update("""
                        INSERT INTO user_quotas (user_id, content_type, quota_type, quota_limit, bypass_approval,
                            created_at, updated_at)
                        VALUES (:userId, :contentType, :quotaType, :quotaLimit, :bypassApproval, :now, :now)
                        """, params);
            }
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to save quota for user " + quota.userId(), e);
        }
    }

    @Override
    public boolean deleteQuota(int userId, ContentType contentType) {
        try {
            return jdbcTemplate.update(
                    "DELETE FROM user_quotas WHERE user_id = :userId AND content_type = :contentType",
                    params(userId, contentType)) > 0;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to delete quota for user " + userId, e);
        }
    }

    @Override
    public void recordUsage(int userId, ContentType contentType, LocalDate requestDate, Instant createdAt) {
        try {
            jdbcTemplate.update("""
                    INSERT INTO quota_usage (user_id, content_type, request_date, created_at)
                    VALUES (:userId, :contentType, :requestDate, :createdAt)
                    """, params(userId, contentType)
                    .addValue("requestDate", Date.valueOf(requestDate))
                    .addValue("createdAt", Timestamp.from(createdAt)));
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to record quota usage for user " + userId, e);
        }
    }

    @Override
    public int countUsage(int userId, ContentType contentType, LocalDate from, LocalDate to) {
        String sql = """
                SELECT COUNT(*) FROM quota_usage
                WHERE user_id = :userId AND content_type = :contentType
                  AND request_date >= :fromDate AND request_date <= :toDate
                """;
        try {
            Integer count = jdbcTemplate.queryForObject(sql, range(userId, contentType, from, to), Integer.class);
            return count != null ? count : 0;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to count quota usage for user " + userId, e);
        }
    }

    @Override
    public Optional<LocalDate> oldestUsageDate(int userId, ContentType contentType, LocalDate from, LocalDate to) {
        String sql = """
                SELECT MIN(request_date) FROM quota_usage
                WHERE user_id = :userId AND content_type = :contentType
                  AND request_date >= :fromDate AND request_date <= :toDate
                """;
        try {
            Date oldest = jdbcTemplate.queryForObject(sql, range(userId, contentType, from, to), Date.class);
            return Optional.ofNullable(oldest).map(Date::toLocalDate);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to read quota usage for user " + userId, e);
        }
    }

    @Override
    public int deleteUsageBefore(LocalDate cutoff) {
        try {
            return jdbcTemplate.update("DELETE FROM quota_usage WHERE request_date < :cutoff",
                    new MapSqlParameterSource("cutoff", Date.valueOf(cutoff)));
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to clean up quota usage", e);
        }
    }

    private static MapSqlParameterSource params(int userId, ContentType contentType) {
        return new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("contentType", contentType.value());
    }

    private static MapSqlParameterSource range(int userId, ContentType contentType, LocalDate from, LocalDate to) {
        return params(userId, contentType)
                .addValue("fromDate", Date.valueOf(from))
                .addValue("toDate", Date.valueOf(to));
    }
}
