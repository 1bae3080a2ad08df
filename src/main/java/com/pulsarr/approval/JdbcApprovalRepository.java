package com.pulsarr.approval;

import com.pulsarr.core.ContentType;
import com.pulsarr.core.GeneratedKeys;
import com.pulsarr.core.JsonColumns;
import com.pulsarr.decision.ApprovalTrigger;
import com.pulsarr.decision.RouterDecisionCodec;
import com.pulsarr.exception.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Approval requests in {@code approval_requests}. The unique key on
 * {@code (user_id, content_key)} enforces one request per user and item.
 */
public class JdbcApprovalRepository implements ApprovalRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcApprovalRepository.class);

    private static final String COLUMNS = """
            id, user_id, content_type, content_title, content_key, content_guids, proposed_router_decision,
            router_rule_id, triggered_by, approval_reason, status, approved_by, approval_notes,
            expires_at, created_at, updated_at
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final RouterDecisionCodec codec;
    private final RowMapper<ApprovalRequest> rowMapper = this::mapRow;

    public JdbcApprovalRepository(NamedParameterJdbcTemplate jdbcTemplate, RouterDecisionCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
    }

    @Override
    public Optional<ApprovalRequest> insert(ApprovalRequest request) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("userId", request.userId())
                .addValue("contentType", request.contentType().value())
                .addValue("contentTitle", request.contentTitle())
                .addValue("contentKey", request.contentKey())
                .addValue("contentGuids", JsonColumns.write(request.contentGuids()))
                .addValue("decision", codec.encode(request.proposedRouterDecision()))
                .addValue("ruleId", request.routerRuleId())
                .addValue("triggeredBy", request.triggeredBy().value())
                .addValue("reason", request.approvalReason())
                .addValue("status", request.status().value())
                .addValue("expiresAt", timestamp(request.expiresAt()))
                .addValue("createdAt", timestamp(request.createdAt()))
                .addValue("updatedAt", timestamp(request.updatedAt()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update("""
                    INSERT INTO approval_requests (user_id, content_type, content_title, content_key, content_guids,
                        proposed_router_decision, router_rule_id, triggered_by, approval_reason, status,
                        expires_at, created_at, updated_at)
                    VALUES (:userId, :contentType, :contentTitle, :contentKey, :contentGuids, :decision, :ruleId,
                        :triggeredBy, :reason, :status, :expiresAt, :createdAt, :updatedAt)
                    """, params, keyHolder);
        } catch (DuplicateKeyException e) {
            log.debug("Approval request for user {} and '{}' already exists", request.userId(), request.contentKey());
            return Optional.empty();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to create approval request for '" + request.contentTitle() + "'", e);
        }
        return findById(GeneratedKeys.id(keyHolder, "approval request '" + request.contentTitle() + "'"));
    }

    @Override
    public Optional<ApprovalRequest> findById(long id) {
        try {
            return jdbcTemplate.query("SELECT " + COLUMNS + " FROM approval_requests WHERE id = :id",
                    new MapSqlParameterSource("id", id), rowMapper).stream().findFirst();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load approval request " + id, e);
        }
    }

    @Override
    public Optional<ApprovalRequest> findByUserAndContentKey(int userId, String contentKey) {
        String sql = "SELECT " + COLUMNS + " FROM approval_requests WHERE user_id = :userId AND content_key = :contentKey";
        try {
            return jdbcTemplate.query(sql, new MapSqlParameterSource()
                            .addValue("userId", userId)
                            .addValue("contentKey", contentKey), rowMapper)
                    .stream().findFirst();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load approval request for user " + userId, e);
        }
    }

    @Override
    public boolean transitionFromPending(long id, ApprovalStatus target, Integer actedBy, String notes, Instant now) {
        if (target == ApprovalStatus.PENDING) {
            throw new IllegalArgumentException("Cannot transition a request back to pending");
        }
        String expiryClause = target == ApprovalStatus.EXPIRED
                ? "expires_at IS NOT NULL AND expires_at <= :now"
                : "(expires_at IS NULL OR expires_at > :now)";
        String sql = """
                UPDATE approval_requests
                SET status = :target, approved_by = :actedBy, approval_notes = :notes, updated_at = :now
                WHERE id = :id AND status = 'pending' AND\s""" + expiryClause;
        try {
            return jdbcTemplate.update(sql, new MapSqlParameterSource()
                    .addValue("id", id)
                    .addValue("target", target.value())
                    .addValue("actedBy", actedBy)
                    .addValue("notes", notes)
                    .addValue("now", Timestamp.from(now))) == 1;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to update approval request " + id, e);
        }
    }

    @Override
    public List<ApprovalRequest> findPastDue(Instant now) {
        String sql = "SELECT " + COLUMNS + """
                 FROM approval_requests
                WHERE status = 'pending' AND expires_at IS NOT NULL AND expires_at <= :now
                ORDER BY expires_at, id
                """;
        try {
            return jdbcTemplate.query(sql, new MapSqlParameterSource("now", Timestamp.from(now)), rowMapper);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load expired approval requests", e);
        }
    }

    @Override
    public List<ApprovalRequest> findPending(Integer userId, Instant now, int limit, int offset) {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append("""
                 FROM approval_requests
                WHERE status = 'pending' AND (expires_at IS NULL OR expires_at > :now)
                """);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("now", Timestamp.from(now))
                .addValue("limit", limit)
                .addValue("offset", offset);
        if (userId != null) {
            sql.append(" AND user_id = :userId");
            params.addValue("userId", userId);
        }
        sql.append(" ORDER BY created_at, id LIMIT :limit OFFSET :offset");
        try {
            return jdbcTemplate.query(sql.toString(), params, rowMapper);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load pending approval requests", e);
        }
    }

    @Override
    public List<ApprovalRequest> findHistory(ApprovalHistoryFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM approval_requests WHERE 1 = 1");
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("limit", filter.limit())
                .addValue("offset", filter.offset());
        if (filter.userId() != null) {
            sql.append(" AND user_id = :userId");
            params.addValue("userId", filter.userId());
        }
        if (filter.status() != null) {
            sql.append(" AND status = :status");
            params.addValue("status", filter.status().value());
        }
        if (filter.contentType() != null) {
            sql.append(" AND content_type = :contentType");
            params.addValue("contentType", filter.contentType().value());
        }
        if (filter.triggeredBy() != null) {
            sql.append(" AND triggered_by = :triggeredBy");
            params.addValue("triggeredBy", filter.triggeredBy().value());
        }
        sql.append(" ORDER BY created_at DESC, id DESC LIMIT :limit OFFSET :offset");
        try {
            return jdbcTemplate.query(sql.toString(), params, rowMapper);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load approval history", e);
        }
    }

    @Override
    public ApprovalStats countByStatus() {
        int[] counts = new int[ApprovalStatus.values().length];
        try {
            jdbcTemplate.query("SELECT status, COUNT(*) AS total FROM approval_requests GROUP BY status",
                    new MapSqlParameterSource(), rs -> {
                        counts[ApprovalStatus.fromValue(rs.getString("status")).ordinal()] = rs.getInt("total");
                    });
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to count approval requests", e);
        }
        return new ApprovalStats(
                counts[ApprovalStatus.PENDING.ordinal()],
                counts[ApprovalStatus.APPROVED.ordinal()],
                counts[ApprovalStatus.REJECTED.ordinal()],
                counts[ApprovalStatus.EXPIRED.ordinal()]);
    }

    @Override
    public boolean delete(long id) {
        try {
            return jdbcTemplate.update("DELETE FROM approval_requests WHERE id = :id",
                    new MapSqlParameterSource("id", id)) > 0;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to delete approval request " + id, e);
        }
    }

    @Override
    public int deleteUpdatedBefore(ApprovalStatus status, Instant cutoff) {
        try {
            return jdbcTemplate.update(
                    "DELETE FROM approval_requests WHERE status = :status AND updated_at < :cutoff",
                    new MapSqlParameterSource()
                            .addValue("status", status.value())
                            .addValue("cutoff", Timestamp.from(cutoff)));
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to clean up " + status.value() + " approval requests", e);
        }
    }

    private ApprovalRequest mapRow(ResultSet rs, int rowNum) throws SQLException {
        long ruleId = rs.getLong("router_rule_id");
        Long routerRuleId = rs.wasNull() ? null : ruleId;
        int approvedBy = rs.getInt("approved_by");
        Integer approver = rs.wasNull() ? null : approvedBy;
        return new ApprovalRequest(
                rs.getLong("id"),
                rs.getInt("user_id"),
                ContentType.fromValue(rs.getString("content_type")),
                rs.getString("content_title"),
                rs.getString("content_key"),
                JsonColumns.readStrings(rs.getString("content_guids")),
                codec.decode(rs.getString("proposed_router_decision")),
                routerRuleId,
                ApprovalTrigger.fromValue(rs.getString("triggered_by")),
                rs.getString("approval_reason"),
                ApprovalStatus.fromValue(rs.getString("status")),
                approver,
                rs.getString("approval_notes"),
                instant(rs.getTimestamp("expires_at")),
                instant(rs.getTimestamp("created_at")),
                instant(rs.getTimestamp("updated_at"))
        );
    }

    private static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant instant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
