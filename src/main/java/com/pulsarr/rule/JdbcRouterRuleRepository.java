package com.pulsarr.rule;

import com.pulsarr.condition.ConditionNode;
import com.pulsarr.config.ConditionParser;
import com.pulsarr.core.GeneratedKeys;
import com.pulsarr.core.JsonColumns;
import com.pulsarr.core.TargetType;
import com.pulsarr.exception.ConfigurationException;
import com.pulsarr.exception.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Router rules stored in the {@code router_rules} table. Criteria are a JSON column; conditional
 * trees are parsed once when a row is loaded.
 */
public class JdbcRouterRuleRepository implements RouterRuleRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRouterRuleRepository.class);

    private static final String SELECT_COLUMNS = """
            SELECT id, name, type, target_type, target_instance_id, quality_profile, root_folder, tags,
                   priority, enabled, criteria, search_on_add, season_monitoring, series_type,
                   minimum_availability, always_require_approval, bypass_user_quotas, approval_reason
            FROM router_rules
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final RowMapper<RouterRule> rowMapper = this::mapRow;

    public JdbcRouterRuleRepository(NamedParameterJdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public List<RouterRule> findByFamily(RuleFamily family, boolean enabledOnly) {
        String sql = SELECT_COLUMNS + """
                WHERE type = :type AND (enabled = TRUE OR :enabledOnly = FALSE)
                ORDER BY priority DESC, id ASC
                """;
        try {
            return jdbcTemplate.query(sql, new MapSqlParameterSource()
                    .addValue("type", family.value())
                    .addValue("enabledOnly", enabledOnly), rowMapper);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load " + family.value() + " rules", e);
        }
    }

    @Override
    public boolean hasEnabledRules(RuleFamily family, TargetType targetType) {
        String sql = """
                SELECT COUNT(*) FROM router_rules
                WHERE type = :type AND target_type = :targetType AND enabled = TRUE
                """;
        try {
            Integer count = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource()
                    .addValue("type", family.value())
                    .addValue("targetType", targetType.value()), Integer.class);
            return count != null && count > 0;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to count " + family.value() + " rules", e);
        }
    }

    @Override
    public Optional<RouterRule> findById(long id) {
        try {
            List<RouterRule> rules = jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = :id",
                    new MapSqlParameterSource("id", id), rowMapper);
            return rules.stream().findFirst();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load rule " + id, e);
        }
    }

    @Override
    public List<RouterRule> findAll() {
        try {
            return jdbcTemplate.query(SELECT_COLUMNS + " ORDER BY priority DESC, id ASC", rowMapper);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load rules", e);
        }
    }

    @Override
    public RouterRule save(RouterRule rule) {
        Timestamp now = Timestamp.from(clock.instant());
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("name", rule.name())
                .addValue("type", rule.type().value())
                .addValue("targetType", rule.targetType().value())
                .addValue("targetInstanceId", rule.targetInstanceId())
                .addValue("qualityProfile", rule.qualityProfile())
                .addValue("rootFolder", rule.rootFolder())
                .addValue("tags", JsonColumns.write(rule.tags()))
                .addValue("priority", rule.priority())
                .addValue("enabled", rule.enabled())
                .addValue("criteria", JsonColumns.write(rule.criteria()))
                .addValue("searchOnAdd", rule.searchOnAdd())
                .addValue("seasonMonitoring", rule.seasonMonitoring())
                .addValue("seriesType", rule.seriesType())
                .addValue("minimumAvailability", rule.minimumAvailability())
                .addValue("alwaysRequireApproval", rule.alwaysRequireApproval())
                .addValue("bypassUserQuotas", rule.bypassUserQuotas())
                .addValue("approvalReason", rule.approvalReason())
                .addValue("now", now);
        try {
            if (rule.id() != null) {
                String sql = """
                        UPDATE router_rules SET name = :name, type = :type, target_type = :targetType,
                            target_instance_id = :targetInstanceId, quality_profile = :qualityProfile,
                            root_folder = :rootFolder, tags = :tags, priority = :priority, enabled = :enabled,
                            criteria = :criteria, search_on_add = :searchOnAdd,
                            season_monitoring = :seasonMonitoring, series_type = :seriesType,
                            minimum_availability = :minimumAvailability,
                            always_require_approval = :alwaysRequireApproval,
                            bypass_user_quotas = :bypassUserQuotas, approval_reason = :approvalReason,
                            updated_at = :now
                        WHERE id = :id
                        """;
                int updated = jdbcTemplate.update(sql, params.addValue("id", rule.id()));
                if (updated == 1) {
                    return rule;
                }
                log.debug("Rule {} not found for update, inserting", rule.id());
            }
            String sql = """
                    INSERT INTO router_rules (name, type, target_type, target_instance_id, quality_profile,
                        root_folder, tags, priority, enabled, criteria, search_on_add, season_monitoring,
                        series_type, minimum_availability, always_require_approval, bypass_user_quotas,
                        approval_reason, created_at, updated_at)
                    VALUES (:name, :type, :targetType, :targetInstanceId, :qualityProfile, :rootFolder, :tags,
                        :priority, :enabled, :criteria, :searchOnAdd, :seasonMonitoring, :seriesType,
                        :minimumAvailability, :alwaysRequireApproval, :bypassUserQuotas, :approvalReason,
                        :now, :now)
                    """;
            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbcTemplate.update(sql, params, keyHolder);
            return rule.withId(GeneratedKeys.id(keyHolder, "rule " + rule.name()));
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to save rule " + rule.name(), e);
        }
    }

    @Override
    public boolean delete(long id) {
        try {
            return jdbcTemplate.update("DELETE FROM router_rules WHERE id = :id",
                    new MapSqlParameterSource("id", id)) == 1;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to delete rule " + id, e);
        }
    }

    private RouterRule mapRow(ResultSet rs, int rowNum) throws SQLException {
        long id = rs.getLong("id");
        RuleFamily family = RuleFamily.fromValue(rs.getString("type"));
        Map<String, Object> criteria = JsonColumns.readMap(rs.getString("criteria"));
        Object searchOnAdd = rs.getObject("search_on_add");
        return new RouterRule(
                id,
                rs.getString("name"),
                family,
                TargetType.fromValue(rs.getString("target_type")),
                rs.getInt("target_instance_id"),
                rs.getString("quality_profile"),
                rs.getString("root_folder"),
                JsonColumns.readStrings(rs.getString("tags")),
                rs.getInt("priority"),
                rs.getBoolean("enabled"),
                criteria,
                family == RuleFamily.CONDITIONAL ? parseCondition(id, criteria) : null,
                searchOnAdd != null ? rs.getBoolean("search_on_add") : null,
                rs.getString("season_monitoring"),
                rs.getString("series_type"),
                rs.getString("minimum_availability"),
                rs.getBoolean("always_require_approval"),
                rs.getBoolean("bypass_user_quotas"),
                rs.getString("approval_reason")
        );
    }

    private ConditionNode parseCondition(long ruleId, Map<String, Object> criteria) {
        try {
            return ConditionParser.parse(criteria.get("condition"));
        } catch (ConfigurationException e) {
            log.warn("Rule {} has a malformed condition tree and will not match: {}", ruleId, e.getMessage());
            return null;
        }
    }
}
