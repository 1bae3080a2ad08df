package com.pulsarr.instance;

import com.pulsarr.core.JsonColumns;
import com.pulsarr.core.TargetType;
import com.pulsarr.exception.PersistenceException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Instances stored in the {@code instances} table.
 */
public class JdbcInstanceRepository implements InstanceRepository {

    private static final String SELECT_COLUMNS = """
            SELECT id, instance_type, name, base_url, api_key, enabled, is_default, quality_profile,
                   root_folder, tags, search_on_add, season_monitoring, series_type, minimum_availability,
                   synced_instances
            FROM instances
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final RowMapper<Instance> rowMapper = this::mapRow;

    public JdbcInstanceRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Instance> findById(int id) {
        try {
            return jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = :id",
                    new MapSqlParameterSource("id", id), rowMapper).stream().findFirst();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load instance " + id, e);
        }
    }

    @Override
    public List<Instance> findEnabled(TargetType type) {
        try {
            return jdbcTemplate.query(SELECT_COLUMNS + " WHERE instance_type = :type AND enabled = TRUE ORDER BY id",
                    new MapSqlParameterSource("type", type.value()), rowMapper);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load " + type.value() + " instances", e);
        }
    }

    @Override
    public Optional<Instance> findDefault(TargetType type) {
        String sql = SELECT_COLUMNS + """
                WHERE instance_type = :type AND is_default = TRUE AND enabled = TRUE
                ORDER BY id
                """;
        try {
            return jdbcTemplate.query(sql, new MapSqlParameterSource("type", type.value()), rowMapper)
                    .stream().findFirst();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load default " + type.value() + " instance", e);
        }
    }

    @Override
    public List<Instance> findAll() {
        try {
            return jdbcTemplate.query(SELECT_COLUMNS + " ORDER BY id", rowMapper);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load instances", e);
        }
    }

    @Override
    public Instance save(Instance instance) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", instance.id())
                .addValue("type", instance.type().value())
                .addValue("name", instance.name())
                .addValue("baseUrl", instance.baseUrl())
                .addValue("apiKey", instance.apiKey())
                .addValue("enabled", instance.enabled())
                .addValue("isDefault", instance.isDefault())
                .addValue("qualityProfile", instance.qualityProfile())
                .addValue("rootFolder", instance.rootFolder())
                .addValue("tags", JsonColumns.write(instance.tags()))
                .addValue("searchOnAdd", instance.searchOnAdd())
                .addValue("seasonMonitoring", instance.seasonMonitoring())
                .addValue("seriesType", instance.seriesType())
                .addValue("minimumAvailability", instance.minimumAvailability())
                .addValue("syncedInstances", JsonColumns.write(instance.syncedInstances()));
        try {
            int updated = jdbcTemplate.update("""
                    UPDATE instances SET instance_type = :type, name = :name, base_url = :baseUrl,
                        api_key = :apiKey, enabled = :enabled, is_default = :isDefault,
                        quality_profile = :qualityProfile, root_folder = :rootFolder, tags = :tags,
                        search_on_add = :searchOnAdd, season_monitoring = :seasonMonitoring,
                        series_type = :seriesType, minimum_availability = :minimumAvailability,
                        synced_instances = :syncedInstances
                    WHERE id = :id
                    """, params);
            if (updated == 0) {
                jdbcTemplate.update("""
                        INSERT INTO instances (id, instance_type, name, base_url, api_key, enabled, is_default,
                            quality_profile, root_folder, tags, search_on_add, season_monitoring, series_type,
                            minimum_availability, synced_instances)
                        VALUES (:id, :type, :name, :baseUrl, :apiKey, :enabled, :isDefault, :qualityProfile,
                            :rootFolder, :tags, :searchOnAdd, :seasonMonitoring, :seriesType,
                            :minimumAvailability, :syncedInstances)
                        """, params);
            }
            return instance;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to save instance " + instance.id(), e);
        }
    }

    private Instance mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Instance(
                rs.getInt("id"),
                TargetType.fromValue(rs.getString("instance_type")),
                rs.getString("name"),
                rs.getString("base_url"),
                rs.getString("api_key"),
                rs.getBoolean("enabled"),
                rs.getBoolean("is_default"),
                rs.getString("quality_profile"),
                rs.getString("root_folder"),
                JsonColumns.readStrings(rs.getString("tags")),
                rs.getBoolean("search_on_add"),
                rs.getString("season_monitoring"),
                rs.getString("series_type"),
                rs.getString("minimum_availability"),
                JsonColumns.readIntegers(rs.getString("synced_instances"))
        );
    }
}
