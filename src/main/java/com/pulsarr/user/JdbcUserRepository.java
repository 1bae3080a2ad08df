package com.pulsarr.user;

import com.pulsarr.exception.PersistenceException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.Optional;

/**
 * Users stored in the {@code users} table.
 */
public class JdbcUserRepository implements UserRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcUserRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<RouterUser> findById(int id) {
        try {
            return jdbcTemplate.query("SELECT id, name, requires_approval FROM users WHERE id = :id",
                    new MapSqlParameterSource("id", id),
                    (rs, rowNum) -> new RouterUser(rs.getInt("id"), rs.getString("name"),
                            rs.getBoolean("requires_approval")))
                    .stream().findFirst();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load user " + id, e);
        }
    }

    @Override
    public RouterUser save(RouterUser user) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", user.id())
                .addValue("name", user.name())
                .addValue("requiresApproval", user.requiresApproval());
        try {
            int updated = jdbcTemplate.update(
                    "UPDATE users SET name = :name, requires_approval = :requiresApproval WHERE id = :id", params);
            if (updated == 0) {
                jdbcTemplate.update(
                        "INSERT INTO users (id, name, requires_approval) VALUES (:id, :name, :requiresApproval)",
                        params);
            }
            return user;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to save user " + user.id(), e);
        }
    }
}
