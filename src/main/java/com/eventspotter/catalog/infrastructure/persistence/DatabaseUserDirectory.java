package com.eventspotter.catalog.infrastructure.persistence;

import com.eventspotter.catalog.domain.model.ProfileUpdate;
import com.eventspotter.catalog.domain.model.User;
import com.eventspotter.catalog.domain.port.out.UserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Users table access. Unique violations on username or email surface as
 * {@link org.springframework.dao.DuplicateKeyException} for the caller to translate.
 */
@Repository
public class DatabaseUserDirectory implements UserDirectory {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseUserDirectory.class);

    private final JdbcTemplate jdbcTemplate;

    public DatabaseUserDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<String> findUsername(UUID userId) {
        return jdbcTemplate.queryForList("SELECT username FROM users WHERE id = ?::uuid", String.class, userId.toString())
                .stream()
                .findFirst();
    }

    @Override
    public Optional<User> findById(UUID userId) {
        String sql = "SELECT " + UserRowMapper.COLUMNS + " FROM users WHERE id = ?::uuid";
        return jdbcTemplate.query(sql, UserRowMapper.INSTANCE, userId.toString())
                .stream()
                .findFirst();
    }

    @Override
    public Optional<User> findConflicting(UUID excludedUserId, String username, String email) {
        List<String> matches = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        if (username != null) {
            matches.add("username = ?");
            params.add(username);
        }
        if (email != null) {
            matches.add("email = ?");
            params.add(email);
        }
        if (matches.isEmpty()) {
            return Optional.empty();
        }

        StringBuilder sql = new StringBuilder("SELECT " + UserRowMapper.COLUMNS + " FROM users WHERE (")
                .append(String.join(" OR ", matches))
                .append(")");
        if (excludedUserId != null) {
            sql.append(" AND id <> ?::uuid");
            params.add(excludedUserId.toString());
        }
        sql.append(" ORDER BY created_at ASC LIMIT 1");

        return jdbcTemplate.query(sql.toString(), UserRowMapper.INSTANCE, params.toArray())
                .stream()
                .findFirst();
    }

    @Override
    public User insert(User user) {
        String sql = """
            INSERT INTO users (id, username, email, created_at, updated_at)
            VALUES (?::uuid, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            RETURNING\s""" + UserRowMapper.COLUMNS;

        User stored = jdbcTemplate.queryForObject(sql, UserRowMapper.INSTANCE,
                user.id().toString(), user.username(), user.email());
        logger.debug("Inserted user {}", user.id());
        return stored;
    }

    @Override
    public Optional<User> update(UUID userId, ProfileUpdate update) {
        List<String> assignments = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        if (update.username() != null) {
            assignments.add("username = ?");
            params.add(update.username());
        }
        if (update.email() != null) {
            assignments.add("email = ?");
            params.add(update.email());
        }
        if (assignments.isEmpty()) {
            return findById(userId);
        }
        assignments.add("updated_at = CURRENT_TIMESTAMP");
        params.add(userId.toString());

        String sql = "UPDATE users SET " + String.join(", ", assignments)
                + " WHERE id = ?::uuid RETURNING " + UserRowMapper.COLUMNS;

        return jdbcTemplate.query(sql, UserRowMapper.INSTANCE, params.toArray())
                .stream()
                .findFirst();
    }
}
