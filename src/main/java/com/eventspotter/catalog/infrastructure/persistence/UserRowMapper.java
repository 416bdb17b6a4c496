package com.eventspotter.catalog.infrastructure.persistence;

import com.eventspotter.catalog.domain.model.User;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.UUID;

final class UserRowMapper implements RowMapper<User> {

    static final UserRowMapper INSTANCE = new UserRowMapper();

    static final String COLUMNS = "id, username, email, created_at, updated_at";

    private UserRowMapper() {
    }

    @Override
    public User mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new User(
                UUID.fromString(rs.getString("id")),
                rs.getString("username"),
                rs.getString("email"),
                rs.getObject("created_at", OffsetDateTime.class).toInstant(),
                rs.getObject("updated_at", OffsetDateTime.class).toInstant()
        );
    }
}
