package com.eventspotter.catalog.infrastructure.persistence;

import com.eventspotter.catalog.domain.model.Event;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Maps a row of the events table to the domain Event
 */
final class EventRowMapper implements RowMapper<Event> {

    static final EventRowMapper INSTANCE = new EventRowMapper();

    private static final List<String> COLUMNS = List.of(
            "id", "user_id", "title", "description", "event_date", "event_time",
            "location_description", "organizer_name", "category", "tags", "website_url",
            "created_at", "updated_at");

    private EventRowMapper() {
    }

    /**
     * Select list of all event columns, optionally qualified by a table alias
     */
    static String columns(String alias) {
        String prefix = alias == null ? "" : alias + ".";
        return String.join(", ", COLUMNS.stream().map(column -> prefix + column).toList());
    }

    @Override
    public Event mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Event(
                UUID.fromString(rs.getString("id")),
                UUID.fromString(rs.getString("user_id")),
                rs.getString("title"),
                rs.getString("description"),
                rs.getObject("event_date", LocalDate.class),
                rs.getObject("event_time", LocalTime.class),
                rs.getString("location_description"),
                rs.getString("organizer_name"),
                rs.getString("category"),
                readTags(rs.getArray("tags")),
                rs.getString("website_url"),
                rs.getObject("created_at", OffsetDateTime.class).toInstant(),
                rs.getObject("updated_at", OffsetDateTime.class).toInstant()
        );
    }

    private static List<String> readTags(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        try {
            return Arrays.asList((String[]) array.getArray());
        } finally {
            array.free();
        }
    }
}
