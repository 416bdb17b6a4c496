package com.eventspotter.catalog.infrastructure.persistence;

import com.eventspotter.catalog.domain.model.Event;
import com.eventspotter.catalog.domain.port.out.SavedEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Bookmark relation backed by the user_saved_events table.
 * The primary key on (user_id, event_id) makes concurrent saves of the same pair collapse to one row.
 */
@Repository
public class DatabaseSavedEventRepository implements SavedEventRepository {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseSavedEventRepository.class);

    private final JdbcTemplate jdbcTemplate;

    public DatabaseSavedEventRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean insertIfAbsent(UUID userId, UUID eventId) {
        String sql = """
            INSERT INTO user_saved_events (user_id, event_id, saved_at)
            VALUES (?::uuid, ?::uuid, clock_timestamp())
            ON CONFLICT (user_id, event_id) DO NOTHING
            """;

        int inserted = jdbcTemplate.update(sql, userId.toString(), eventId.toString());
        logger.debug("Save of event {} for user {} inserted {} row(s)", eventId, userId, inserted);
        return inserted > 0;
    }

    @Override
    public boolean exists(UUID userId, UUID eventId) {
        Boolean exists = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM user_saved_events WHERE user_id = ?::uuid AND event_id = ?::uuid)",
                Boolean.class, userId.toString(), eventId.toString());
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public void delete(UUID userId, UUID eventId) {
        int deleted = jdbcTemplate.update(
                "DELETE FROM user_saved_events WHERE user_id = ?::uuid AND event_id = ?::uuid",
                userId.toString(), eventId.toString());
        if (deleted == 0) {
            logger.debug("Event {} was not saved by user {}", eventId, userId);
        }
    }

    @Override
    public List<Event> findSavedEvents(UUID userId) {
        // Inner join drops bookmarks whose event has been deleted
        String sql = "SELECT " + EventRowMapper.columns("e") + """
             FROM user_saved_events s
             JOIN events e ON e.id = s.event_id
             WHERE s.user_id = ?::uuid
             ORDER BY s.saved_at DESC, e.id ASC
            """;

        return jdbcTemplate.query(sql, EventRowMapper.INSTANCE, userId.toString());
    }

    @Override
    public long countAll() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM user_saved_events", Long.class);
        return count != null ? count : 0L;
    }
}
