package com.eventspotter.catalog.infrastructure.persistence;

import com.eventspotter.catalog.domain.exception.EventNotFoundException;
import com.eventspotter.catalog.domain.model.Event;
import com.eventspotter.catalog.domain.model.EventFilter;
import com.eventspotter.catalog.domain.port.out.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Events table access over JdbcTemplate.
 * Listing and count queries take their predicates from {@link EventFilterSql}; inserts and updates
 * read the stored row back through RETURNING so server-assigned timestamps reach the caller.
 */
@Repository
public class DatabaseEventRepository implements EventRepository {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseEventRepository.class);

    private static final String SELECT_EVENTS = "SELECT " + EventRowMapper.columns(null) + " FROM events";

    private final JdbcTemplate jdbcTemplate;

    public DatabaseEventRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Event> findPage(EventFilter filter) {
        EventFilterSql predicates = EventFilterSql.from(filter);
        String sql = SELECT_EVENTS + predicates.whereClause() + EventFilterSql.orderBy(filter) + " LIMIT ? OFFSET ?";

        List<Object> arguments = new ArrayList<>(predicates.arguments());
        arguments.add(filter.limit());
        arguments.add(filter.offset());

        return jdbcTemplate.query(sql, EventRowMapper.INSTANCE, arguments.toArray());
    }

    @Override
    public long countMatching(EventFilter filter) {
        EventFilterSql predicates = EventFilterSql.from(filter);
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM events" + predicates.whereClause(),
                Long.class,
                predicates.arguments().toArray());
        return count != null ? count : 0L;
    }

    @Override
    public Optional<Event> findById(UUID id) {
        return jdbcTemplate.query(SELECT_EVENTS + " WHERE id = ?::uuid", EventRowMapper.INSTANCE, id.toString())
                .stream()
                .findFirst();
    }

    @Override
    public List<Event> findByIds(Collection<UUID> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(", ", Collections.nCopies(ids.size(), "?::uuid"));
        Object[] arguments = ids.stream().map(UUID::toString).toArray();

        return jdbcTemplate.query(SELECT_EVENTS + " WHERE id IN (" + placeholders + ")",
                EventRowMapper.INSTANCE, arguments);
    }

    @Override
    public boolean existsById(UUID id) {
        Boolean exists = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM events WHERE id = ?::uuid)", Boolean.class, id.toString());
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public long countAll() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM events", Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public Optional<Event> findAtOffset(long offset) {
        return jdbcTemplate.query(SELECT_EVENTS + " ORDER BY id LIMIT 1 OFFSET ?", EventRowMapper.INSTANCE, offset)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<Event> findFirst() {
        return jdbcTemplate.query(SELECT_EVENTS + " ORDER BY id LIMIT 1", EventRowMapper.INSTANCE)
                .stream()
                .findFirst();
    }

    @Override
    public List<String> findDistinctCategories() {
        return jdbcTemplate.queryForList("SELECT DISTINCT category FROM events", String.class);
    }

    @Override
    public List<String> findDistinctRawTags() {
        return jdbcTemplate.queryForList("SELECT DISTINCT tag FROM events, unnest(tags) AS tag", String.class);
    }

    @Override
    @Transactional
    public Event insert(Event event) {
        String sql = """
            INSERT INTO events (
                id, user_id, title, description, event_date, event_time,
                location_description, organizer_name, category, tags, website_url,
                created_at, updated_at
            ) VALUES (?::uuid, ?::uuid, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            RETURNING\s""" + EventRowMapper.columns(null);

        try {
            List<Event> inserted = jdbcTemplate.query(connection -> {
                PreparedStatement ps = connection.prepareStatement(sql);
                ps.setString(1, event.id().toString());
                ps.setString(2, event.userId().toString());
                bindContent(connection, ps, 3, event);
                return ps;
            }, EventRowMapper.INSTANCE);

            logger.debug("Inserted event {}", event.id());
            return inserted.get(0);

        } catch (DataAccessException e) {
            logger.error("Error inserting event {}", event.id(), e);
            throw e;
        }
    }

    @Override
    @Transactional
    public Event update(Event event) {
        String sql = """
            UPDATE events SET
                title = ?, description = ?, event_date = ?, event_time = ?,
                location_description = ?, organizer_name = ?, category = ?, tags = ?, website_url = ?,
                updated_at = CURRENT_TIMESTAMP
            WHERE id = ?::uuid
            RETURNING\s""" + EventRowMapper.columns(null);

        try {
            List<Event> updated = jdbcTemplate.query(connection -> {
                PreparedStatement ps = connection.prepareStatement(sql);
                int next = bindContent(connection, ps, 1, event);
                ps.setString(next, event.id().toString());
                return ps;
            }, EventRowMapper.INSTANCE);

            if (updated.isEmpty()) {
                throw new EventNotFoundException(event.id());
            }
            return updated.get(0);

        } catch (DataAccessException e) {
            logger.error("Error updating event {}", event.id(), e);
            throw e;
        }
    }

    @Override
    @Transactional
    public void deleteById(UUID id) {
        int deleted = jdbcTemplate.update("DELETE FROM events WHERE id = ?::uuid", id.toString());
        logger.debug("Deleted {} row(s) for event {}", deleted, id);
    }

    /**
     * Binds the user-editable columns in table order starting at the given index
     * @return the next free parameter index
     */
    private static int bindContent(Connection connection, PreparedStatement ps, int start, Event event)
            throws SQLException {
        int i = start;
        ps.setString(i++, event.title());
        ps.setString(i++, event.description());
        ps.setObject(i++, event.eventDate());
        if (event.eventTime() != null) {
            ps.setObject(i++, event.eventTime());
        } else {
            ps.setNull(i++, Types.TIME);
        }
        ps.setString(i++, event.locationDescription());
        ps.setString(i++, event.organizerName());
        ps.setString(i++, event.category());
        ps.setArray(i++, connection.createArrayOf("text", event.tags().toArray(new String[0])));
        ps.setString(i++, event.websiteUrl());
        return i;
    }
}
