package com.eventspotter.catalog.domain.port.out;

import com.eventspotter.catalog.domain.model.Event;

import java.util.List;
import java.util.UUID;

/**
 * Storage of the user to event bookmark relation, keyed by (userId, eventId)
 */
public interface SavedEventRepository {

    /**
     * Inserts the pair unless it is already present.
     * @return true if a row was created, false if one already existed
     */
    boolean insertIfAbsent(UUID userId, UUID eventId);

    boolean exists(UUID userId, UUID eventId);

    /**
     * Removes the pair if present; absent pairs are ignored
     */
    void delete(UUID userId, UUID eventId);

    /**
     * Saved events that still exist, most recently saved first
     */
    List<Event> findSavedEvents(UUID userId);

    long countAll();
}
