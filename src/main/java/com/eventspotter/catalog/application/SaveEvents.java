package com.eventspotter.catalog.application;

import com.eventspotter.catalog.domain.model.Event;
import com.eventspotter.catalog.domain.model.SaveOutcome;

import java.util.List;
import java.util.UUID;

/**
 * Owns the user to event bookmark relation.
 * Saving an event requires no ownership of it.
 */
public interface SaveEvents {

    /**
     * Bookmarks an event for a user. Repeating the call leaves the original bookmark untouched.
     *
     * @return {@link SaveOutcome#CREATED} for a new bookmark, {@link SaveOutcome#ALREADY_EXISTS} otherwise
     * @throws com.eventspotter.catalog.domain.exception.EventNotFoundException if the event does not exist
     */
    SaveOutcome save(UUID userId, UUID eventId);

    /**
     * Ensures the bookmark is absent. Never fails for a missing bookmark or event.
     */
    void unsave(UUID userId, UUID eventId);

    /**
     * Events the user has saved, most recently saved first. Bookmarks of deleted events are skipped.
     */
    List<Event> listSaved(UUID userId);
}
