package com.eventspotter.catalog.application;

import com.eventspotter.catalog.domain.model.Event;
import com.eventspotter.catalog.domain.model.EventFilter;
import com.eventspotter.catalog.domain.model.EventPage;

import java.util.List;
import java.util.UUID;

/**
 * Read access to the shared event listing.
 * None of these operations look at who is asking; they run over the whole corpus.
 */
public interface FindEvents {

    /**
     * Executes a filtered, sorted and paginated listing query.
     *
     * @param filter the validated query description
     * @return the requested page plus the total number of matching events
     */
    EventPage list(EventFilter filter);

    /**
     * @throws com.eventspotter.catalog.domain.exception.EventNotFoundException if no such event exists
     */
    Event findById(UUID eventId);

    /**
     * Resolves a list of identifiers to the events that currently exist.
     * Unknown identifiers are silently omitted.
     *
     * @throws com.eventspotter.catalog.domain.exception.InvalidEventQueryException if the list is empty
     */
    List<Event> batchGet(List<UUID> eventIds);
}
