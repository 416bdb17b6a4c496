package com.eventspotter.catalog.domain.port.out;

import com.eventspotter.catalog.domain.model.Event;
import com.eventspotter.catalog.domain.model.EventFilter;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository port for the Event aggregate
 * This is the contract that infrastructure must implement
 */
public interface EventRepository {

    /**
     * Page of events matching the filter, in the filter's sort order
     */
    List<Event> findPage(EventFilter filter);

    /**
     * Number of events matching the filter's predicates, ignoring pagination
     */
    long countMatching(EventFilter filter);

    Optional<Event> findById(UUID id);

    /**
     * Existing events among the given ids, each at most once, in no particular order
     */
    List<Event> findByIds(Collection<UUID> ids);

    boolean existsById(UUID id);

    long countAll();

    /**
     * Event at the given zero-based position of the id-ordered corpus, if any
     */
    Optional<Event> findAtOffset(long offset);

    /**
     * First event of the id-ordered corpus, if any
     */
    Optional<Event> findFirst();

    /**
     * Distinct category values exactly as stored
     */
    List<String> findDistinctCategories();

    /**
     * Distinct raw tag values as stored, before any trimming
     */
    List<String> findDistinctRawTags();

    Event insert(Event event);

    Event update(Event event);

    void deleteById(UUID id);
}
