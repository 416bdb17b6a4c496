package com.eventspotter.catalog.application;

import com.eventspotter.catalog.domain.exception.EventNotFoundException;
import com.eventspotter.catalog.domain.exception.InvalidEventQueryException;
import com.eventspotter.catalog.domain.model.Event;
import com.eventspotter.catalog.domain.model.EventFilter;
import com.eventspotter.catalog.domain.model.EventPage;
import com.eventspotter.catalog.domain.port.out.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
public class EventUseCase implements FindEvents {

    private static final Logger logger = LoggerFactory.getLogger(EventUseCase.class);

    private final EventRepository eventRepository;

    public EventUseCase(EventRepository eventRepository) {
        this.eventRepository = eventRepository;
    }

    @Override
    public EventPage list(EventFilter filter) {
        logger.debug("Listing events with {}", filter);

        // Count and page are separate reads; under concurrent writes they may disagree
        long totalEvents = eventRepository.countMatching(filter);
        if (totalEvents == 0 || filter.offset() >= totalEvents) {
            logger.debug("No events on page {} ({} matching)", filter.page(), totalEvents);
            return EventPage.of(List.of(), totalEvents, filter);
        }

        List<Event> events = eventRepository.findPage(filter);
        logger.debug("Found {} events on page {} of {} matching", events.size(), filter.page(), totalEvents);
        return EventPage.of(events, totalEvents, filter);
    }

    @Override
    public Event findById(UUID eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new EventNotFoundException(eventId));
    }

    @Override
    public List<Event> batchGet(List<UUID> eventIds) {
        if (eventIds == null || eventIds.isEmpty()) {
            throw new InvalidEventQueryException("At least one event ID must be provided");
        }

        Set<UUID> distinctIds = new LinkedHashSet<>(eventIds);
        List<Event> events = eventRepository.findByIds(distinctIds);

        logger.debug("Batch get resolved {} of {} requested ids", events.size(), distinctIds.size());
        return events;
    }
}
