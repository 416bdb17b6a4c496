package com.eventspotter.catalog.application;

import com.eventspotter.catalog.domain.exception.CatalogCapacityExceededException;
import com.eventspotter.catalog.domain.exception.EventAccessDeniedException;
import com.eventspotter.catalog.domain.exception.EventNotFoundException;
import com.eventspotter.catalog.domain.exception.InvalidEventQueryException;
import com.eventspotter.catalog.domain.exception.UserNotFoundException;
import com.eventspotter.catalog.domain.model.Event;
import com.eventspotter.catalog.domain.model.EventUpdate;
import com.eventspotter.catalog.domain.model.NewEvent;
import com.eventspotter.catalog.domain.port.out.EventRepository;
import com.eventspotter.catalog.domain.port.out.UserDirectory;
import com.eventspotter.catalog.infrastructure.config.CatalogLimitsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Create, update and delete of events. Only the owning user may change or remove an event.
 */
@Service
public class ManageEvents {

    private static final Logger logger = LoggerFactory.getLogger(ManageEvents.class);

    private final EventRepository eventRepository;
    private final UserDirectory userDirectory;
    private final CatalogLimitsConfig limits;

    public ManageEvents(EventRepository eventRepository,
                        UserDirectory userDirectory,
                        CatalogLimitsConfig limits) {
        this.eventRepository = eventRepository;
        this.userDirectory = userDirectory;
        this.limits = limits;
    }

    public Event create(UUID userId, NewEvent newEvent) {
        long eventCount = eventRepository.countAll();
        if (limits.isEventLimitReached(eventCount)) {
            logger.warn("Event creation limit reached: {} of {}", eventCount, limits.getMaxEvents());
            throw new CatalogCapacityExceededException("Event creation limit reached. Please try again later.");
        }

        String username = userDirectory.findUsername(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
        String organizerName = newEvent.organizerName() != null && !newEvent.organizerName().isBlank()
                ? newEvent.organizerName()
                : username;

        Event created = eventRepository.insert(new Event(
                UUID.randomUUID(),
                userId,
                newEvent.title(),
                newEvent.description(),
                newEvent.eventDate(),
                newEvent.eventTime(),
                newEvent.locationDescription(),
                organizerName,
                newEvent.category(),
                newEvent.tags(),
                newEvent.websiteUrl(),
                null,
                null
        ));

        logger.info("Event {} created by user {}: {}", created.id(), userId, created.title());
        return created;
    }

    public Event update(UUID userId, UUID eventId, EventUpdate update) {
        if (update.isEmpty()) {
            throw new InvalidEventQueryException("At least one field must be provided for update");
        }

        Event current = requireOwnedEvent(userId, eventId);
        Event updated = eventRepository.update(update.applyTo(current));

        logger.info("Event {} updated by owner {}", eventId, userId);
        return updated;
    }

    public void delete(UUID userId, UUID eventId) {
        requireOwnedEvent(userId, eventId);
        eventRepository.deleteById(eventId);

        logger.info("Event {} deleted by owner {}", eventId, userId);
    }

    private Event requireOwnedEvent(UUID userId, UUID eventId) {
        Event event = eventRepository.findById(eventId)
                .orElseThrow(() -> {
                    logger.info("User {} addressed non-existent event {}", userId, eventId);
                    return new EventNotFoundException(eventId);
                });

        if (!event.userId().equals(userId)) {
            logger.warn("User {} attempted to modify event {} owned by {}", userId, eventId, event.userId());
            throw new EventAccessDeniedException(eventId, userId);
        }
        return event;
    }
}
