package com.eventspotter.catalog.application;

import com.eventspotter.catalog.domain.exception.CatalogCapacityExceededException;
import com.eventspotter.catalog.domain.exception.EventNotFoundException;
import com.eventspotter.catalog.domain.exception.UserNotFoundException;
import com.eventspotter.catalog.domain.model.Event;
import com.eventspotter.catalog.domain.model.SaveOutcome;
import com.eventspotter.catalog.domain.port.out.EventRepository;
import com.eventspotter.catalog.domain.port.out.SavedEventRepository;
import com.eventspotter.catalog.infrastructure.config.CatalogLimitsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
public class SavedEventUseCase implements SaveEvents {

    private static final Logger logger = LoggerFactory.getLogger(SavedEventUseCase.class);

    private final EventRepository eventRepository;
    private final SavedEventRepository savedEventRepository;
    private final CatalogLimitsConfig limits;

    public SavedEventUseCase(EventRepository eventRepository,
                             SavedEventRepository savedEventRepository,
                             CatalogLimitsConfig limits) {
        this.eventRepository = eventRepository;
        this.savedEventRepository = savedEventRepository;
        this.limits = limits;
    }

    @Override
    public SaveOutcome save(UUID userId, UUID eventId) {
        if (!eventRepository.existsById(eventId)) {
            logger.warn("Attempt to save non-existent event {} by user {}", eventId, userId);
            throw new EventNotFoundException(eventId);
        }

        if (limits.isSavedEventLimitReached(savedEventRepository.countAll())) {
            if (savedEventRepository.exists(userId, eventId)) {
                return SaveOutcome.ALREADY_EXISTS;
            }
            logger.warn("Saved event limit of {} reached", limits.getMaxSavedEvents());
            throw new CatalogCapacityExceededException("Event saving limit reached. Please try again later.");
        }

        boolean created;
        try {
            created = savedEventRepository.insertIfAbsent(userId, eventId);
        } catch (DataIntegrityViolationException e) {
            logger.warn("Foreign key violation while saving event {} for user {}", eventId, userId);
            throw new UserNotFoundException(userId);
        }

        if (created) {
            logger.info("Event {} saved by user {}", eventId, userId);
            return SaveOutcome.CREATED;
        }
        logger.info("Event {} already saved by user {}", eventId, userId);
        return SaveOutcome.ALREADY_EXISTS;
    }

    @Override
    public void unsave(UUID userId, UUID eventId) {
        savedEventRepository.delete(userId, eventId);
        logger.debug("Event {} unsaved by user {}", eventId, userId);
    }

    @Override
    public List<Event> listSaved(UUID userId) {
        List<Event> events = savedEventRepository.findSavedEvents(userId);
        logger.debug("User {} has {} saved events", userId, events.size());
        return events;
    }
}
