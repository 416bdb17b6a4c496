package com.eventspotter.catalog.application;

import com.eventspotter.catalog.domain.exception.EventNotFoundException;
import com.eventspotter.catalog.domain.model.Event;
import com.eventspotter.catalog.domain.port.out.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Picks one event uniformly at random.
 *
 * <p>The pick counts the corpus and then reads the row at a random offset. A deletion between
 * the two reads can leave the offset past the end; in that case the first event in id order is
 * returned instead, so a caller always receives an event while at least one exists.
 */
@Service
public class RandomEventPicker {

    private static final Logger logger = LoggerFactory.getLogger(RandomEventPicker.class);

    private final EventRepository eventRepository;
    private final LongUnaryOperator offsetSource;

    @Autowired
    public RandomEventPicker(EventRepository eventRepository) {
        this(eventRepository, bound -> ThreadLocalRandom.current().nextLong(bound));
    }

    RandomEventPicker(EventRepository eventRepository, LongUnaryOperator offsetSource) {
        this.eventRepository = eventRepository;
        this.offsetSource = offsetSource;
    }

    public Event pickRandom() {
        long totalEvents = eventRepository.countAll();
        if (totalEvents == 0) {
            throw new EventNotFoundException("No events found.");
        }

        long offset = offsetSource.applyAsLong(totalEvents);
        Optional<Event> picked = eventRepository.findAtOffset(offset);
        if (picked.isPresent()) {
            return picked.get();
        }

        logger.info("Random pick at offset {} of {} returned nothing, falling back to first event",
                offset, totalEvents);
        return eventRepository.findFirst()
                .orElseThrow(() -> new EventNotFoundException("No events found (fallback)."));
    }
}
