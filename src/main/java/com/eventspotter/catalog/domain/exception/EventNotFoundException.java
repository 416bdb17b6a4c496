package com.eventspotter.catalog.domain.exception;

import java.util.UUID;

public class EventNotFoundException extends EventCatalogException {

    public EventNotFoundException(UUID eventId) {
        super("Event not found: " + eventId);
    }

    public EventNotFoundException(String message) {
        super(message);
    }
}
