package com.eventspotter.catalog.domain.exception;

import java.util.UUID;

public class EventAccessDeniedException extends EventCatalogException {

    public EventAccessDeniedException(UUID eventId, UUID userId) {
        super("User " + userId + " does not own event " + eventId);
    }
}
