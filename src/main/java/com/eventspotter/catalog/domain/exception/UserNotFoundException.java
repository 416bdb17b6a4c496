package com.eventspotter.catalog.domain.exception;

import java.util.UUID;

public class UserNotFoundException extends EventCatalogException {

    public UserNotFoundException(UUID userId) {
        super("User not found: " + userId);
    }
}
