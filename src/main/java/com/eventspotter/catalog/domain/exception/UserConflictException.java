package com.eventspotter.catalog.domain.exception;

/**
 * A username or email that another user already holds.
 */
public class UserConflictException extends EventCatalogException {

    public UserConflictException(String message) {
        super(message);
    }
}
