package com.eventspotter.catalog.domain.exception;

/**
 * Base type for failures the catalog reports to its callers.
 * Storage failures are not wrapped and surface as Spring {@code DataAccessException}s.
 */
public abstract class EventCatalogException extends RuntimeException {

    protected EventCatalogException(String message) {
        super(message);
    }
}
