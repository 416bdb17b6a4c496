package com.eventspotter.catalog.domain.exception;

/**
 * A request the catalog refuses on its own invariants, e.g. an inverted date range
 * or an empty id list.
 */
public class InvalidEventQueryException extends EventCatalogException {

    public InvalidEventQueryException(String message) {
        super(message);
    }
}
