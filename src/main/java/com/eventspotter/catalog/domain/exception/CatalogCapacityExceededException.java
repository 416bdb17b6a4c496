package com.eventspotter.catalog.domain.exception;

public class CatalogCapacityExceededException extends EventCatalogException {

    public CatalogCapacityExceededException(String message) {
        super(message);
    }
}
