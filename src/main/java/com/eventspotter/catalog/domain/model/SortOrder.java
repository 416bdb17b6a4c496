package com.eventspotter.catalog.domain.model;

import com.eventspotter.catalog.domain.exception.InvalidEventQueryException;

public enum SortOrder {
    ASC,
    DESC;

    public static SortOrder fromParameter(String value) {
        if ("asc".equalsIgnoreCase(value)) {
            return ASC;
        }
        if ("desc".equalsIgnoreCase(value)) {
            return DESC;
        }
        throw new InvalidEventQueryException("Unsupported sortOrder value: " + value);
    }
}
