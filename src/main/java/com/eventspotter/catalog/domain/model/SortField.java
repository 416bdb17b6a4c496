package com.eventspotter.catalog.domain.model;

import com.eventspotter.catalog.domain.exception.InvalidEventQueryException;

/**
 * Event attributes a listing may be ordered by, keyed by their query-parameter name.
 */
public enum SortField {
    EVENT_DATE("eventDate"),
    TITLE("title"),
    CREATED_AT("createdAt"),
    ORGANIZER_NAME("organizerName"),
    CATEGORY("category");

    private final String parameterName;

    SortField(String parameterName) {
        this.parameterName = parameterName;
    }

    public String parameterName() {
        return parameterName;
    }

    public static SortField fromParameter(String value) {
        for (SortField field : values()) {
            if (field.parameterName.equals(value)) {
                return field;
            }
        }
        throw new InvalidEventQueryException("Unsupported sortBy value: " + value);
    }
}
