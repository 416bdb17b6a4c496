package com.eventspotter.catalog.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Fields supplied by a user creating an event.
 * A null organizerName is replaced by the creator's username.
 */
public record NewEvent(
        String title,
        String description,
        LocalDate eventDate,
        LocalTime eventTime,
        String locationDescription,
        String organizerName,
        String category,
        List<String> tags,
        String websiteUrl
) {
    public NewEvent {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
