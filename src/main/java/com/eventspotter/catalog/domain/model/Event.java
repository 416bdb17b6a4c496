package com.eventspotter.catalog.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

public record Event(
        UUID id,
        UUID userId,
        String title,
        String description,
        LocalDate eventDate,
        LocalTime eventTime,
        String locationDescription,
        String organizerName,
        String category,
        List<String> tags,
        String websiteUrl,
        Instant createdAt,
        Instant updatedAt
) {
    public Event {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
