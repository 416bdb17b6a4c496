package com.eventspotter.catalog.infrastructure.web.dto;

import com.eventspotter.catalog.domain.model.Event;
import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

public record EventResponse(
        UUID id,
        UUID userId,
        String title,
        String description,
        LocalDate eventDate,
        @JsonFormat(pattern = "HH:mm:ss")
        LocalTime eventTime,
        String locationDescription,
        String organizerName,
        String category,
        List<String> tags,
        String websiteUrl,
        Instant createdAt,
        Instant updatedAt
) {
    public static EventResponse fromEvent(Event event) {
        return new EventResponse(
                event.id(),
                event.userId(),
                event.title(),
                event.description(),
                event.eventDate(),
                event.eventTime(),
                event.locationDescription(),
                event.organizerName(),
                event.category(),
                event.tags(),
                event.websiteUrl(),
                event.createdAt(),
                event.updatedAt()
        );
    }

    public static List<EventResponse> fromEvents(List<Event> events) {
        return events.stream()
                .map(EventResponse::fromEvent)
                .toList();
    }
}
