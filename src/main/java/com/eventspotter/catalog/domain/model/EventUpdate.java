package com.eventspotter.catalog.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Partial replacement of an event. Null fields are left unchanged.
 */
public record EventUpdate(
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
    public boolean isEmpty() {
        return title == null && description == null && eventDate == null && eventTime == null
                && locationDescription == null && organizerName == null && category == null
                && tags == null && websiteUrl == null;
    }

    public Event applyTo(Event current) {
        return new Event(
                current.id(),
                current.userId(),
                title != null ? title : current.title(),
                description != null ? description : current.description(),
                eventDate != null ? eventDate : current.eventDate(),
                eventTime != null ? eventTime : current.eventTime(),
                locationDescription != null ? locationDescription : current.locationDescription(),
                organizerName != null ? organizerName : current.organizerName(),
                category != null ? category : current.category(),
                tags != null ? tags : current.tags(),
                websiteUrl != null ? websiteUrl : current.websiteUrl(),
                current.createdAt(),
                current.updatedAt()
        );
    }
}
