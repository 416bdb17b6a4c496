package com.eventspotter.catalog.infrastructure.web.dto;

import com.eventspotter.catalog.domain.model.Event;

import java.util.List;

public record EventListResponse(
        List<EventResponse> events
) {
    public static EventListResponse fromEvents(List<Event> events) {
        return new EventListResponse(EventResponse.fromEvents(events));
    }
}
