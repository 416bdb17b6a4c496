package com.eventspotter.catalog.infrastructure.web.dto;

import com.eventspotter.catalog.domain.model.EventPage;

import java.util.List;

public record EventPageResponse(
        List<EventResponse> events,
        long totalEvents,
        long totalPages,
        int currentPage,
        int limit
) {
    public static EventPageResponse fromPage(EventPage page) {
        return new EventPageResponse(
                EventResponse.fromEvents(page.events()),
                page.totalEvents(),
                page.totalPages(),
                page.currentPage(),
                page.limit()
        );
    }
}
