package com.eventspotter.catalog.domain.model;

import java.util.List;

/**
 * One page of a filtered listing together with the size of the full matching set.
 */
public record EventPage(
        List<Event> events,
        long totalEvents,
        long totalPages,
        int currentPage,
        int limit
) {
    public static EventPage of(List<Event> events, long totalEvents, EventFilter filter) {
        return new EventPage(
                List.copyOf(events),
                totalEvents,
                totalPages(totalEvents, filter.limit()),
                filter.page(),
                filter.limit()
        );
    }

    static long totalPages(long totalEvents, int limit) {
        if (totalEvents <= 0) {
            return 0;
        }
        return (totalEvents + limit - 1) / limit;
    }
}
