package com.eventspotter.catalog.domain.model;

import com.eventspotter.catalog.domain.exception.InvalidEventQueryException;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Canonical description of an event listing query: which events match, in which order,
 * and which page of them is wanted.
 *
 * <p>All filters are optional and combined with AND; the tag list matches when an event
 * carries any of the requested tags. Null pagination and sort values fall back to page 1,
 * 10 per page, newest first by creation time.
 */
public record EventFilter(
        int page,
        int limit,
        SortField sortBy,
        SortOrder sortOrder,
        String category,
        List<String> tags,
        LocalDate startDate,
        LocalDate endDate,
        String search
) {
    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;

    public EventFilter {
        if (page < 1) {
            throw new InvalidEventQueryException("page must be at least 1");
        }
        if (limit < 1) {
            throw new InvalidEventQueryException("limit must be at least 1");
        }
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new InvalidEventQueryException("endDate cannot be before startDate");
        }
        sortBy = Objects.requireNonNullElse(sortBy, SortField.CREATED_AT);
        sortOrder = Objects.requireNonNullElse(sortOrder, SortOrder.DESC);
        category = blankToNull(category);
        search = blankToNull(search);
        tags = tags == null ? List.of() : List.copyOf(new LinkedHashSet<>(tags));
    }

    public static EventFilter defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Splits a comma separated tag parameter, trimming each entry and dropping empty ones.
     */
    public static List<String> parseTags(String commaSeparated) {
        if (commaSeparated == null) {
            return List.of();
        }
        return Arrays.stream(commaSeparated.split(","))
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .toList();
    }

    public long offset() {
        return (long) (page - 1) * limit;
    }

    public boolean hasTags() {
        return !tags.isEmpty();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    public static final class Builder {
        private int page = DEFAULT_PAGE;
        private int limit = DEFAULT_LIMIT;
        private SortField sortBy;
        private SortOrder sortOrder;
        private String category;
        private List<String> tags;
        private LocalDate startDate;
        private LocalDate endDate;
        private String search;

        private Builder() {
        }

        public Builder page(Integer page) {
            this.page = page != null ? page : DEFAULT_PAGE;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit != null ? limit : DEFAULT_LIMIT;
            return this;
        }

        public Builder sortBy(SortField sortBy) {
            this.sortBy = sortBy;
            return this;
        }

        public Builder sortOrder(SortOrder sortOrder) {
            this.sortOrder = sortOrder;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder search(String search) {
            this.search = search;
            return this;
        }

        public EventFilter build() {
            return new EventFilter(page, limit, sortBy, sortOrder, category, tags, startDate, endDate, search);
        }
    }
}
