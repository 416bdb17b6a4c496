package com.eventspotter.catalog.infrastructure.persistence;

import com.eventspotter.catalog.domain.model.EventFilter;
import com.eventspotter.catalog.domain.model.SortField;
import com.eventspotter.catalog.domain.model.SortOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Translates an EventFilter into SQL predicates and ordering.
 * The page query and the count query both take their WHERE clause from here,
 * so they always describe the same set of rows.
 */
final class EventFilterSql {

    private static final List<String> SEARCHABLE_COLUMNS = List.of(
            "title", "description", "location_description", "organizer_name", "category");

    private final String whereClause;
    private final List<Object> arguments;

    private EventFilterSql(String whereClause, List<Object> arguments) {
        this.whereClause = whereClause;
        this.arguments = arguments;
    }

    static EventFilterSql from(EventFilter filter) {
        List<String> conditions = new ArrayList<>();
        List<Object> arguments = new ArrayList<>();

        if (filter.category() != null) {
            conditions.add("category = ?");
            arguments.add(filter.category());
        }
        if (filter.hasTags()) {
            // Stored tags are compared raw; only the requested ones were trimmed
            String placeholders = String.join(", ", Collections.nCopies(filter.tags().size(), "?"));
            conditions.add("EXISTS (SELECT 1 FROM unnest(tags) AS tag WHERE tag IN (" + placeholders + "))");
            arguments.addAll(filter.tags());
        }
        if (filter.startDate() != null) {
            conditions.add("event_date >= ?");
            arguments.add(filter.startDate());
        }
        if (filter.endDate() != null) {
            conditions.add("event_date <= ?");
            arguments.add(filter.endDate());
        }
        if (filter.search() != null) {
            String pattern = "%" + escapeLike(filter.search()) + "%";
            List<String> matches = new ArrayList<>();
            for (String column : SEARCHABLE_COLUMNS) {
                matches.add(column + " ILIKE ?");
                arguments.add(pattern);
            }
            conditions.add("(" + String.join(" OR ", matches) + ")");
        }

        String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
        return new EventFilterSql(where, List.copyOf(arguments));
    }

    String whereClause() {
        return whereClause;
    }

    List<Object> arguments() {
        return arguments;
    }

    /**
     * ORDER BY clause for the filter. Text columns sort case-insensitively by code point,
     * and id breaks ties so that consecutive pages never overlap.
     */
    static String orderBy(EventFilter filter) {
        String direction = filter.sortOrder() == SortOrder.ASC ? "ASC" : "DESC";
        return " ORDER BY " + sortExpression(filter.sortBy()) + " " + direction + ", id ASC";
    }

    private static String sortExpression(SortField field) {
        return switch (field) {
            case EVENT_DATE -> "event_date";
            case CREATED_AT -> "created_at";
            case TITLE -> "lower(title) COLLATE \"C\"";
            case ORGANIZER_NAME -> "lower(organizer_name) COLLATE \"C\"";
            case CATEGORY -> "lower(category) COLLATE \"C\"";
        };
    }

    static String escapeLike(String value) {
        return value
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
