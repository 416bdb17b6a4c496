package com.eventspotter.catalog.infrastructure.web.dto;

import com.eventspotter.catalog.domain.model.EventUpdate;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.URL;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Partial update payload; omitted fields keep their current value.
 */
public record UpdateEventRequest(
        @Size(min = 3, max = 255)
        @Pattern(regexp = ".*\\S.*", message = "Title cannot be blank")
        String title,

        @Size(min = 10)
        String description,

        LocalDate eventDate,

        LocalTime eventTime,

        @Size(min = 1)
        String locationDescription,

        @Size(min = 1, max = 100)
        String organizerName,

        @Size(min = 1, max = 100)
        String category,

        List<@NotNull @Size(max = 50) String> tags,

        @URL
        @Size(max = 2048)
        String websiteUrl
) {
    public EventUpdate toUpdate() {
        return new EventUpdate(title, description, eventDate, eventTime, locationDescription,
                organizerName, category, tags, websiteUrl);
    }
}
