package com.eventspotter.catalog.infrastructure.web.dto;

import com.eventspotter.catalog.domain.model.NewEvent;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.URL;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

public record CreateEventRequest(
        @NotBlank
        @Size(min = 3, max = 255, message = "Title must be between 3 and 255 characters long")
        String title,

        @NotNull
        @Size(min = 10, message = "Description must be at least 10 characters long")
        String description,

        @NotNull(message = "eventDate must be a valid date string in YYYY-MM-DD format")
        LocalDate eventDate,

        LocalTime eventTime,

        @NotBlank(message = "Location description cannot be empty")
        String locationDescription,

        @Size(min = 1, max = 100)
        String organizerName,

        @NotBlank(message = "Category cannot be empty")
        @Size(max = 100, message = "Category must be at most 100 characters long")
        String category,

        List<@NotNull @Size(max = 50, message = "Each tag must be at most 50 characters long") String> tags,

        @URL(message = "Invalid URL format for website")
        @Size(max = 2048)
        String websiteUrl
) {
    public NewEvent toNewEvent() {
        return new NewEvent(title, description, eventDate, eventTime, locationDescription,
                organizerName, category, tags, websiteUrl);
    }
}
