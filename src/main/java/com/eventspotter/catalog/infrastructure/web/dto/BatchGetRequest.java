package com.eventspotter.catalog.infrastructure.web.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

public record BatchGetRequest(
        @NotEmpty(message = "At least one event ID must be provided")
        List<@NotNull UUID> eventIds
) {}
