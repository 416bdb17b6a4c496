package com.eventspotter.catalog.domain.model;

import java.time.Instant;
import java.util.UUID;

public record User(
        UUID id,
        String username,
        String email,
        Instant createdAt,
        Instant updatedAt
) {}
