package com.eventspotter.catalog.infrastructure.web.dto;

import com.eventspotter.catalog.domain.model.User;

import java.time.Instant;
import java.util.UUID;

public record UserResponse(
        UUID id,
        String username,
        String email,
        Instant createdAt,
        Instant updatedAt
) {
    public static UserResponse fromUser(User user) {
        return new UserResponse(user.id(), user.username(), user.email(), user.createdAt(), user.updatedAt());
    }
}
