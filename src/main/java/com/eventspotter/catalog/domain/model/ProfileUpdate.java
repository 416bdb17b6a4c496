package com.eventspotter.catalog.domain.model;

/**
 * Changes to a user's profile. Null fields are left unchanged.
 */
public record ProfileUpdate(
        String username,
        String email
) {
    public boolean isEmpty() {
        return username == null && email == null;
    }
}
