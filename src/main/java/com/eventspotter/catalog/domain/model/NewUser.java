package com.eventspotter.catalog.domain.model;

/**
 * Registration data for a user. Credentials are held by the authentication layer, not here.
 */
public record NewUser(
        String username,
        String email
) {}
