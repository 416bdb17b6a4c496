package com.eventspotter.catalog.domain.port.out;

import com.eventspotter.catalog.domain.model.ProfileUpdate;
import com.eventspotter.catalog.domain.model.User;

import java.util.Optional;
import java.util.UUID;

/**
 * Storage of the users known to the catalog. Username and email are each unique.
 */
public interface UserDirectory {

    Optional<String> findUsername(UUID userId);

    Optional<User> findById(UUID userId);

    /**
     * First user other than {@code excludedUserId} holding the given username or email.
     * Null arguments are ignored; an excluded id of null considers every user.
     */
    Optional<User> findConflicting(UUID excludedUserId, String username, String email);

    User insert(User user);

    /**
     * Applies the non-null fields of the update.
     * @return the stored user, or empty if no user has that id
     */
    Optional<User> update(UUID userId, ProfileUpdate update);
}
