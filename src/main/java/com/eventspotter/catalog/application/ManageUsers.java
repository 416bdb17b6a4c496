package com.eventspotter.catalog.application;

import com.eventspotter.catalog.domain.exception.UserConflictException;
import com.eventspotter.catalog.domain.exception.UserNotFoundException;
import com.eventspotter.catalog.domain.model.NewUser;
import com.eventspotter.catalog.domain.model.ProfileUpdate;
import com.eventspotter.catalog.domain.model.User;
import com.eventspotter.catalog.domain.port.out.UserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Registration and profile maintenance. Usernames and emails are unique across all users.
 */
@Service
public class ManageUsers {

    private static final Logger logger = LoggerFactory.getLogger(ManageUsers.class);

    static final String REGISTER_CONFLICT = "User with this username or email already exists.";

    private final UserDirectory userDirectory;

    public ManageUsers(UserDirectory userDirectory) {
        this.userDirectory = userDirectory;
    }

    public User register(NewUser newUser) {
        String username = newUser.username().trim();
        String email = newUser.email().trim();

        if (userDirectory.findConflicting(null, username, email).isPresent()) {
            logger.info("Registration rejected, username {} or its email is taken", username);
            throw new UserConflictException(REGISTER_CONFLICT);
        }

        Instant now = Instant.now();
        User candidate = new User(UUID.randomUUID(), username, email, now, now);
        try {
            User created = userDirectory.insert(candidate);
            logger.info("Registered user {} ({})", created.id(), created.username());
            return created;
        } catch (DuplicateKeyException e) {
            // Lost a race with a concurrent registration
            logger.warn("Unique violation registering {}", username);
            throw new UserConflictException(REGISTER_CONFLICT);
        }
    }

    public User findById(UUID userId) {
        return userDirectory.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
    }

    public User updateProfile(UUID userId, ProfileUpdate update) {
        ProfileUpdate trimmed = new ProfileUpdate(trimToNull(update.username()), trimToNull(update.email()));
        if (trimmed.isEmpty()) {
            return findById(userId);
        }

        Optional<User> conflicting = userDirectory.findConflicting(userId, trimmed.username(), trimmed.email());
        if (conflicting.isPresent()) {
            throw new UserConflictException(conflictMessage(conflicting.get(), trimmed));
        }

        try {
            User updated = userDirectory.update(userId, trimmed)
                    .orElseThrow(() -> new UserNotFoundException(userId));
            logger.info("Profile of user {} updated", userId);
            return updated;
        } catch (DuplicateKeyException e) {
            logger.warn("Unique violation updating profile of user {}", userId);
            throw new UserConflictException(REGISTER_CONFLICT);
        }
    }

    private static String conflictMessage(User existing, ProfileUpdate update) {
        boolean usernameTaken = update.username() != null && Objects.equals(existing.username(), update.username());
        boolean emailTaken = update.email() != null && Objects.equals(existing.email(), update.email());

        String field;
        if (usernameTaken && emailTaken) {
            field = "username and email";
        } else if (emailTaken) {
            field = "email";
        } else {
            field = "username";
        }
        return "User with this " + field + " already exists.";
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
