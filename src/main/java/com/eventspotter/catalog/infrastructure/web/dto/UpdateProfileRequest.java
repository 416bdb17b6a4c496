package com.eventspotter.catalog.infrastructure.web.dto;

import com.eventspotter.catalog.domain.model.ProfileUpdate;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial profile update; omitted fields keep their current value.
 */
public record UpdateProfileRequest(
        @Size(min = 3, max = 50, message = "Username must be between 3 and 50 characters long")
        @Pattern(regexp = ".*\\S.*", message = "Username cannot be blank")
        String username,

        @Email(message = "Invalid email address")
        @Size(max = 255)
        String email
) {
    public ProfileUpdate toProfileUpdate() {
        return new ProfileUpdate(username, email);
    }
}
