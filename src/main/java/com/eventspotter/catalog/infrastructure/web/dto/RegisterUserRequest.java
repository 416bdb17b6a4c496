package com.eventspotter.catalog.infrastructure.web.dto;

import com.eventspotter.catalog.domain.model.NewUser;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterUserRequest(
        @NotBlank
        @Size(min = 3, max = 50, message = "Username must be between 3 and 50 characters long")
        String username,

        @NotBlank
        @Email(message = "Invalid email address")
        @Size(max = 255)
        String email
) {
    public NewUser toNewUser() {
        return new NewUser(username, email);
    }
}
