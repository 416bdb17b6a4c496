package com.eventspotter.catalog.infrastructure.web;

import com.eventspotter.catalog.application.ManageUsers;
import com.eventspotter.catalog.domain.model.User;
import com.eventspotter.catalog.infrastructure.web.dto.RegisterUserRequest;
import com.eventspotter.catalog.infrastructure.web.dto.UpdateProfileRequest;
import com.eventspotter.catalog.infrastructure.web.dto.UserResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@Tag(name = "Users", description = "Registration and profile of the calling user")
@RequestMapping("/api/users")
public class UserController {

    private final ManageUsers manageUsers;

    public UserController(ManageUsers manageUsers) {
        this.manageUsers = manageUsers;
    }

    @Operation(summary = "Register a user")
    @PostMapping
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterUserRequest request) {
        User user = manageUsers.register(request.toNewUser());
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.fromUser(user));
    }

    @Operation(summary = "Get the caller's profile")
    @GetMapping("/me")
    public ResponseEntity<UserResponse> currentUser(@RequestHeader(CallerHeaders.USER_ID) UUID userId) {
        return ResponseEntity.ok(UserResponse.fromUser(manageUsers.findById(userId)));
    }

    @Operation(summary = "Update the caller's username or email")
    @PatchMapping("/me")
    public ResponseEntity<UserResponse> updateProfile(
            @RequestHeader(CallerHeaders.USER_ID) UUID userId,
            @Valid @RequestBody UpdateProfileRequest request
    ) {
        User user = manageUsers.updateProfile(userId, request.toProfileUpdate());
        return ResponseEntity.ok(UserResponse.fromUser(user));
    }
}
