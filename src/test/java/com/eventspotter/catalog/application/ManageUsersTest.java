package com.eventspotter.catalog.application;

import com.eventspotter.catalog.domain.exception.UserConflictException;
import com.eventspotter.catalog.domain.exception.UserNotFoundException;
import com.eventspotter.catalog.domain.model.NewUser;
import com.eventspotter.catalog.domain.model.ProfileUpdate;
import com.eventspotter.catalog.domain.model.User;
import com.eventspotter.catalog.domain.port.out.UserDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ManageUsersTest {

    private static final UUID USER_ID = UUID.fromString("33333333-3333-3333-3333-333333333333");

    @Mock
    private UserDirectory userDirectory;

    private ManageUsers manageUsers;

    @BeforeEach
    void setUp() {
        manageUsers = new ManageUsers(userDirectory);
    }

    @Test
    void shouldRegisterTrimmedUser() {
        // Given
        when(userDirectory.findConflicting(isNull(), eq("marta"), eq("marta@example.com"))).thenReturn(Optional.empty());
        when(userDirectory.insert(any(User.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        User registered = manageUsers.register(new NewUser(" marta ", "marta@example.com "));

        // Then
        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userDirectory).insert(captor.capture());
        assertThat(captor.getValue().username()).isEqualTo("marta");
        assertThat(captor.getValue().email()).isEqualTo("marta@example.com");
        assertThat(captor.getValue().id()).isNotNull();
        assertThat(registered.username()).isEqualTo("marta");
    }

    @Test
    void shouldRejectRegistrationWhenUsernameOrEmailTaken() {
        // Given
        when(userDirectory.findConflicting(null, "marta", "marta@example.com"))
                .thenReturn(Optional.of(user(UUID.randomUUID(), "marta", "other@example.com")));

        // When & Then
        assertThatThrownBy(() -> manageUsers.register(new NewUser("marta", "marta@example.com")))
                .isInstanceOf(UserConflictException.class)
                .hasMessage("User with this username or email already exists.");

        verify(userDirectory, never()).insert(any());
    }

    @Test
    void shouldTranslateDuplicateKeyOnRegistration() {
        // Given
        when(userDirectory.findConflicting(null, "marta", "marta@example.com")).thenReturn(Optional.empty());
        when(userDirectory.insert(any(User.class))).thenThrow(new DuplicateKeyException("users_email_key"));

        // When & Then
        assertThatThrownBy(() -> manageUsers.register(new NewUser("marta", "marta@example.com")))
                .isInstanceOf(UserConflictException.class);
    }

    @Test
    void shouldThrowWhenUserMissing() {
        // Given
        when(userDirectory.findById(USER_ID)).thenReturn(Optional.empty());

        // When & Then
        assertThatThrownBy(() -> manageUsers.findById(USER_ID))
                .isInstanceOf(UserNotFoundException.class)
                .hasMessageContaining(USER_ID.toString());
    }

    @Test
    void shouldReturnCurrentUserForEmptyUpdate() {
        // Given
        User current = user(USER_ID, "marta", "marta@example.com");
        when(userDirectory.findById(USER_ID)).thenReturn(Optional.of(current));

        // When
        User result = manageUsers.updateProfile(USER_ID, new ProfileUpdate(null, "  "));

        // Then
        assertThat(result).isEqualTo(current);
        verify(userDirectory, never()).update(any(), any());
        verify(userDirectory, never()).findConflicting(any(), any(), any());
    }

    @Test
    void shouldNameEmailInConflictMessage() {
        // Given
        when(userDirectory.findConflicting(USER_ID, "marta2", "taken@example.com"))
                .thenReturn(Optional.of(user(UUID.randomUUID(), "someone", "taken@example.com")));

        // When & Then
        assertThatThrownBy(() -> manageUsers.updateProfile(USER_ID, new ProfileUpdate("marta2", "taken@example.com")))
                .isInstanceOf(UserConflictException.class)
                .hasMessage("User with this email already exists.");
    }

    @Test
    void shouldNameBothFieldsWhenOneUserHoldsBoth() {
        // Given
        when(userDirectory.findConflicting(USER_ID, "jo", "jo@example.com"))
                .thenReturn(Optional.of(user(UUID.randomUUID(), "jo", "jo@example.com")));

        // When & Then
        assertThatThrownBy(() -> manageUsers.updateProfile(USER_ID, new ProfileUpdate("jo", "jo@example.com")))
                .isInstanceOf(UserConflictException.class)
                .hasMessage("User with this username and email already exists.");
    }

    @Test
    void shouldApplyProfileUpdate() {
        // Given
        ProfileUpdate update = new ProfileUpdate("marta_k", null);
        User updated = user(USER_ID, "marta_k", "marta@example.com");
        when(userDirectory.findConflicting(USER_ID, "marta_k", null)).thenReturn(Optional.empty());
        when(userDirectory.update(USER_ID, update)).thenReturn(Optional.of(updated));

        // When
        User result = manageUsers.updateProfile(USER_ID, update);

        // Then
        assertThat(result.username()).isEqualTo("marta_k");
    }

    @Test
    void shouldThrowWhenUpdatingUnknownUser() {
        // Given
        ProfileUpdate update = new ProfileUpdate("ghost", null);
        when(userDirectory.findConflicting(USER_ID, "ghost", null)).thenReturn(Optional.empty());
        when(userDirectory.update(USER_ID, update)).thenReturn(Optional.empty());

        // When & Then
        assertThatThrownBy(() -> manageUsers.updateProfile(USER_ID, update))
                .isInstanceOf(UserNotFoundException.class);
    }

    @Test
    void shouldTranslateDuplicateKeyOnUpdate() {
        // Given
        ProfileUpdate update = new ProfileUpdate(null, "race@example.com");
        when(userDirectory.findConflicting(USER_ID, null, "race@example.com")).thenReturn(Optional.empty());
        when(userDirectory.update(USER_ID, update)).thenThrow(new DuplicateKeyException("users_email_key"));

        // When & Then
        assertThatThrownBy(() -> manageUsers.updateProfile(USER_ID, update))
                .isInstanceOf(UserConflictException.class);
    }

    private User user(UUID id, String username, String email) {
        Instant now = Instant.parse("2025-03-01T10:00:00Z");
        return new User(id, username, email, now, now);
    }
}
