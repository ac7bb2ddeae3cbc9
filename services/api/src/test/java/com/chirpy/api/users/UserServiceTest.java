package com.chirpy.api.users;

import com.chirpy.api.error.ConflictException;
import com.chirpy.api.error.NotFoundException;
import com.chirpy.api.security.PasswordHasher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock AppUserRepository users;
    @Mock PasswordHasher passwordHasher;

    private UserService userService;

    @BeforeEach
    void setUp() {
        userService = new UserService(users, passwordHasher, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static AppUser stored(String email) {
        var user = new AppUser(email, "old-hash", NOW.minusSeconds(3600));
        user.id = UUID.randomUUID();
        return user;
    }

    @Test
    void register_storesHashNotPassword() {
        when(users.existsByEmail("a@example.com")).thenReturn(false);
        when(passwordHasher.hash("pw")).thenReturn("hashed");
        when(users.saveAndFlush(any(AppUser.class))).thenAnswer(inv -> inv.getArgument(0));

        var user = userService.register("a@example.com", "pw");

        assertThat(user.getHashedPassword()).isEqualTo("hashed");
        assertThat(user.isChirpyRed()).isFalse();
        assertThat(user.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void register_duplicateEmail_conflicts() {
        when(users.existsByEmail("a@example.com")).thenReturn(true);

        assertThatThrownBy(() -> userService.register("a@example.com", "pw")).isInstanceOf(ConflictException.class);
        verifyNoInteractions(passwordHasher);
    }

    @Test
    void register_losingARaceOnTheUniqueEmail_conflicts() {
        when(users.existsByEmail("a@example.com")).thenReturn(false);
        when(passwordHasher.hash("pw")).thenReturn("hashed");
        when(users.saveAndFlush(any(AppUser.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"));

        assertThatThrownBy(() -> userService.register("a@example.com", "pw"))
                .isInstanceOf(ConflictException.class)
                .hasMessage("Email already in use");
    }

    @Test
    void updateCredentials_rehashesAndTouchesUpdatedAt() {
        var user = stored("old@example.com");
        when(users.findById(user.id)).thenReturn(Optional.of(user));
        when(users.findByEmail("new@example.com")).thenReturn(Optional.empty());
        when(passwordHasher.hash("new-pw")).thenReturn("new-hash");
        when(users.saveAndFlush(user)).thenReturn(user);

        var out = userService.updateCredentials(user.id, "new@example.com", "new-pw");

        assertThat(out.getEmail()).isEqualTo("new@example.com");
        assertThat(out.getHashedPassword()).isEqualTo("new-hash");
        assertThat(out.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void updateCredentials_emailTakenBySomeoneElse_conflicts() {
        var user = stored("me@example.com");
        when(users.findById(user.id)).thenReturn(Optional.of(user));
        when(users.findByEmail("taken@example.com")).thenReturn(Optional.of(stored("taken@example.com")));

        assertThatThrownBy(() -> userService.updateCredentials(user.id, "taken@example.com", "pw"))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void upgradeToChirpyRed_setsFlag() {
        var user = stored("a@example.com");
        when(users.findById(user.id)).thenReturn(Optional.of(user));

        userService.upgradeToChirpyRed(user.id);

        assertThat(user.isChirpyRed()).isTrue();
        verify(users).save(user);
    }

    @Test
    void upgradeToChirpyRed_unknownUser_isNotFound() {
        var id = UUID.randomUUID();
        when(users.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> userService.upgradeToChirpyRed(id)).isInstanceOf(NotFoundException.class);
    }
}
