package com.chirpy.api.users;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.time.Instant;
import java.util.UUID;

record CredentialsRequest(@NotBlank String email, @NotBlank String password) {}

record UserResponse(UUID id, Instant createdAt, Instant updatedAt, String email,
        @JsonProperty("is_chirpy_red") boolean isChirpyRed) {
    static UserResponse of(AppUser u) {
        return new UserResponse(u.getId(), u.getCreatedAt(), u.getUpdatedAt(), u.getEmail(), u.isChirpyRed());
    }
}
