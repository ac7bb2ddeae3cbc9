package com.chirpy.api.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.time.Instant;
import java.util.UUID;

record LoginRequest(@NotBlank String email, @NotBlank String password) {}
record LoginResponse(UUID id, Instant createdAt, Instant updatedAt, String email,
        @JsonProperty("is_chirpy_red") boolean isChirpyRed,
        String token, String refreshToken) {}
record TokenResponse(String token) {}
