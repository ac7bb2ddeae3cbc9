package com.chirpy.api.chirps;

import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

record CreateChirpRequest(@NotNull String body) {}

record ChirpResponse(UUID id, Instant createdAt, Instant updatedAt, String body, UUID userId) {
    static ChirpResponse of(Chirp c) {
        return new ChirpResponse(c.id, c.createdAt, c.updatedAt, c.body, c.userId);
    }
}
