package com.chirpy.api.auth;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "refresh_tokens")
class RefreshToken {

    @Id
    @Column(length = 64)
    String token;

    @Column(nullable = false)
    Instant createdAt;

    @Column(nullable = false)
    Instant updatedAt;

    @Column(nullable = false)
    UUID userId;

    @Column(nullable = false)
    Instant expiresAt;

    Instant revokedAt;

    protected RefreshToken() {}

    RefreshToken(String token, UUID userId, Instant now, Instant expiresAt) {
        this.token = token;
        this.userId = userId;
        this.createdAt = now;
        this.updatedAt = now;
        this.expiresAt = expiresAt;
    }

    boolean isUsableAt(Instant now) {
        return revokedAt == null && now.isBefore(expiresAt);
    }

    void revoke(Instant now) {
        this.revokedAt = now;
        this.updatedAt = now;
    }
}
