package com.chirpy.api.chirps;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "chirps")
class Chirp {

    @Id
    @GeneratedValue
    UUID id;

    @Column(nullable = false)
    Instant createdAt;

    @Column(nullable = false)
    Instant updatedAt;

    @Column(nullable = false)
    String body;

    @Column(nullable = false)
    UUID userId;

    protected Chirp() {}

    Chirp(String body, UUID userId, Instant now) {
        this.body = body;
        this.userId = userId;
        this.createdAt = now;
        this.updatedAt = now;
    }
}
