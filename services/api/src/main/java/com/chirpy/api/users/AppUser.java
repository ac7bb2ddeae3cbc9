package com.chirpy.api.users;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "users")
public class AppUser {

    @Id
    @GeneratedValue
    UUID id;

    @Column(nullable = false)
    Instant createdAt;

    @Column(nullable = false)
    Instant updatedAt;

    @Column(nullable = false, unique = true)
    String email;

    @Column(nullable = false)
    String hashedPassword;

    @Column(name = "is_chirpy_red", nullable = false)
    boolean chirpyRed;

    protected AppUser() {}

    public AppUser(String email, String hashedPassword, Instant now) {
        this.email = email;
        this.hashedPassword = hashedPassword;
        this.createdAt = now;
        this.updatedAt = now;
        this.chirpyRed = false;
    }

    public void changeCredentials(String email, String hashedPassword, Instant now) {
        this.email = email;
        this.hashedPassword = hashedPassword;
        this.updatedAt = now;
    }

    public void upgradeToChirpyRed(Instant now) {
        this.chirpyRed = true;
        this.updatedAt = now;
    }

    public UUID getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public String getEmail() {
        return email;
    }

    public String getHashedPassword() {
        return hashedPassword;
    }

    public boolean isChirpyRed() {
        return chirpyRed;
    }
}
