package com.chirpy.api.users;

import com.chirpy.api.error.ConflictException;
import com.chirpy.api.error.NotFoundException;
import com.chirpy.api.security.PasswordHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final AppUserRepository users;
    private final PasswordHasher passwordHasher;
    private final Clock clock;

    UserService(AppUserRepository users, PasswordHasher passwordHasher, Clock clock) {
        this.users = users;
        this.passwordHasher = passwordHasher;
        this.clock = clock;
    }

    @Transactional
    public AppUser register(String email, String password) {
        if (users.existsByEmail(email)) {
            throw new ConflictException("Email already in use");
        }
        var user = saveUnique(new AppUser(email, passwordHasher.hash(password), clock.instant()));
        log.info("Registered user {}", user.getId());
        return user;
    }

    @Transactional
    public AppUser updateCredentials(UUID userId, String email, String password) {
        var user = users.findById(userId).orElseThrow(() -> new NotFoundException("User not found"));
        users.findByEmail(email)
                .filter(other -> !other.getId().equals(userId))
                .ifPresent(other -> {
                    throw new ConflictException("Email already in use");
                });
        user.changeCredentials(email, passwordHasher.hash(password), clock.instant());
        return saveUnique(user);
    }

    @Transactional
    public void upgradeToChirpyRed(UUID userId) {
        var user = users.findById(userId).orElseThrow(() -> new NotFoundException("User not found"));
        user.upgradeToChirpyRed(clock.instant());
        users.save(user);
        log.info("User {} upgraded to Chirpy Red", userId);
    }

    // The email lookups above can race a concurrent write; the unique constraint decides.
    private AppUser saveUnique(AppUser user) {
        try {
            return users.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            log.info("Email {} taken by a concurrent request", user.getEmail());
            throw new ConflictException("Email already in use");
        }
    }

    /** Removes every user; chirps and refresh tokens go with them through the foreign keys. */
    @Transactional
    public void deleteAll() {
        users.deleteAllInBatch();
    }
}
