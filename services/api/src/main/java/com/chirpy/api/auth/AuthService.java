package com.chirpy.api.auth;

import com.chirpy.api.error.ExpiredTokenException;
import com.chirpy.api.error.InvalidCredentialsException;
import com.chirpy.api.error.InvalidTokenException;
import com.chirpy.api.security.JwtService;
import com.chirpy.api.security.PasswordHasher;
import com.chirpy.api.users.AppUserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final AppUserRepository users;
    private final RefreshTokenRepository refreshTokens;
    private final PasswordHasher passwordHasher;
    private final JwtService jwtService;
    private final Clock clock;
    private final Duration refreshTtl;

    AuthService(AppUserRepository users, RefreshTokenRepository refreshTokens, PasswordHasher passwordHasher,
            JwtService jwtService, Clock clock, @Value("${security.refresh.ttlDays:60}") long refreshTtlDays) {
        this.users = users;
        this.refreshTokens = refreshTokens;
        this.passwordHasher = passwordHasher;
        this.jwtService = jwtService;
        this.clock = clock;
        this.refreshTtl = Duration.ofDays(refreshTtlDays);
    }

    @Transactional
    public LoginResponse login(LoginRequest req) {
        var user = users.findByEmail(req.email()).orElseThrow(InvalidCredentialsException::new);
        passwordHasher.verify(user.getHashedPassword(), req.password());

        var access = jwtService.issueAccessToken(user.getId());
        var now = clock.instant();
        var refresh = RefreshTokenGenerator.newToken();
        refreshTokens.save(new RefreshToken(refresh, user.getId(), now, now.plus(refreshTtl)));
        log.info("User {} logged in", user.getId());

        return new LoginResponse(user.getId(), user.getCreatedAt(), user.getUpdatedAt(), user.getEmail(),
                user.isChirpyRed(), access, refresh);
    }

    @Transactional(readOnly = true)
    public TokenResponse refresh(String rawRefreshToken) {
        var rt = refreshTokens.findById(rawRefreshToken)
                .orElseThrow(() -> new InvalidTokenException("Unknown refresh token"));
        var now = clock.instant();
        if (rt.revokedAt != null) {
            throw new InvalidTokenException("Refresh token revoked at " + rt.revokedAt);
        }
        if (!rt.isUsableAt(now)) {
            throw new ExpiredTokenException("Refresh token expired at " + rt.expiresAt);
        }
        return new TokenResponse(jwtService.issueAccessToken(rt.userId));
    }

    /** Revoking an unknown or already revoked token is a no-op. */
    @Transactional
    public void revoke(String rawRefreshToken) {
        refreshTokens.findById(rawRefreshToken)
                .filter(rt -> rt.revokedAt == null)
                .ifPresent(rt -> {
                    rt.revoke(clock.instant());
                    refreshTokens.save(rt);
                    log.info("Revoked a refresh token of user {}", rt.userId);
                });
    }
}
