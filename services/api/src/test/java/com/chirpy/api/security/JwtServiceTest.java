package com.chirpy.api.security;

import com.chirpy.api.error.AuthException;
import com.chirpy.api.error.ExpiredTokenException;
import com.chirpy.api.error.InvalidTokenException;
import com.chirpy.api.error.MalformedCredentialException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtServiceTest {

    private static final String SECRET = "test-secret-must-be-at-least-32-bytes!";
    private static final String WRONG_SECRET = "wrong-secret-must-be-at-least-32-bytes";
    private static final String BASE64URL =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-_";

    private JwtService jwtService;

    @BeforeEach
    void setUp() {
        jwtService = new JwtService(SECRET, Duration.ofHours(1), Clock.systemUTC());
    }

    @Test
    void issueAndValidate_roundTrip() {
        var userId = UUID.randomUUID();
        String token = jwtService.issue(userId, Duration.ofMinutes(10));

        assertThat(token).isNotBlank();
        assertThat(jwtService.validate(token)).isEqualTo(userId);
    }

    @Test
    void issuedToken_carriesChirpyClaims() {
        var userId = UUID.randomUUID();
        String token = jwtService.issueAccessToken(userId);

        var claims = Jwts.parser()
                .verifyWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .build()
                .parseSignedClaims(token)
                .getPayload();
        assertThat(claims.getIssuer()).isEqualTo("chirpy");
        assertThat(claims.getSubject()).isEqualTo(userId.toString());
        assertThat(claims.getExpiration().getTime() - claims.getIssuedAt().getTime())
                .isEqualTo(Duration.ofHours(1).toMillis());
    }

    @Test
    void validate_wrongSecret_fails() {
        String token = jwtService.issue(UUID.randomUUID(), Duration.ofMinutes(10));
        var other = new JwtService(WRONG_SECRET, Duration.ofHours(1), Clock.systemUTC());

        assertThatThrownBy(() -> other.validate(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void validate_negativeTtl_isExpired() {
        String token = jwtService.issue(UUID.randomUUID(), Duration.ofSeconds(-1));

        assertThatThrownBy(() -> jwtService.validate(token)).isInstanceOf(ExpiredTokenException.class);
    }

    @Test
    void validate_afterExpiry_fails() {
        var issuedAt = Instant.parse("2024-05-01T10:00:00Z");
        var issuer = new JwtService(SECRET, Duration.ofHours(1), Clock.fixed(issuedAt, ZoneOffset.UTC));
        var later = new JwtService(SECRET, Duration.ofHours(1),
                Clock.fixed(issuedAt.plus(Duration.ofMinutes(61)), ZoneOffset.UTC));
        var userId = UUID.randomUUID();
        String token = issuer.issueAccessToken(userId);

        assertThat(issuer.validate(token)).isEqualTo(userId);
        assertThatThrownBy(() -> later.validate(token)).isInstanceOf(ExpiredTokenException.class);
    }

    @Test
    void validate_everySingleCharacterMutation_fails() {
        String token = jwtService.issue(UUID.randomUUID(), Duration.ofMinutes(10));
        var accepted = new ArrayList<String>();

        for (int i = 0; i < token.length(); i++) {
            char original = token.charAt(i);
            if (original == '.') {
                continue;
            }
            for (char replacement : BASE64URL.toCharArray()) {
                if (replacement == original) {
                    continue;
                }
                String tampered = token.substring(0, i) + replacement + token.substring(i + 1);
                try {
                    jwtService.validate(tampered);
                    accepted.add("idx=" + i + " " + original + "->" + replacement);
                } catch (AuthException expected) {
                    // rejected
                }
            }
        }

        assertThat(accepted).isEmpty();
    }

    @Test
    void validate_nonCanonicalSignatureEnding_fails() {
        String token = jwtService.issue(UUID.randomUUID(), Duration.ofMinutes(10));
        char last = token.charAt(token.length() - 1);
        // same high 4 bits, different unused low 2 bits
        int index = BASE64URL.indexOf(last);
        char sibling = BASE64URL.charAt((index & ~3) | ((index + 1) & 3));
        String tampered = token.substring(0, token.length() - 1) + sibling;

        assertThatThrownBy(() -> jwtService.validate(tampered)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void validate_garbage_isMalformed() {
        assertThatThrownBy(() -> jwtService.validate("not-a-jwt")).isInstanceOf(MalformedCredentialException.class);
        assertThatThrownBy(() -> jwtService.validate("")).isInstanceOf(MalformedCredentialException.class);
    }

    @Test
    void validate_subjectNotAUuid_isMalformed() {
        var now = Instant.now();
        String token = Jwts.builder()
                .issuer("chirpy")
                .subject("alice")
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusSeconds(60)))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), Jwts.SIG.HS256)
                .compact();

        assertThatThrownBy(() -> jwtService.validate(token)).isInstanceOf(MalformedCredentialException.class);
    }

    @Test
    void validate_foreignIssuer_fails() {
        var now = Instant.now();
        String token = Jwts.builder()
                .issuer("someone-else")
                .subject(UUID.randomUUID().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusSeconds(60)))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), Jwts.SIG.HS256)
                .compact();

        assertThatThrownBy(() -> jwtService.validate(token)).isInstanceOf(InvalidTokenException.class);
    }
}
