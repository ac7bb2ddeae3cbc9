package com.chirpy.api.security;

import com.chirpy.api.error.ExpiredTokenException;
import com.chirpy.api.error.InvalidTokenException;
import com.chirpy.api.error.MalformedCredentialException;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and validates the short-lived session tokens.
 *
 * <p>Tokens are HS256 signed with the configured secret and carry the user id as
 * the subject. Nothing is stored server side: a token is valid exactly when its
 * signature verifies and its expiry has not passed.
 */
@Service
public class JwtService {

    public static final String ISSUER = "chirpy";

    private static final Base64.Encoder SIGNATURE_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder SIGNATURE_DECODER = Base64.getUrlDecoder();

    private final SecretKey key;
    private final Duration accessTtl;
    private final Clock clock;
    private final JwtParser parser;

    @Autowired
    JwtService(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.accessTtlSeconds:3600}") long accessTtlSeconds,
            Clock clock) {
        this(secret, Duration.ofSeconds(accessTtlSeconds), clock);
    }

    public JwtService(String secret, Duration accessTtl, Clock clock) {
        // hmacShaKeyFor rejects secrets shorter than 256 bits
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.accessTtl = accessTtl;
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(ISSUER)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public String issueAccessToken(UUID userId) {
        return issue(userId, accessTtl);
    }

    /** A negative ttl produces a token that is already expired. */
    public String issue(UUID userId, Duration ttl) {
        Instant now = clock.instant();
        return Jwts.builder()
                .issuer(ISSUER)
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    public UUID validate(String token) {
        requireCanonicalSignature(token);

        String subject;
        try {
            subject = parser.parseSignedClaims(token).getPayload().getSubject();
        } catch (ExpiredJwtException e) {
            throw new ExpiredTokenException("Token expired", e);
        } catch (SignatureException e) {
            throw new InvalidTokenException("Token signature does not match", e);
        } catch (MalformedJwtException | IllegalArgumentException e) {
            throw new MalformedCredentialException("Token is malformed", e);
        } catch (JwtException e) {
            throw new InvalidTokenException("Token rejected: " + e.getMessage(), e);
        }

        if (subject == null) {
            throw new MalformedCredentialException("Token has no subject");
        }
        try {
            return UUID.fromString(subject);
        } catch (IllegalArgumentException e) {
            throw new MalformedCredentialException("Token subject is not a user id", e);
        }
    }

    // The last character of an unpadded HS256 signature carries 2 unused bits; the
    // decoder ignores them, so only the canonical spelling is accepted.
    private static void requireCanonicalSignature(String token) {
        if (token == null) {
            return;
        }
        String signature = token.substring(token.lastIndexOf('.') + 1);
        try {
            String canonical = SIGNATURE_ENCODER.encodeToString(SIGNATURE_DECODER.decode(signature));
            if (!canonical.equals(signature)) {
                throw new InvalidTokenException("Token signature is not canonically encoded");
            }
        } catch (IllegalArgumentException e) {
            throw new MalformedCredentialException("Token signature is not base64url", e);
        }
    }
}
