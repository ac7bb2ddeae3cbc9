package com.chirpy.api.auth;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Opaque refresh tokens: 32 random bytes, hex encoded. Uniqueness is left to the
 * primary key of {@code refresh_tokens}.
 */
final class RefreshTokenGenerator {
    static final int TOKEN_BYTES = 32;

    private static final SecureRandom RNG = new SecureRandom();

    static String newToken() {
        var b = new byte[TOKEN_BYTES];
        RNG.nextBytes(b);
        return HexFormat.of().formatHex(b);
    }

    private RefreshTokenGenerator() {}
}
