package com.chirpy.api.security;

import com.chirpy.api.error.BadRequestException;
import com.chirpy.api.error.InvalidCredentialsException;
import com.chirpy.api.error.PasswordHashingException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Salted, deliberately slow password hashing backed by the application's
 * {@link PasswordEncoder} (BCrypt).
 *
 * <p>BCrypt only reads the first {@value #MAX_PASSWORD_BYTES} bytes of its input,
 * so longer passwords are refused here instead of being silently truncated.
 */
@Component
public class PasswordHasher {

    public static final int MAX_PASSWORD_BYTES = 72;

    private final PasswordEncoder encoder;

    public PasswordHasher(PasswordEncoder encoder) {
        this.encoder = encoder;
    }

    public String hash(String plaintext) {
        if (tooLong(plaintext)) {
            throw new BadRequestException("Password must be at most " + MAX_PASSWORD_BYTES + " bytes");
        }
        try {
            return encoder.encode(plaintext);
        } catch (RuntimeException e) {
            throw new PasswordHashingException(e);
        }
    }

    /**
     * Throws {@link InvalidCredentialsException} when the password does not match,
     * whether because it is wrong, too long, or the stored hash is unreadable.
     */
    public void verify(String hash, String plaintext) {
        boolean matches;
        try {
            matches = hash != null && !tooLong(plaintext) && encoder.matches(plaintext, hash);
        } catch (RuntimeException e) {
            matches = false;
        }
        if (!matches) {
            throw new InvalidCredentialsException();
        }
    }

    private static boolean tooLong(String plaintext) {
        return plaintext != null && plaintext.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }
}
