package com.chirpy.api.security;

import com.chirpy.api.error.MalformedCredentialException;
import com.chirpy.api.error.MissingCredentialException;
import org.springframework.http.HttpHeaders;

/**
 * Reads credentials out of the {@code Authorization} header.
 */
public final class CredentialExtractor {

    /** {@code Authorization: Bearer <token>}; returns the second whitespace-separated field. */
    public static String extractBearer(HttpHeaders headers) {
        String[] fields = fields(headers);
        if (fields.length < 2) {
            throw new MalformedCredentialException("Authorization header has no token after the scheme");
        }
        return fields[1];
    }

    /** Returns the last whitespace-separated field, so both {@code ApiKey <key>} and a bare key work. */
    public static String extractApiKey(HttpHeaders headers) {
        String[] fields = fields(headers);
        return fields[fields.length - 1];
    }

    private static String[] fields(HttpHeaders headers) {
        String value = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (value == null || value.isBlank()) {
            throw new MissingCredentialException("Authorization header is missing");
        }
        return value.trim().split("\\s+");
    }

    private CredentialExtractor() {}
}
