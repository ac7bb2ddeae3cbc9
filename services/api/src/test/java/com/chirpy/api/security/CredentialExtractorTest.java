package com.chirpy.api.security;

import com.chirpy.api.error.MalformedCredentialException;
import com.chirpy.api.error.MissingCredentialException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialExtractorTest {

    private static HttpHeaders authorization(String value) {
        var headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, value);
        return headers;
    }

    @Test
    void extractBearer_returnsToken() {
        assertThat(CredentialExtractor.extractBearer(authorization("Bearer abc123"))).isEqualTo("abc123");
        assertThat(CredentialExtractor.extractBearer(authorization("  Bearer   abc123 "))).isEqualTo("abc123");
    }

    @Test
    void extractBearer_missingHeader_fails() {
        assertThatThrownBy(() -> CredentialExtractor.extractBearer(new HttpHeaders()))
                .isInstanceOf(MissingCredentialException.class);
    }

    @Test
    void extractBearer_schemeOnly_failsWithoutIndexError() {
        assertThatThrownBy(() -> CredentialExtractor.extractBearer(authorization("Bearer")))
                .isInstanceOf(MalformedCredentialException.class);
    }

    @Test
    void extractApiKey_returnsLastField() {
        assertThat(CredentialExtractor.extractApiKey(authorization("ApiKey xyz"))).isEqualTo("xyz");
        assertThat(CredentialExtractor.extractApiKey(authorization("xyz"))).isEqualTo("xyz");
    }

    @Test
    void extractApiKey_emptyValue_fails() {
        assertThatThrownBy(() -> CredentialExtractor.extractApiKey(authorization("")))
                .isInstanceOf(MissingCredentialException.class);
        assertThatThrownBy(() -> CredentialExtractor.extractApiKey(authorization("   ")))
                .isInstanceOf(MissingCredentialException.class);
    }
}
