package com.chirpy.api.error;

/** Signature did not verify, or a token lookup found nothing usable. */
public class InvalidTokenException extends AuthException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
