package com.chirpy.api.error;

import org.springframework.http.HttpStatus;

/**
 * Any authentication failure. Callers translate all subclasses into a 401 without
 * telling the client which check failed; the subclass and cause are for logs only.
 */
public abstract class AuthException extends ApiException {

    protected AuthException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }

    protected AuthException(String message, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, message, cause);
    }
}
