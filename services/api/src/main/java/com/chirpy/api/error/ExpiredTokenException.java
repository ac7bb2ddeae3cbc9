package com.chirpy.api.error;

public class ExpiredTokenException extends AuthException {

    public ExpiredTokenException(String message) {
        super(message);
    }

    public ExpiredTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
