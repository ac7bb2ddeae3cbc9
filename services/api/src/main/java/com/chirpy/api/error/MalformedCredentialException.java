package com.chirpy.api.error;

public class MalformedCredentialException extends AuthException {

    public MalformedCredentialException(String message) {
        super(message);
    }

    public MalformedCredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
