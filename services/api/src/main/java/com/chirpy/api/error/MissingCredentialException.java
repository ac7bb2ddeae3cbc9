package com.chirpy.api.error;

public class MissingCredentialException extends AuthException {

    public MissingCredentialException(String message) {
        super(message);
    }
}
