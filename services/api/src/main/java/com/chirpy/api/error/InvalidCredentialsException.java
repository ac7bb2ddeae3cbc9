package com.chirpy.api.error;

public class InvalidCredentialsException extends AuthException {

    public InvalidCredentialsException() {
        super("Incorrect email or password");
    }
}
