package com.chirpy.api.error;

import org.springframework.http.HttpStatus;

public class PasswordHashingException extends ApiException {

    public PasswordHashingException(Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to hash password", cause);
    }
}
