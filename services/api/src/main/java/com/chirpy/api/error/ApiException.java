package com.chirpy.api.error;

import org.springframework.http.HttpStatus;

/**
 * Base of every failure that maps onto an HTTP status. The message is what the
 * client sees, so it must never carry secrets.
 */
public class ApiException extends RuntimeException {

    private final HttpStatus status;

    public ApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public ApiException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
