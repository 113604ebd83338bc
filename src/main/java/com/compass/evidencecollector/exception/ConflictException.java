package com.compass.evidencecollector.exception;

import java.io.Serial;

/**
 * Exception indicating the request conflicts with the current state of a resource (HTTP 409).
 */
public class ConflictException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 1475820384468713203L;

    public ConflictException(String message) {
        super(message);
    }
}
