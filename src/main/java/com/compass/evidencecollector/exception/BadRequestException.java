package com.compass.evidencecollector.exception;

import java.io.Serial;

/**
 * Exception indicating the request is invalid for the referenced records (HTTP 400).
 */
public class BadRequestException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = -2296478843046313510L;

    public BadRequestException(String message) {
        super(message);
    }
}
