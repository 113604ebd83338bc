package com.compass.evidencecollector.exception;

import java.io.Serial;

/**
 * Exception indicating that a requested resource was not found (HTTP 404).
 */
public class NotFoundException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = -3051703506470244006L;

    public NotFoundException(String message) {
        super(message);
    }
}
