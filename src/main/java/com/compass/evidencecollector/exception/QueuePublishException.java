package com.compass.evidencecollector.exception;

import java.io.Serial;

/**
 * Thrown when a job message could not be published to the job queue.
 */
public class QueuePublishException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -6045187324079981120L;

    public QueuePublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
