package com.compass.evidencecollector.exception;

import java.io.Serial;

/**
 * A dedicated runtime exception thrown when a batch of SQS messages cannot be handed to the
 * workers at all, signaling that the whole batch should be redelivered.
 * NOTE: This is an internal exception and should NOT be handled by the GlobalExceptionHandler.
 */
public class MessageProcessingFailedException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 3546738330082948966L;

    public MessageProcessingFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
