package com.compass.evidencecollector.exception;

import com.compass.evidencecollector.model.JobStep;

import java.io.Serial;

/**
 * Thrown when a job message lacks required fields or references records that do not fit
 * together. Redelivery can never fix such a message, so it is never retried.
 */
public class MalformedMessageException extends EvidenceCollectionException {
    @Serial
    private static final long serialVersionUID = -1538830211953612937L;

    public MalformedMessageException(String message) {
        super(JobStep.MESSAGE_PARSING, false, message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(JobStep.MESSAGE_PARSING, false, message, cause);
    }

    @Override
    public String getReason() {
        return "MALFORMED_MESSAGE";
    }
}
