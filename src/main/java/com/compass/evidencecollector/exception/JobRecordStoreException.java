package com.compass.evidencecollector.exception;

import com.compass.evidencecollector.model.JobStep;

import java.io.Serial;

/**
 * Thrown when the job record store cannot persist a state change. The outcome of the job is
 * not durable, so the message must be redelivered.
 */
public class JobRecordStoreException extends EvidenceCollectionException {
    @Serial
    private static final long serialVersionUID = 5518379426018803527L;

    public JobRecordStoreException(String message, Throwable cause) {
        super(JobStep.PERSISTENCE, true, message, cause);
    }

    @Override
    public String getReason() {
        return "STORE_ERROR";
    }
}
