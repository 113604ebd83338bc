package com.compass.evidencecollector.exception;

import com.compass.evidencecollector.model.JobStep;
import lombok.Getter;

import java.io.Serial;

/**
 * A base exception for errors that occur during the evidence collection pipeline.
 * Every failure is tagged with the step that produced it and whether redelivering the
 * job message could succeed.
 */
@Getter
public abstract class EvidenceCollectionException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 6201148829145273304L;

    private final JobStep step;
    private final boolean retryable;

    protected EvidenceCollectionException(JobStep step, boolean retryable, String message) {
        super(message);
        this.step = step;
        this.retryable = retryable;
    }

    protected EvidenceCollectionException(JobStep step, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        this.step = step;
        this.retryable = retryable;
    }

    /**
     * A short machine-readable reason recorded on the failed job.
     */
    public abstract String getReason();
}
