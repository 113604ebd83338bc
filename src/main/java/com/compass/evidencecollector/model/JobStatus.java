package com.compass.evidencecollector.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Defines the lifecycle states of an automated evidence collection job.
 */
public enum JobStatus {
    /**
     * The job record exists and its message has been published to the job queue.
     */
    QUEUED,
    /**
     * A worker has received the message and is executing the pipeline.
     * Redelivered messages re-enter this state from any other state.
     */
    RUNNING,
    /**
     * The result has been computed and durably recorded.
     */
    SUCCEEDED,
    /**
     * A pipeline step failed; the failing step and reason are recorded on the job.
     */
    FAILED;

    public boolean canTransitionTo(final JobStatus target) {
        return allowedSources(target).contains(this);
    }

    private static Set<JobStatus> allowedSources(final JobStatus target) {
        return switch (target) {
            case QUEUED -> EnumSet.of(FAILED);
            case RUNNING -> EnumSet.allOf(JobStatus.class);
            // Repeating a terminal write for the same outcome is an idempotent overwrite.
            case SUCCEEDED -> EnumSet.of(RUNNING, SUCCEEDED);
            case FAILED -> EnumSet.of(RUNNING, FAILED);
        };
    }
}
