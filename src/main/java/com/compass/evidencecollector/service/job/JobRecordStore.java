package com.compass.evidencecollector.service.job;

import com.compass.evidencecollector.model.JobStep;
import com.compass.evidencecollector.model.evaluation.EvidenceCollectionResult;
import com.compass.evidencecollector.model.evaluation.JobReference;

/**
 * Durable job state, written only by the worker currently processing the job's message.
 * Every write is an overwrite keyed by job id, so repeating any of them is safe.
 * <p>
 * Terminal writes are fenced by the attempt number handed out by {@link #markRunning}: once a
 * redelivery has started a newer attempt, a late write from an older worker is refused.
 */
public interface JobRecordStore {

    /**
     * Moves the job to {@code RUNNING}, creating the record if the message arrived without one,
     * and increments its attempt count. Verifies that the evidence exists and belongs to the
     * control and assessment named by the message.
     *
     * @return the attempt number now owned by the caller
     * @throws com.compass.evidencecollector.exception.MalformedMessageException if the message does not fit the stored records
     * @throws com.compass.evidencecollector.exception.JobRecordStoreException   if the store is unavailable
     */
    int markRunning(JobReference job, String executorId);

    /**
     * Records the result and moves the job to {@code SUCCEEDED}.
     *
     * @return false if {@code attempt} is no longer the current attempt, or the job's current state
     * does not allow the transition; nothing was written
     * @throws com.compass.evidencecollector.exception.JobRecordStoreException if the store is unavailable
     */
    boolean markSucceeded(String jobId, int attempt, EvidenceCollectionResult result);

    /**
     * Records the failing step and reason and moves the job to {@code FAILED}.
     *
     * @return false if there is no such job, {@code attempt} is no longer the current attempt, or
     * its current state does not allow the transition
     * @throws com.compass.evidencecollector.exception.JobRecordStoreException if the store is unavailable
     */
    boolean markFailed(String jobId, int attempt, JobStep step, String reason, String errorMessage);
}
