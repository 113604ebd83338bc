package com.compass.evidencecollector.model.evaluation;

import com.compass.evidencecollector.model.JobStep;
import com.compass.evidencecollector.model.PipelineStage;

/**
 * The per-message result of processing, used to report back to the queue.
 */
public record JobOutcome(String messageId,
                         String jobId,
                         Result result,
                         PipelineStage stageReached,
                         JobStep failedStep,
                         String reason) {

    public enum Result {
        /**
         * The result is durably recorded; the message can be deleted.
         */
        SUCCESS,
        /**
         * The attempt failed; leave the message for queue-level redelivery.
         */
        RETRYABLE_FAILURE,
        /**
         * Redelivery can never succeed; route the message to the dead-letter queue.
         */
        PERMANENT_FAILURE
    }

    public static JobOutcome success(final String messageId, final String jobId) {
        return new JobOutcome(messageId, jobId, Result.SUCCESS, PipelineStage.PERSISTED, null, null);
    }

    public static JobOutcome failure(final String messageId, final String jobId, final boolean retryable,
                                     final PipelineStage stageReached, final JobStep failedStep, final String reason) {
        return new JobOutcome(messageId, jobId, retryable ? Result.RETRYABLE_FAILURE : Result.PERMANENT_FAILURE,
                              stageReached, failedStep, reason);
    }

    public boolean isSuccess() {
        return result == Result.SUCCESS;
    }
}
