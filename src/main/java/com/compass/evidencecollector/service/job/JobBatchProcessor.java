package com.compass.evidencecollector.service.job;

import com.compass.evidencecollector.config.EvidenceCollectionProperties;
import com.compass.evidencecollector.model.JobStep;
import com.compass.evidencecollector.model.PipelineStage;
import com.compass.evidencecollector.model.evaluation.JobOutcome;
import com.compass.evidencecollector.model.evaluation.QueuedJobMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans a batch of job messages out to the worker pool and collects one {@link JobOutcome} per
 * message. A failure or timeout of one message never affects the outcome of the others.
 * <p>
 * A timed-out pipeline is not interrupted; it keeps its worker thread until its own AWS call
 * timeouts end it, and any write it makes afterwards is refused as a stale attempt.
 */
@Slf4j
@Service
public class JobBatchProcessor {

    private final EvidenceCollectionPipeline pipeline;
    private final AsyncTaskExecutor taskExecutor;
    private final Duration workerTimeout;

    public JobBatchProcessor(EvidenceCollectionPipeline pipeline,
                             @Qualifier("jobWorkerExecutor") AsyncTaskExecutor taskExecutor,
                             EvidenceCollectionProperties properties) {
        this.pipeline = pipeline;
        this.taskExecutor = taskExecutor;
        this.workerTimeout = properties.getQueue().getWorkerTimeout();
    }

    /**
     * Processes every message of the batch concurrently.
     *
     * @return the outcomes, in the same order as the input messages
     */
    public List<JobOutcome> processBatch(final List<QueuedJobMessage> messages) {
        final List<CompletableFuture<JobOutcome>> futures = new ArrayList<>(messages.size());
        for (final QueuedJobMessage message : messages) {
            futures.add(submit(message));
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private CompletableFuture<JobOutcome> submit(final QueuedJobMessage message) {
        CompletableFuture<JobOutcome> future;
        try {
            future = CompletableFuture.supplyAsync(() -> pipeline.process(message), taskExecutor)
                                      .orTimeout(workerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final RuntimeException e) {
            // Rejected by the pool; the message will be redelivered.
            future = CompletableFuture.failedFuture(e);
        }
        return future.exceptionally(ex -> toFailure(message, ex));
    }

    private JobOutcome toFailure(final QueuedJobMessage message, final Throwable ex) {
        final Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TimeoutException) {
            log.error("[msg={}] Worker did not finish within {}. Leaving the message for redelivery.",
                    message.messageId(), workerTimeout);
            return JobOutcome.failure(message.messageId(), null, true, PipelineStage.RECEIVED, null,
                                      "WORKER_TIMEOUT");
        }
        log.error("[msg={}] Worker failed unexpectedly. Leaving the message for redelivery.",
                message.messageId(), cause);
        return JobOutcome.failure(message.messageId(), null, true, PipelineStage.RECEIVED,
                                  JobStep.MESSAGE_PARSING, "WORKER_ERROR");
    }
}
