package com.compass.evidencecollector.service.job;

import com.compass.evidencecollector.config.EvidenceCollectionProperties;
import com.compass.evidencecollector.model.JobStep;
import com.compass.evidencecollector.model.PipelineStage;
import com.compass.evidencecollector.model.evaluation.JobOutcome;
import com.compass.evidencecollector.model.evaluation.QueuedJobMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobBatchProcessorTest {

    @Mock
    private EvidenceCollectionPipeline pipeline;

    @Test
    @DisplayName("One failing message does not affect the others in the batch")
    void partialBatchIsolation() {
        QueuedJobMessage first = new QueuedJobMessage("m1", "{}", 1);
        QueuedJobMessage second = new QueuedJobMessage("m2", "{}", 1);
        QueuedJobMessage third = new QueuedJobMessage("m3", "{}", 1);
        when(pipeline.process(first)).thenReturn(JobOutcome.success("m1", "j1"));
        when(pipeline.process(second)).thenReturn(JobOutcome.failure("m2", "j2", true, PipelineStage.RECEIVED,
                                                                     JobStep.ROLE_ASSUMPTION, "ASSUME_DENIED"));
        when(pipeline.process(third)).thenReturn(JobOutcome.success("m3", "j3"));

        JobBatchProcessor processor = new JobBatchProcessor(pipeline, new TaskExecutorAdapter(Runnable::run), new EvidenceCollectionProperties());
        List<JobOutcome> outcomes = processor.processBatch(List.of(first, second, third));

        assertThat(outcomes).extracting(JobOutcome::messageId).containsExactly("m1", "m2", "m3");
        assertThat(outcomes).extracting(JobOutcome::result).containsExactly(
                JobOutcome.Result.SUCCESS, JobOutcome.Result.RETRYABLE_FAILURE, JobOutcome.Result.SUCCESS);
    }

    @Test
    @DisplayName("An unexpected exception becomes a retryable failure for that message only")
    void exceptionBecomesRetryableFailure() {
        QueuedJobMessage first = new QueuedJobMessage("m1", "{}", 1);
        QueuedJobMessage second = new QueuedJobMessage("m2", "{}", 1);
        when(pipeline.process(first)).thenThrow(new IllegalStateException("boom"));
        when(pipeline.process(second)).thenReturn(JobOutcome.success("m2", "j2"));

        JobBatchProcessor processor = new JobBatchProcessor(pipeline, new TaskExecutorAdapter(Runnable::run), new EvidenceCollectionProperties());
        List<JobOutcome> outcomes = processor.processBatch(List.of(first, second));

        assertThat(outcomes.get(0).result()).isEqualTo(JobOutcome.Result.RETRYABLE_FAILURE);
        assertThat(outcomes.get(0).reason()).isEqualTo("WORKER_ERROR");
        assertThat(outcomes.get(1).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("A worker exceeding its timeout is reported as retryable")
    void slowWorkerTimesOut() throws InterruptedException {
        QueuedJobMessage slow = new QueuedJobMessage("m1", "{}", 1);
        when(pipeline.process(slow)).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return JobOutcome.success("m1", "j1");
        });
        EvidenceCollectionProperties properties = new EvidenceCollectionProperties();
        properties.getQueue().setWorkerTimeout(Duration.ofMillis(100));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            JobBatchProcessor processor = new JobBatchProcessor(pipeline, new TaskExecutorAdapter(executor), properties);

            List<JobOutcome> outcomes = processor.processBatch(List.of(slow));

            assertThat(outcomes.get(0).result()).isEqualTo(JobOutcome.Result.RETRYABLE_FAILURE);
            assertThat(outcomes.get(0).reason()).isEqualTo("WORKER_TIMEOUT");
        } finally {
            executor.shutdownNow();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
    }
}
