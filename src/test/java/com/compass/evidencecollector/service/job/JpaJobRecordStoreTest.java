package com.compass.evidencecollector.service.job;

import com.compass.evidencecollector.common.json.jackson.JacksonJsonSerializer;
import com.compass.evidencecollector.exception.MalformedMessageException;
import com.compass.evidencecollector.model.AggregateStatus;
import com.compass.evidencecollector.model.Evidence;
import com.compass.evidencecollector.model.EvidenceType;
import com.compass.evidencecollector.model.JobExecution;
import com.compass.evidencecollector.model.JobStatus;
import com.compass.evidencecollector.model.JobStep;
import com.compass.evidencecollector.model.PipelineStage;
import com.compass.evidencecollector.model.evaluation.EvidenceCollectionResult;
import com.compass.evidencecollector.model.evaluation.JobReference;
import com.compass.evidencecollector.model.evaluation.RuleSelector;
import com.compass.evidencecollector.model.evaluation.ScanMetadata;
import com.compass.evidencecollector.repository.EvidenceRepository;
import com.compass.evidencecollector.repository.JobExecutionRepository;
import com.compass.evidencecollector.service.aggregation.ResultAggregator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs without a test transaction: the store commits each write in its own transaction.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaJobRecordStoreTest {

    private static final String ACCOUNT = "123456789012";

    @Autowired
    private JobExecutionRepository jobExecutionRepository;
    @Autowired
    private EvidenceRepository evidenceRepository;
    @Autowired
    private PlatformTransactionManager transactionManager;

    private JpaJobRecordStore store;
    private final ResultAggregator aggregator = new ResultAggregator();

    @BeforeEach
    void setUp() {
        store = new JpaJobRecordStore(jobExecutionRepository, evidenceRepository, transactionManager,
                                      new JacksonJsonSerializer(new ObjectMapper()),
                                      Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC));
        Evidence evidence = new Evidence();
        evidence.setId("e-1");
        evidence.setControlId("c-1");
        evidence.setAssessmentId("a-1");
        evidence.setTitle("ACM certificates");
        evidence.setEvidenceType(EvidenceType.AUTOMATED_COLLECTION);
        evidence.setAwsAccountId(ACCOUNT);
        evidence.setJobTemplateId("t-1");
        evidenceRepository.save(evidence);
    }

    @AfterEach
    void tearDown() {
        jobExecutionRepository.deleteAll();
        evidenceRepository.deleteAll();
    }

    private static JobReference job(String jobId) {
        return new JobReference(jobId, "a-1", "c-1", "e-1", ACCOUNT, "t-1");
    }

    private EvidenceCollectionResult emptyResult() {
        return aggregator.buildResult(List.of(), new ScanMetadata("t-1", "ca-central-1", List.of("securityhub-"),
                List.of(new RuleSelector("securityhub-", "https://docs")), "arn"));
    }

    @Test
    @DisplayName("markRunning creates the record and counts attempts across redeliveries")
    void markRunningCountsAttempts() {
        assertThat(store.markRunning(job("job-1"), "worker-a")).isEqualTo(1);
        assertThat(store.markRunning(job("job-1"), "worker-b")).isEqualTo(2);

        JobExecution execution = jobExecutionRepository.findById("job-1").orElseThrow();
        assertThat(execution.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(execution.getCurrentStage()).isEqualTo(PipelineStage.RECEIVED);
        assertThat(execution.getAttemptCount()).isEqualTo(2);
        assertThat(execution.getExecutorId()).isEqualTo("worker-b");
    }

    @Test
    @DisplayName("Evidence that belongs to another control is rejected as malformed")
    void rejectsEvidenceControlMismatch() {
        JobReference wrongControl = new JobReference("job-1", "a-1", "c-other", "e-1", ACCOUNT, "t-1");

        assertThatThrownBy(() -> store.markRunning(wrongControl, "worker"))
                .isInstanceOf(MalformedMessageException.class);
        assertThat(jobExecutionRepository.findById("job-1")).isEmpty();
    }

    @Test
    void rejectsUnknownEvidence() {
        JobReference unknown = new JobReference("job-1", "a-1", "c-1", "e-missing", ACCOUNT, "t-1");

        assertThatThrownBy(() -> store.markRunning(unknown, "worker"))
                .isInstanceOf(MalformedMessageException.class);
    }

    @Test
    @DisplayName("Success stores the result and updates the evidence status")
    void markSucceeded() {
        int attempt = store.markRunning(job("job-1"), "worker");

        assertThat(store.markSucceeded("job-1", attempt, emptyResult())).isTrue();

        JobExecution execution = jobExecutionRepository.findById("job-1").orElseThrow();
        assertThat(execution.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(execution.getCurrentStage()).isEqualTo(PipelineStage.PERSISTED);
        assertThat(execution.getAggregateStatus()).isEqualTo(AggregateStatus.INSUFFICIENT_DATA);
        assertThat(execution.getResultJson()).contains("\"insufficient_data\"");
        Evidence evidence = evidenceRepository.findById("e-1").orElseThrow();
        assertThat(evidence.getCollectionStatus()).isEqualTo(AggregateStatus.INSUFFICIENT_DATA);
        assertThat(evidence.getLatestJobId()).isEqualTo("job-1");
    }

    @Test
    @DisplayName("Failure records the step and marks the evidence as error, not non-compliant")
    void markFailed() {
        int attempt = store.markRunning(job("job-1"), "worker");

        assertThat(store.markFailed("job-1", attempt, JobStep.ROLE_ASSUMPTION, "ASSUME_DENIED", "denied")).isTrue();

        JobExecution execution = jobExecutionRepository.findById("job-1").orElseThrow();
        assertThat(execution.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(execution.getFailedStep()).isEqualTo(JobStep.ROLE_ASSUMPTION);
        assertThat(execution.getFailureReason()).isEqualTo("ASSUME_DENIED");
        assertThat(evidenceRepository.findById("e-1").orElseThrow().getCollectionStatus())
                .isEqualTo(AggregateStatus.ERROR);
    }

    @Test
    @DisplayName("A stale worker cannot overwrite a succeeded job with a failure")
    void staleFailureDoesNotOverwriteSuccess() {
        int attempt = store.markRunning(job("job-1"), "worker");
        store.markSucceeded("job-1", attempt, emptyResult());

        assertThat(store.markFailed("job-1", attempt, JobStep.RULE_EVALUATION, "EVAL_THROTTLED", "late")).isFalse();
        assertThat(jobExecutionRepository.findById("job-1").orElseThrow().getStatus()).isEqualTo(JobStatus.SUCCEEDED);
    }

    @Test
    @DisplayName("A late failure from an older attempt does not block the redelivered attempt's success")
    void lateFailureFromOlderAttemptIsDropped() {
        int first = store.markRunning(job("job-1"), "worker-a");
        int second = store.markRunning(job("job-1"), "worker-b");

        assertThat(store.markFailed("job-1", first, JobStep.RULE_EVALUATION, "EVAL_UNAVAILABLE", "timed out")).isFalse();
        assertThat(store.markSucceeded("job-1", second, emptyResult())).isTrue();

        JobExecution execution = jobExecutionRepository.findById("job-1").orElseThrow();
        assertThat(execution.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(execution.getFailureReason()).isNull();
        assertThat(evidenceRepository.findById("e-1").orElseThrow().getCollectionStatus())
                .isEqualTo(AggregateStatus.INSUFFICIENT_DATA);
    }

    @Test
    void lateSuccessFromOlderAttemptIsDropped() {
        int first = store.markRunning(job("job-1"), "worker-a");
        store.markRunning(job("job-1"), "worker-b");

        assertThat(store.markSucceeded("job-1", first, emptyResult())).isFalse();
        assertThat(jobExecutionRepository.findById("job-1").orElseThrow().getStatus()).isEqualTo(JobStatus.RUNNING);
    }

    @Test
    @DisplayName("A superseded job does not update the evidence status")
    void supersededJobLeavesEvidenceAlone() {
        Evidence evidence = evidenceRepository.findById("e-1").orElseThrow();
        evidence.setLatestJobId("job-newer");
        evidenceRepository.save(evidence);
        int attempt = store.markRunning(job("job-old"), "worker");

        store.markFailed("job-old", attempt, JobStep.ROLE_ASSUMPTION, "ASSUME_DENIED", "denied");

        Evidence reloaded = evidenceRepository.findById("e-1").orElseThrow();
        assertThat(reloaded.getCollectionStatus()).isNull();
        assertThat(reloaded.getLatestJobId()).isEqualTo("job-newer");
    }

    @Test
    void markFailedForUnknownJobReturnsFalse() {
        assertThat(store.markFailed("missing", 1, JobStep.PERSISTENCE, "STORE_ERROR", "x")).isFalse();
    }
}
