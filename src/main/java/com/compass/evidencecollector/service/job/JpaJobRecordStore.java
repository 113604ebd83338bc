package com.compass.evidencecollector.service.job;

import com.compass.evidencecollector.common.json.JsonSerializer;
import com.compass.evidencecollector.exception.JobRecordStoreException;
import com.compass.evidencecollector.exception.MalformedMessageException;
import com.compass.evidencecollector.model.AggregateStatus;
import com.compass.evidencecollector.model.Evidence;
import com.compass.evidencecollector.model.JobExecution;
import com.compass.evidencecollector.model.JobStatus;
import com.compass.evidencecollector.model.JobStep;
import com.compass.evidencecollector.model.PipelineStage;
import com.compass.evidencecollector.model.evaluation.EvidenceCollectionResult;
import com.compass.evidencecollector.model.evaluation.JobReference;
import com.compass.evidencecollector.repository.EvidenceRepository;
import com.compass.evidencecollector.repository.JobExecutionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A {@link JobRecordStore} on the relational job and evidence tables.
 * <p>
 * Each method runs in its own transaction so a job's state is committed independently of any
 * caller. The evidence record's collection status is updated in the same transaction as the job,
 * but only by the job the evidence currently points at, so a slow, superseded job can never
 * overwrite a newer job's status.
 */
@Slf4j
@Service
public class JpaJobRecordStore implements JobRecordStore {

    private final JobExecutionRepository jobExecutionRepository;
    private final EvidenceRepository evidenceRepository;
    private final TransactionTemplate transactionTemplate;
    private final JsonSerializer jsonSerializer;
    private final Clock clock;

    public JpaJobRecordStore(JobExecutionRepository jobExecutionRepository,
                             EvidenceRepository evidenceRepository,
                             PlatformTransactionManager transactionManager,
                             JsonSerializer jsonSerializer,
                             Clock clock) {
        this.jobExecutionRepository = jobExecutionRepository;
        this.evidenceRepository = evidenceRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.jsonSerializer = jsonSerializer;
        this.clock = clock;
    }

    @Override
    public int markRunning(final JobReference job, final String executorId) {
        return inTransaction("mark running", job.jobId(), () -> {
            final Evidence evidence = evidenceRepository.findById(job.evidenceId()).orElseThrow(
                    () -> new MalformedMessageException("Evidence " + job.evidenceId() + " does not exist"));
            if (!Objects.equals(evidence.getControlId(), job.controlId())
                    || !Objects.equals(evidence.getAssessmentId(), job.assessmentId())) {
                throw new MalformedMessageException(String.format(
                        "Evidence %s does not belong to control %s in assessment %s",
                        job.evidenceId(), job.controlId(), job.assessmentId()));
            }

            final JobExecution execution = jobExecutionRepository.findById(job.jobId())
                                                                 .orElseGet(() -> newExecution(job));
            if (!Objects.equals(execution.getEvidenceId(), job.evidenceId())
                    || !Objects.equals(execution.getTargetAccountId(), job.targetAccountId())
                    || !Objects.equals(execution.getJobTemplateId(), job.jobTemplateId())) {
                throw new MalformedMessageException(String.format(
                        "Job %s already exists for a different evidence, account or template", job.jobId()));
            }

            execution.setStatus(JobStatus.RUNNING);
            execution.setCurrentStage(PipelineStage.RECEIVED);
            execution.setAttemptCount(execution.getAttemptCount() + 1);
            execution.setExecutorId(executorId);
            execution.setStartedAt(now());
            execution.setCompletedAt(null);
            execution.setFailedStep(null);
            execution.setFailureReason(null);
            execution.setErrorMessage(null);
            jobExecutionRepository.save(execution);
            log.info("Job {} is RUNNING (attempt {}, executor {})", job.jobId(), execution.getAttemptCount(), executorId);
            return execution.getAttemptCount();
        });
    }

    @Override
    public boolean markSucceeded(final String jobId, final int attempt, final EvidenceCollectionResult result) {
        final String resultJson = jsonSerializer.serialize(result);
        return inTransaction("mark succeeded", jobId, () -> {
            final JobExecution execution = jobExecutionRepository.findById(jobId).orElse(null);
            if (execution == null) {
                throw new JobRecordStoreException("Job record " + jobId + " disappeared before its result was saved", null);
            }
            if (isStale(execution, attempt)) {
                return false;
            }
            if (!execution.getStatus().canTransitionTo(JobStatus.SUCCEEDED)) {
                log.warn("Job {} is {}; not recording a SUCCEEDED result over it.", jobId, execution.getStatus());
                return false;
            }

            execution.setStatus(JobStatus.SUCCEEDED);
            execution.setCurrentStage(PipelineStage.PERSISTED);
            execution.setAggregateStatus(result.aggregateStatus());
            execution.setResultJson(resultJson);
            execution.setCompletedAt(now());
            execution.setFailedStep(null);
            execution.setFailureReason(null);
            execution.setErrorMessage(null);
            jobExecutionRepository.save(execution);

            updateEvidenceStatus(execution, result.aggregateStatus());
            log.info("Job {} SUCCEEDED with status {}", jobId, result.aggregateStatus().getValue());
            return true;
        });
    }

    @Override
    public boolean markFailed(final String jobId, final int attempt, final JobStep step, final String reason,
                              final String errorMessage) {
        return inTransaction("mark failed", jobId, () -> {
            final JobExecution execution = jobExecutionRepository.findById(jobId).orElse(null);
            if (execution == null) {
                log.error("Cannot fail job: JobExecution with ID {} not found.", jobId);
                return false;
            }
            if (isStale(execution, attempt)) {
                return false;
            }
            if (!execution.getStatus().canTransitionTo(JobStatus.FAILED)) {
                log.warn("Job {} is {}; not recording a FAILED outcome over it.", jobId, execution.getStatus());
                return false;
            }

            execution.setStatus(JobStatus.FAILED);
            execution.setCurrentStage(PipelineStage.FAILED);
            execution.setAggregateStatus(AggregateStatus.ERROR);
            execution.setFailedStep(step);
            execution.setFailureReason(reason);
            execution.setErrorMessage(errorMessage);
            execution.setCompletedAt(now());
            jobExecutionRepository.save(execution);

            updateEvidenceStatus(execution, AggregateStatus.ERROR);
            log.error("Marked job {} as FAILED at step {} ({}): {}", jobId, step, reason, errorMessage);
            return true;
        });
    }

    private static boolean isStale(final JobExecution execution, final int attempt) {
        if (execution.getAttemptCount() == attempt) {
            return false;
        }
        log.warn("Job {} is on attempt {} (executor {}); dropping the outcome of attempt {}.",
                execution.getId(), execution.getAttemptCount(), execution.getExecutorId(), attempt);
        return true;
    }

    private void updateEvidenceStatus(final JobExecution execution, final AggregateStatus status) {
        evidenceRepository.findById(execution.getEvidenceId()).ifPresentOrElse(evidence -> {
            final String latestJobId = evidence.getLatestJobId();
            if (latestJobId != null && !latestJobId.equals(execution.getId())) {
                log.info("Evidence {} now tracks job {}; job {} does not update it.",
                        evidence.getId(), latestJobId, execution.getId());
                return;
            }
            evidence.setLatestJobId(execution.getId());
            evidence.setCollectionStatus(status);
            evidenceRepository.save(evidence);
        }, () -> log.warn("Evidence {} for job {} no longer exists.", execution.getEvidenceId(), execution.getId()));
    }

    private JobExecution newExecution(final JobReference job) {
        log.info("No record for job {}; creating it from the queue message.", job.jobId());
        final JobExecution execution = new JobExecution();
        execution.setId(job.jobId());
        execution.setAssessmentId(job.assessmentId());
        execution.setControlId(job.controlId());
        execution.setEvidenceId(job.evidenceId());
        execution.setTargetAccountId(job.targetAccountId());
        execution.setJobTemplateId(job.jobTemplateId());
        execution.setStatus(JobStatus.QUEUED);
        return execution;
    }

    private <T> T inTransaction(final String action, final String jobId, final Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (final DataAccessException | TransactionException e) {
            throw new JobRecordStoreException(String.format("Failed to %s for job %s", action, jobId), e);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
