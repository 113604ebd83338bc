package com.compass.evidencecollector.service.job;

import com.compass.evidencecollector.common.json.JsonSerializer;
import com.compass.evidencecollector.config.EvidenceCollectionProperties;
import com.compass.evidencecollector.dto.job.request.EnqueueJobRequest;
import com.compass.evidencecollector.dto.message.EvidenceJobMessage;
import com.compass.evidencecollector.exception.BadRequestException;
import com.compass.evidencecollector.exception.ConflictException;
import com.compass.evidencecollector.exception.NotFoundException;
import com.compass.evidencecollector.exception.QueuePublishException;
import com.compass.evidencecollector.model.Evidence;
import com.compass.evidencecollector.model.JobExecution;
import com.compass.evidencecollector.model.JobStatus;
import com.compass.evidencecollector.repository.EvidenceRepository;
import com.compass.evidencecollector.repository.JobExecutionRepository;
import com.compass.evidencecollector.repository.JobTemplateRepository;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Objects;
import java.util.UUID;

/**
 * Creates collection jobs and publishes them to the job queue. This is the entry point for
 * both the REST trigger and the scheduled collection run.
 */
@Slf4j
@Service
public class JobEnqueueService {

    private final JobExecutionRepository jobExecutionRepository;
    private final EvidenceRepository evidenceRepository;
    private final JobTemplateRepository jobTemplateRepository;
    private final SqsTemplate sqsTemplate;
    private final JsonSerializer jsonSerializer;
    private final String queueName;

    public JobEnqueueService(JobExecutionRepository jobExecutionRepository,
                             EvidenceRepository evidenceRepository,
                             JobTemplateRepository jobTemplateRepository,
                             SqsTemplate sqsTemplate,
                             JsonSerializer jsonSerializer,
                             EvidenceCollectionProperties properties) {
        this.jobExecutionRepository = jobExecutionRepository;
        this.evidenceRepository = evidenceRepository;
        this.jobTemplateRepository = jobTemplateRepository;
        this.sqsTemplate = sqsTemplate;
        this.jsonSerializer = jsonSerializer;
        this.queueName = properties.getQueue().getName();
    }

    /**
     * Creates a {@code QUEUED} job for the request and publishes it once the job is committed.
     *
     * @return the new job
     */
    @Transactional
    public JobExecution enqueue(final EnqueueJobRequest request) {
        final Evidence evidence = evidenceRepository.findById(request.getEvidenceId()).orElseThrow(
                () -> new NotFoundException("Evidence not found with ID: " + request.getEvidenceId()));
        if (!Objects.equals(evidence.getControlId(), request.getControlId())
                || !Objects.equals(evidence.getAssessmentId(), request.getAssessmentId())) {
            throw new BadRequestException(String.format("Evidence %s does not belong to control %s in assessment %s",
                    request.getEvidenceId(), request.getControlId(), request.getAssessmentId()));
        }
        if (!evidence.isAutomatedCollection()) {
            throw new ConflictException("Evidence " + evidence.getId() + " is not an automated collection evidence.");
        }
        if (jobTemplateRepository.findByIdAndActiveTrue(request.getJobTemplateId()).isEmpty()) {
            throw new NotFoundException("Active job template not found with ID: " + request.getJobTemplateId());
        }

        final JobExecution job = new JobExecution();
        job.setId(UUID.randomUUID().toString());
        job.setAssessmentId(request.getAssessmentId());
        job.setControlId(request.getControlId());
        job.setEvidenceId(request.getEvidenceId());
        job.setTargetAccountId(request.getTargetAccountId());
        job.setJobTemplateId(request.getJobTemplateId());
        job.setStatus(JobStatus.QUEUED);
        final JobExecution saved = jobExecutionRepository.save(job);

        evidence.setLatestJobId(saved.getId());
        evidenceRepository.save(evidence);

        log.info("Created job {} for evidence {} / account {} with template {}", saved.getId(), evidence.getId(),
                 saved.getTargetAccountId(), saved.getJobTemplateId());
        publishAfterCommit(saved);
        return saved;
    }

    /**
     * Enqueues a fresh job for an automated-collection evidence record, using the account and
     * template stored on it.
     */
    @Transactional
    public JobExecution enqueueForEvidence(final Evidence evidence) {
        final EnqueueJobRequest request = new EnqueueJobRequest();
        request.setAssessmentId(evidence.getAssessmentId());
        request.setControlId(evidence.getControlId());
        request.setEvidenceId(evidence.getId());
        request.setTargetAccountId(evidence.getAwsAccountId());
        request.setJobTemplateId(evidence.getJobTemplateId());
        return enqueue(request);
    }

    /**
     * Re-publishes a job. A {@code FAILED} job moves back to {@code QUEUED}; a {@code QUEUED} job
     * whose message may never have been published is sent again as is.
     */
    @Transactional
    public JobExecution retry(final String jobId) {
        final JobExecution job = jobExecutionRepository.findById(jobId).orElseThrow(
                () -> new NotFoundException("Job not found with ID: " + jobId));
        if (job.getStatus() != JobStatus.QUEUED && !job.getStatus().canTransitionTo(JobStatus.QUEUED)) {
            throw new ConflictException(String.format(
                    "Job %s cannot be retried because it is %s. Only FAILED or QUEUED jobs can be retried.",
                    jobId, job.getStatus()));
        }

        log.warn("Retrying job {} (status {}, failed step {}, reason {})", jobId, job.getStatus(),
                 job.getFailedStep(), job.getFailureReason());
        job.setStatus(JobStatus.QUEUED);
        job.setCurrentStage(null);
        final JobExecution saved = jobExecutionRepository.save(job);

        evidenceRepository.findById(job.getEvidenceId()).ifPresent(evidence -> {
            evidence.setLatestJobId(jobId);
            evidenceRepository.save(evidence);
        });
        publishAfterCommit(saved);
        return saved;
    }

    private void publishAfterCommit(final JobExecution job) {
        final String payload = jsonSerializer.serialize(new EvidenceJobMessage(job.getId(), job.getAssessmentId(),
                job.getControlId(), job.getEvidenceId(), job.getTargetAccountId(), job.getJobTemplateId()));
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                try {
                    sqsTemplate.send(to -> to.queue(queueName).payload(payload));
                } catch (final RuntimeException e) {
                    log.error("Job {} is committed but could not be published to '{}'. Retry it once the queue is reachable.",
                              job.getId(), queueName, e);
                    throw new QueuePublishException("Failed to publish job " + job.getId(), e);
                }
                log.info("Published job {} to queue '{}'", job.getId(), queueName);
            }
        });
    }
}
