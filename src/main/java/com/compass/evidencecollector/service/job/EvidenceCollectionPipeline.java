package com.compass.evidencecollector.service.job;

import com.compass.evidencecollector.config.EvidenceCollectionProperties;
import com.compass.evidencecollector.exception.EvidenceCollectionException;
import com.compass.evidencecollector.exception.JobRecordStoreException;
import com.compass.evidencecollector.exception.MalformedMessageException;
import com.compass.evidencecollector.model.JobStep;
import com.compass.evidencecollector.model.PipelineStage;
import com.compass.evidencecollector.model.evaluation.EvidenceCollectionResult;
import com.compass.evidencecollector.model.evaluation.JobOutcome;
import com.compass.evidencecollector.model.evaluation.JobReference;
import com.compass.evidencecollector.model.evaluation.JobTemplateSnapshot;
import com.compass.evidencecollector.model.evaluation.QueuedJobMessage;
import com.compass.evidencecollector.model.evaluation.RuleEvaluation;
import com.compass.evidencecollector.model.evaluation.ScanMetadata;
import com.compass.evidencecollector.model.evaluation.ScopedCredentials;
import com.compass.evidencecollector.service.aggregation.ResultAggregator;
import com.compass.evidencecollector.service.credentials.CrossAccountRoleAssumer;
import com.compass.evidencecollector.service.evaluation.RuleEvaluationClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one job message through the collection pipeline:
 * parse, mark running, load the template, assume the role, fetch rule evaluations, aggregate,
 * persist.
 * <p>
 * The steps run strictly in order and every attempt starts from scratch. Role assumption and
 * rule listing are read-only, and the only write is the final overwrite of the job record, so a
 * redelivered message can safely run the whole pipeline again.
 * <p>
 * Never throws: every failure is recorded on the job (when there is one) and returned as a
 * {@link JobOutcome} so that the caller can report it to the queue.
 */
@Slf4j
@Service
public class EvidenceCollectionPipeline {

    static final String SUPERSEDED_ATTEMPT = "SUPERSEDED_ATTEMPT";

    private final JobMessageParser jobMessageParser;
    private final JobRecordStore jobRecordStore;
    private final JobTemplateStore jobTemplateStore;
    private final CrossAccountRoleAssumer roleAssumer;
    private final RuleEvaluationClient ruleEvaluationClient;
    private final ResultAggregator resultAggregator;
    private final String executorId;

    public EvidenceCollectionPipeline(JobMessageParser jobMessageParser,
                                      JobRecordStore jobRecordStore,
                                      JobTemplateStore jobTemplateStore,
                                      CrossAccountRoleAssumer roleAssumer,
                                      RuleEvaluationClient ruleEvaluationClient,
                                      ResultAggregator resultAggregator,
                                      EvidenceCollectionProperties properties) {
        this.jobMessageParser = jobMessageParser;
        this.jobRecordStore = jobRecordStore;
        this.jobTemplateStore = jobTemplateStore;
        this.roleAssumer = roleAssumer;
        this.ruleEvaluationClient = ruleEvaluationClient;
        this.resultAggregator = resultAggregator;
        this.executorId = properties.getQueue().getExecutorId();
    }

    public JobOutcome process(final QueuedJobMessage message) {
        final JobReference job;
        try {
            job = jobMessageParser.parse(message);
        } catch (final MalformedMessageException e) {
            log.error("[MALFORMED] [msg={}] Dropping to dead-letter: {}. Payload: {}",
                    message.messageId(), e.getMessage(), message.body());
            return JobOutcome.failure(message.messageId(), null, false, PipelineStage.RECEIVED,
                                      e.getStep(), e.getReason());
        }

        final String contextInfo = String.format("job=%s msg=%s", job.jobId(), message.messageId());
        log.info("[{}] Received job for evidence {} / account {} (receive count {})",
                contextInfo, job.evidenceId(), job.targetAccountId(), message.receiveCount());

        PipelineStage stage = PipelineStage.RECEIVED;
        int attempt = 0;
        boolean running = false;
        try {
            attempt = jobRecordStore.markRunning(job, executorId);
            running = true;

            final JobTemplateSnapshot template = jobTemplateStore.getTemplate(job.jobTemplateId());

            final ScopedCredentials credentials = roleAssumer.assume(job.targetAccountId());
            stage = PipelineStage.ROLE_ASSUMED;

            final List<String> prefixes = new ArrayList<>(template.prefixes());
            final List<RuleEvaluation> evaluations =
                    ruleEvaluationClient.listMatchingRules(credentials, template.region(), prefixes);
            stage = PipelineStage.RULES_FETCHED;

            final EvidenceCollectionResult result = resultAggregator.buildResult(evaluations,
                    new ScanMetadata(template.id(), template.region(), prefixes, template.rules(),
                                     credentials.roleArn()));
            stage = PipelineStage.AGGREGATED;

            if (!jobRecordStore.markSucceeded(job.jobId(), attempt, result)) {
                // A newer attempt owns the job; leave the message to it.
                log.warn("[{}] Attempt {} was superseded; result {} not recorded", contextInfo, attempt,
                        result.aggregateStatus().getValue());
                return JobOutcome.failure(message.messageId(), job.jobId(), true, stage, JobStep.PERSISTENCE,
                                          SUPERSEDED_ATTEMPT);
            }
            stage = PipelineStage.PERSISTED;

            log.info("[{}] Collection finished: {} ({} rules)", contextInfo, result.aggregateStatus().getValue(),
                    result.rulesScanned().size());
            return JobOutcome.success(message.messageId(), job.jobId());
        } catch (final EvidenceCollectionException e) {
            if (e instanceof MalformedMessageException) {
                log.error("[MALFORMED] [{}] Message does not match the stored records: {}. Payload: {}",
                        contextInfo, e.getMessage(), message.body());
            } else {
                log.warn("[{}] Step {} failed after stage {} ({}): {}", contextInfo, e.getStep(), stage,
                        e.getReason(), e.getMessage());
            }
            recordFailure(contextInfo, job, running, attempt, e.getStep(), e.getReason(), e.getMessage());
            return JobOutcome.failure(message.messageId(), job.jobId(), e.isRetryable(), stage, e.getStep(),
                                      e.getReason());
        } catch (final RuntimeException e) {
            final JobStep step = stepAfter(stage, running);
            log.error("[{}] Unexpected failure in step {} after stage {}", contextInfo, step, stage, e);
            recordFailure(contextInfo, job, running, attempt, step, "UNEXPECTED_ERROR", e.toString());
            return JobOutcome.failure(message.messageId(), job.jobId(), true, stage, step, "UNEXPECTED_ERROR");
        }
    }

    private void recordFailure(final String contextInfo, final JobReference job, final boolean recordExists,
                               final int attempt, final JobStep step, final String reason, final String errorMessage) {
        if (!recordExists) {
            return;
        }
        try {
            jobRecordStore.markFailed(job.jobId(), attempt, step, reason, errorMessage);
        } catch (final JobRecordStoreException e) {
            // The message is still reported as failed; redelivery re-runs the job from scratch.
            log.error("[{}] CRITICAL: Could not record the failure of step {}. The job state might be stale.",
                    contextInfo, step, e);
        }
    }

    private static JobStep stepAfter(final PipelineStage stage, final boolean running) {
        if (!running) {
            return JobStep.PERSISTENCE;
        }
        return switch (stage) {
            case RECEIVED -> JobStep.ROLE_ASSUMPTION;
            case ROLE_ASSUMED -> JobStep.RULE_EVALUATION;
            case RULES_FETCHED -> JobStep.AGGREGATION;
            case AGGREGATED, PERSISTED, FAILED -> JobStep.PERSISTENCE;
        };
    }
}
