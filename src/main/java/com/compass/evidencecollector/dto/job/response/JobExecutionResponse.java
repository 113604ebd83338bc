package com.compass.evidencecollector.dto.job.response;

import com.compass.evidencecollector.model.AggregateStatus;
import com.compass.evidencecollector.model.JobExecution;
import com.compass.evidencecollector.model.JobStatus;
import com.compass.evidencecollector.model.JobStep;
import com.compass.evidencecollector.model.PipelineStage;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonRawValue;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * A read model of one job execution. The stored result is embedded as raw JSON.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobExecutionResponse {
    private final String jobId;
    private final String assessmentId;
    private final String controlId;
    private final String evidenceId;
    private final String targetAccountId;
    private final String jobTemplateId;
    private final JobStatus status;
    private final PipelineStage currentStage;
    private final int attemptCount;
    private final AggregateStatus aggregateStatus;
    @JsonRawValue
    private final String result;
    private final JobStep failedStep;
    private final String failureReason;
    private final String errorMessage;
    private final LocalDateTime startedAt;
    private final LocalDateTime completedAt;
    private final LocalDateTime createdAt;

    public static JobExecutionResponse from(final JobExecution execution) {
        return JobExecutionResponse.builder()
                .jobId(execution.getId())
                .assessmentId(execution.getAssessmentId())
                .controlId(execution.getControlId())
                .evidenceId(execution.getEvidenceId())
                .targetAccountId(execution.getTargetAccountId())
                .jobTemplateId(execution.getJobTemplateId())
                .status(execution.getStatus())
                .currentStage(execution.getCurrentStage())
                .attemptCount(execution.getAttemptCount())
                .aggregateStatus(execution.getAggregateStatus())
                .result(execution.getResultJson())
                .failedStep(execution.getFailedStep())
                .failureReason(execution.getFailureReason())
                .errorMessage(execution.getErrorMessage())
                .startedAt(execution.getStartedAt())
                .completedAt(execution.getCompletedAt())
                .createdAt(execution.getCreatedAt())
                .build();
    }
}
