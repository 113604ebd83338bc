package com.compass.evidencecollector.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * The durable record of one automated collection job: one evidence record evaluated against
 * one target account. Keyed by {@code id} so that every write is an overwrite of the same row.
 */
@Entity
@Table(name = "job_execution", indexes = @Index(name = "idx_job_execution_evidence", columnList = "evidenceId"))
@Data
public class JobExecution {

    @Id
    private String id;

    @Column(nullable = false)
    private String assessmentId;

    @Column(nullable = false)
    private String controlId;

    @Column(nullable = false)
    private String evidenceId;

    @Column(nullable = false)
    private String targetAccountId;

    @Column(nullable = false)
    private String jobTemplateId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status;

    @Enumerated(EnumType.STRING)
    @Column
    private PipelineStage currentStage;

    @Column(nullable = false)
    private int attemptCount;

    @Column
    private String executorId;

    @Enumerated(EnumType.STRING)
    @Column
    private AggregateStatus aggregateStatus;

    /**
     * Serialized {@link com.compass.evidencecollector.model.evaluation.EvidenceCollectionResult}.
     */
    @Column(columnDefinition = "TEXT")
    private String resultJson;

    @Enumerated(EnumType.STRING)
    @Column
    private JobStep failedStep;

    @Column
    private String failureReason;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @Column
    private LocalDateTime startedAt;

    @Column
    private LocalDateTime completedAt;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
