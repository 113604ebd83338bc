package com.compass.evidencecollector.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * An evidence record attached to a control. Automated-collection evidence references the
 * job template and target account used to collect it and carries the latest collection status.
 */
@Entity
@Table(name = "evidence", indexes = @Index(name = "idx_evidence_control", columnList = "controlId"))
@Data
public class Evidence {

    @Id
    private String id;

    @Column(nullable = false)
    private String controlId;

    @Column(nullable = false)
    private String assessmentId;

    @Column(nullable = false)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EvidenceType evidenceType = EvidenceType.DOCUMENT;

    @Column
    private String awsAccountId;

    @Column
    private String jobTemplateId;

    @Enumerated(EnumType.STRING)
    @Column
    private AggregateStatus collectionStatus;

    /**
     * The most recently enqueued job. Only that job may update {@link #collectionStatus}.
     */
    @Column
    private String latestJobId;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @Transient
    public boolean isAutomatedCollection() {
        return evidenceType == EvidenceType.AUTOMATED_COLLECTION;
    }
}
