package com.compass.evidencecollector.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A reusable automated-check definition, maintained by administrators through the CRUD layer.
 * The collection pipeline only ever reads it.
 */
@Entity
@Table(name = "job_template")
@Data
public class JobTemplate {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column
    private String documentationLink;

    /**
     * The kind of evaluation source the template targets. Only {@code aws_config} is supported.
     */
    @Column(nullable = false)
    private String scanType = "aws_config";

    /**
     * Region to evaluate in. If null, the configured default region is used.
     */
    @Column
    private String region;

    @Column(nullable = false)
    private boolean active = true;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "job_template_rule", joinColumns = @JoinColumn(name = "template_id"))
    @OrderColumn(name = "rule_order")
    private List<TemplateRule> rules = new ArrayList<>();

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
