package com.compass.evidencecollector.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One rule category of a {@link JobTemplate}: a case-sensitive rule-name prefix and the
 * documentation URL for that category.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TemplateRule {

    @Column(name = "rule_prefix", nullable = false)
    private String prefix;

    @Column(name = "documentation_link")
    private String link;
}
