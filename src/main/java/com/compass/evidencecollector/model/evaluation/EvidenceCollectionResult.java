package com.compass.evidencecollector.model.evaluation;

import com.compass.evidencecollector.model.AggregateStatus;

import java.util.List;
import java.util.Map;

/**
 * The outcome of one successful collection run. Contains no timestamps or attempt-specific
 * values, so re-running against an unchanged source yields an identical result.
 *
 * @param aggregateStatus   the evidence-level status
 * @param complianceSummary number of rules per compliance type, in {@link ComplianceType} order
 * @param rulesScanned      names of the matched rules, sorted
 * @param ruleDetails       per-rule findings, sorted by rule name
 * @param scanMetadata      what was scanned and how
 */
public record EvidenceCollectionResult(AggregateStatus aggregateStatus,
                                       Map<ComplianceType, Integer> complianceSummary,
                                       List<String> rulesScanned,
                                       List<RuleEvaluation> ruleDetails,
                                       ScanMetadata scanMetadata) {
}
