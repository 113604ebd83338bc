package com.compass.evidencecollector.service.aggregation;

import com.compass.evidencecollector.model.AggregateStatus;
import com.compass.evidencecollector.model.evaluation.ComplianceType;
import com.compass.evidencecollector.model.evaluation.EvidenceCollectionResult;
import com.compass.evidencecollector.model.evaluation.RuleEvaluation;
import com.compass.evidencecollector.model.evaluation.ScanMetadata;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces per-rule evaluations into the evidence-level status. Pure: no I/O, no clock.
 * <p>
 * Precedence, first match wins:
 * <ol>
 *     <li>no evaluations: {@code insufficient_data}</li>
 *     <li>any {@code NON_COMPLIANT}: {@code non_compliant}</li>
 *     <li>any {@code INSUFFICIENT_DATA}: {@code insufficient_data}</li>
 *     <li>all {@code NOT_APPLICABLE}: {@code not_applicable}</li>
 *     <li>otherwise: {@code compliant}</li>
 * </ol>
 */
@Component
public class ResultAggregator {

    public AggregateStatus aggregate(final List<RuleEvaluation> evaluations) {
        if (evaluations.isEmpty()) {
            return AggregateStatus.INSUFFICIENT_DATA;
        }
        if (anyOf(evaluations, ComplianceType.NON_COMPLIANT)) {
            return AggregateStatus.NON_COMPLIANT;
        }
        if (anyOf(evaluations, ComplianceType.INSUFFICIENT_DATA)) {
            return AggregateStatus.INSUFFICIENT_DATA;
        }
        if (evaluations.stream().allMatch(e -> e.complianceType() == ComplianceType.NOT_APPLICABLE)) {
            return AggregateStatus.NOT_APPLICABLE;
        }
        return AggregateStatus.COMPLIANT;
    }

    /**
     * Counts rules per compliance type. Every type is present, in declaration order.
     */
    public Map<ComplianceType, Integer> summarize(final List<RuleEvaluation> evaluations) {
        final Map<ComplianceType, Integer> summary = new LinkedHashMap<>();
        for (final ComplianceType type : ComplianceType.values()) {
            summary.put(type, 0);
        }
        evaluations.forEach(e -> summary.merge(e.complianceType(), 1, Integer::sum));
        return summary;
    }

    /**
     * Builds the complete, order-stable result for a run.
     */
    public EvidenceCollectionResult buildResult(final List<RuleEvaluation> evaluations, final ScanMetadata metadata) {
        final List<RuleEvaluation> sorted = new ArrayList<>(evaluations);
        sorted.sort(Comparator.comparing(RuleEvaluation::ruleName));
        return new EvidenceCollectionResult(
                aggregate(sorted),
                summarize(sorted),
                sorted.stream().map(RuleEvaluation::ruleName).toList(),
                List.copyOf(sorted),
                metadata);
    }

    private static boolean anyOf(final List<RuleEvaluation> evaluations, final ComplianceType type) {
        return evaluations.stream().anyMatch(e -> e.complianceType() == type);
    }
}
