package com.compass.evidencecollector.model.evaluation;

import java.util.Objects;

/**
 * One compliance rule's state for the target account.
 *
 * @param ruleName               the rule name as reported by the source
 * @param complianceType         the rule's aggregate compliance state
 * @param evaluatedResourceCount the number of contributing resources, or null when the source does not report one
 */
public record RuleEvaluation(String ruleName, ComplianceType complianceType, Integer evaluatedResourceCount) {

    public RuleEvaluation {
        Objects.requireNonNull(ruleName, "ruleName");
        Objects.requireNonNull(complianceType, "complianceType");
        if (evaluatedResourceCount != null && evaluatedResourceCount < 0) {
            throw new IllegalArgumentException("evaluatedResourceCount must not be negative: " + evaluatedResourceCount);
        }
    }

    public static RuleEvaluation insufficientData(final String ruleName) {
        return new RuleEvaluation(ruleName, ComplianceType.INSUFFICIENT_DATA, null);
    }
}
