package com.compass.evidencecollector.exception;

import com.compass.evidencecollector.model.JobStep;
import lombok.Getter;

import java.io.Serial;

/**
 * Thrown when the rule evaluation source cannot be listed or described.
 */
@Getter
public class RuleEvaluationException extends EvidenceCollectionException {
    @Serial
    private static final long serialVersionUID = -3348906187410550297L;

    private final EvaluationFailureReason failureReason;

    public RuleEvaluationException(EvaluationFailureReason failureReason, String message) {
        super(JobStep.RULE_EVALUATION, true, message);
        this.failureReason = failureReason;
    }

    public RuleEvaluationException(EvaluationFailureReason failureReason, String message, Throwable cause) {
        super(JobStep.RULE_EVALUATION, true, message, cause);
        this.failureReason = failureReason;
    }

    @Override
    public String getReason() {
        return "EVAL_" + failureReason.name();
    }
}
