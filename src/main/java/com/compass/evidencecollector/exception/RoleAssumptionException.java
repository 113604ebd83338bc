package com.compass.evidencecollector.exception;

import com.compass.evidencecollector.model.JobStep;
import lombok.Getter;

import java.io.Serial;

/**
 * Thrown when cross-account role assumption fails. Terminal for the current attempt; the
 * job message remains eligible for queue-level redelivery.
 */
@Getter
public class RoleAssumptionException extends EvidenceCollectionException {
    @Serial
    private static final long serialVersionUID = 8812490373301642110L;

    private final AssumeFailureReason failureReason;
    private final String roleArn;

    public RoleAssumptionException(AssumeFailureReason failureReason, String roleArn, String message, Throwable cause) {
        super(JobStep.ROLE_ASSUMPTION, true, message, cause);
        this.failureReason = failureReason;
        this.roleArn = roleArn;
    }

    @Override
    public String getReason() {
        return "ASSUME_" + failureReason.name();
    }
}
