package com.compass.evidencecollector.exception;

import com.compass.evidencecollector.model.JobStep;

import java.io.Serial;

/**
 * Thrown when a job template cannot be used for collection, e.g. it has no rule prefixes
 * or a blank one (which would match every rule).
 */
public class InvalidJobTemplateException extends EvidenceCollectionException {
    @Serial
    private static final long serialVersionUID = -7723364250923617415L;

    public InvalidJobTemplateException(String message) {
        super(JobStep.TEMPLATE_LOOKUP, false, message);
    }

    @Override
    public String getReason() {
        return "TEMPLATE_INVALID";
    }
}
