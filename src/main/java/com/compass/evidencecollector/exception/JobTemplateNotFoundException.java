package com.compass.evidencecollector.exception;

import com.compass.evidencecollector.model.JobStep;

import java.io.Serial;

public class JobTemplateNotFoundException extends EvidenceCollectionException {
    @Serial
    private static final long serialVersionUID = 2876016467390345187L;

    public JobTemplateNotFoundException(String templateId) {
        super(JobStep.TEMPLATE_LOOKUP, false, "Job template not found or inactive: " + templateId);
    }

    @Override
    public String getReason() {
        return "TEMPLATE_NOT_FOUND";
    }
}
