package com.compass.evidencecollector.model.evaluation;

/**
 * The validated identity of a job, parsed from a queue message.
 */
public record JobReference(String jobId,
                           String assessmentId,
                           String controlId,
                           String evidenceId,
                           String targetAccountId,
                           String jobTemplateId) {
}
