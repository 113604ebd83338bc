package com.compass.evidencecollector.dto.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The wire format of a message on the evidence job queue.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvidenceJobMessage(@JsonProperty("job_id") String jobId,
                                 @JsonProperty("assessment_id") String assessmentId,
                                 @JsonProperty("control_id") String controlId,
                                 @JsonProperty("evidence_id") String evidenceId,
                                 @JsonProperty("target_account_id") String targetAccountId,
                                 @JsonProperty("job_template_id") String jobTemplateId) {
}
