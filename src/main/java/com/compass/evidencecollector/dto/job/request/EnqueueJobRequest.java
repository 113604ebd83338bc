package com.compass.evidencecollector.dto.job.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString
@Schema(description = "A request to collect evidence for one control from one AWS account.")
public class EnqueueJobRequest {

    @NotBlank(message = "The 'assessment_id' cannot be empty.")
    @JsonProperty("assessment_id")
    @Schema(example = "asmt-2024-q3")
    private String assessmentId;

    @NotBlank(message = "The 'control_id' cannot be empty.")
    @JsonProperty("control_id")
    @Schema(example = "ctrl-iam-01")
    private String controlId;

    @NotBlank(message = "The 'evidence_id' cannot be empty.")
    @JsonProperty("evidence_id")
    @Schema(example = "ev-7f3a")
    private String evidenceId;

    @NotBlank(message = "The 'target_account_id' cannot be empty.")
    @Pattern(regexp = "\\d{12}", message = "The 'target_account_id' must be a 12-digit AWS account id.")
    @JsonProperty("target_account_id")
    @Schema(example = "123456789012")
    private String targetAccountId;

    @NotBlank(message = "The 'job_template_id' cannot be empty.")
    @JsonProperty("job_template_id")
    @Schema(example = "tmpl-acm")
    private String jobTemplateId;
}
