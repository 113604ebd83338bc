package com.compass.evidencecollector.controller;

import com.compass.evidencecollector.dto.common.ApiResponse;
import com.compass.evidencecollector.dto.job.request.EnqueueJobRequest;
import com.compass.evidencecollector.dto.job.response.JobExecutionResponse;
import com.compass.evidencecollector.model.JobExecution;
import com.compass.evidencecollector.service.job.JobEnqueueService;
import com.compass.evidencecollector.service.job.JobQueryService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for triggering and monitoring automated evidence collection jobs.
 * All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/evidence-collection")
@RequiredArgsConstructor
@Validated
public class EvidenceCollectionController implements EvidenceCollectionApi {

    private final JobEnqueueService jobEnqueueService;
    private final JobQueryService jobQueryService;

    @Override
    @PostMapping("/v1/jobs")
    public ResponseEntity<ApiResponse<JobExecutionResponse>> enqueueJob(@Valid @RequestBody final EnqueueJobRequest request) {
        log.info("Enqueueing collection job: {}", request);
        final JobExecution job = jobEnqueueService.enqueue(request);

        ApiResponse<JobExecutionResponse> response = ApiResponse.<JobExecutionResponse>builder()
                .response(JobExecutionResponse.from(job))
                .displayMessage("Evidence collection job queued.")
                .showMessage(true)
                .statusCode(HttpStatus.ACCEPTED.value())
                .build();

        return new ResponseEntity<>(response, HttpStatus.ACCEPTED);
    }

    @Override
    @GetMapping("/v1/jobs/{jobId}")
    public ResponseEntity<ApiResponse<JobExecutionResponse>> getJob(
            @PathVariable @NotBlank(message = "The 'jobId' cannot be empty.") final String jobId) {
        log.debug("Fetching job {}", jobId);

        ApiResponse<JobExecutionResponse> response = ApiResponse.<JobExecutionResponse>builder()
                .response(jobQueryService.getJob(jobId))
                .showMessage(false)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }

    @Override
    @GetMapping("/v1/evidence/{evidenceId}/jobs")
    public ResponseEntity<ApiResponse<List<JobExecutionResponse>>> getJobsForEvidence(
            @PathVariable @NotBlank(message = "The 'evidenceId' cannot be empty.") final String evidenceId) {
        log.debug("Fetching job history for evidence {}", evidenceId);

        ApiResponse<List<JobExecutionResponse>> response = ApiResponse.<List<JobExecutionResponse>>builder()
                .response(jobQueryService.getJobsForEvidence(evidenceId))
                .showMessage(false)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }

    @Override
    @PostMapping("/v1/jobs/{jobId}/retry")
    public ResponseEntity<ApiResponse<JobExecutionResponse>> retryJob(
            @PathVariable @NotBlank(message = "The 'jobId' cannot be empty.") final String jobId) {
        log.warn("Retrying job {}", jobId);
        final JobExecution job = jobEnqueueService.retry(jobId);

        ApiResponse<JobExecutionResponse> response = ApiResponse.<JobExecutionResponse>builder()
                .response(JobExecutionResponse.from(job))
                .displayMessage("Retry request accepted. The job has been re-queued for collection.")
                .showMessage(true)
                .statusCode(HttpStatus.ACCEPTED.value())
                .build();

        return new ResponseEntity<>(response, HttpStatus.ACCEPTED);
    }
}
