package com.compass.evidencecollector.controller;

import com.compass.evidencecollector.dto.common.ApiResponse;
import com.compass.evidencecollector.dto.job.request.EnqueueJobRequest;
import com.compass.evidencecollector.dto.job.response.JobExecutionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;

import java.util.List;

@Tag(name = "Automated Evidence Collection", description = "Endpoints for triggering AWS Config evidence collection jobs and monitoring their state.")
public interface EvidenceCollectionApi {

    @Operation(summary = "Enqueue Collection Job",
            description = "Creates a job that evaluates the AWS Config rules selected by the job template in the target account, and publishes it to the job queue.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Job created and queued.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Evidence collection job queued.",
                                        "response": {
                                            "jobId": "0b6f7c1e-3f52-4a0e-9d59-1f2a4c3e8b11",
                                            "evidenceId": "ev-7f3a",
                                            "targetAccountId": "123456789012",
                                            "status": "QUEUED",
                                            "attemptCount": 0
                                        },
                                        "showMessage": true,
                                        "statusCode": 202
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Invalid fields, or the evidence does not belong to the control.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Evidence or job template not found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "The evidence is not an automated collection evidence.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobExecutionResponse>> enqueueJob(@RequestBody EnqueueJobRequest request);

    @Operation(summary = "Get Job", description = "Returns the current state of a job, including its result once it has succeeded.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Job not found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobExecutionResponse>> getJob(
            @Parameter(description = "The job id.", required = true) @PathVariable String jobId);

    @Operation(summary = "List Jobs For Evidence", description = "Returns the job history of an evidence record, newest first.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job history returned.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Evidence not found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<List<JobExecutionResponse>>> getJobsForEvidence(
            @Parameter(description = "The evidence id.", required = true) @PathVariable String evidenceId);

    @Operation(summary = "Retry Job", description = "Re-queues a FAILED job, or re-publishes a QUEUED job whose message was lost.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Job re-queued.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Job not found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "The job is running or has succeeded.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobExecutionResponse>> retryJob(
            @Parameter(description = "The job id.", required = true) @PathVariable String jobId);
}
