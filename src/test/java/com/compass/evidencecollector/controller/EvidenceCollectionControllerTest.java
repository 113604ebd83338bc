package com.compass.evidencecollector.controller;

import com.compass.evidencecollector.dto.job.request.EnqueueJobRequest;
import com.compass.evidencecollector.dto.job.response.JobExecutionResponse;
import com.compass.evidencecollector.exception.BadRequestException;
import com.compass.evidencecollector.exception.ConflictException;
import com.compass.evidencecollector.exception.NotFoundException;
import com.compass.evidencecollector.exception.QueuePublishException;
import com.compass.evidencecollector.exception.handler.GlobalExceptionHandler;
import com.compass.evidencecollector.model.AggregateStatus;
import com.compass.evidencecollector.model.JobExecution;
import com.compass.evidencecollector.model.JobStatus;
import com.compass.evidencecollector.service.job.JobEnqueueService;
import com.compass.evidencecollector.service.job.JobQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Drives the controller through MockMvc with the application's exception handler, so the
 * status codes and the {@code ApiResponse} envelope are the ones a caller sees.
 */
@ExtendWith(MockitoExtension.class)
class EvidenceCollectionControllerTest {

    private static final String ENQUEUE_BODY = """
            {"assessment_id":"a-1","control_id":"c-1","evidence_id":"e-1",
             "target_account_id":"123456789012","job_template_id":"t-1"}
            """;

    @Mock
    private JobEnqueueService jobEnqueueService;
    @Mock
    private JobQueryService jobQueryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new EvidenceCollectionController(jobEnqueueService, jobQueryService))
                                 .setControllerAdvice(new GlobalExceptionHandler())
                                 .build();
    }

    private static JobExecution job(JobStatus status) {
        JobExecution job = new JobExecution();
        job.setId("job-1");
        job.setAssessmentId("a-1");
        job.setControlId("c-1");
        job.setEvidenceId("e-1");
        job.setTargetAccountId("123456789012");
        job.setJobTemplateId("t-1");
        job.setStatus(status);
        return job;
    }

    @Nested
    @DisplayName("POST /v1/jobs")
    class EnqueueTest {

        @Test
        @DisplayName("A valid request is accepted with 202 and the queued job")
        void accepted() throws Exception {
            when(jobEnqueueService.enqueue(any(EnqueueJobRequest.class))).thenReturn(job(JobStatus.QUEUED));

            mockMvc.perform(post("/evidence-collection/v1/jobs").contentType(MediaType.APPLICATION_JSON).content(ENQUEUE_BODY))
                   .andExpect(status().isAccepted())
                   .andExpect(jsonPath("$.statusCode").value(202))
                   .andExpect(jsonPath("$.response.jobId").value("job-1"))
                   .andExpect(jsonPath("$.response.status").value("QUEUED"));

            ArgumentCaptor<EnqueueJobRequest> request = ArgumentCaptor.forClass(EnqueueJobRequest.class);
            verify(jobEnqueueService).enqueue(request.capture());
            assertThat(request.getValue().getTargetAccountId()).isEqualTo("123456789012");
            assertThat(request.getValue().getJobTemplateId()).isEqualTo("t-1");
        }

        @Test
        @DisplayName("An invalid account id is rejected with 400 before anything is queued")
        void invalidAccountId() throws Exception {
            mockMvc.perform(post("/evidence-collection/v1/jobs").contentType(MediaType.APPLICATION_JSON)
                                                               .content(ENQUEUE_BODY.replace("123456789012", "12345")))
                   .andExpect(status().isBadRequest())
                   .andExpect(jsonPath("$.statusCode").value(400))
                   .andExpect(jsonPath("$.displayMessage").value("Invalid input provided."));

            verifyNoInteractions(jobEnqueueService);
        }

        @Test
        void unreadableBodyIsBadRequest() throws Exception {
            mockMvc.perform(post("/evidence-collection/v1/jobs").contentType(MediaType.APPLICATION_JSON).content("{oops"))
                   .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Evidence that belongs to another control is a 400")
        void mismatchedEvidence() throws Exception {
            when(jobEnqueueService.enqueue(any(EnqueueJobRequest.class)))
                    .thenThrow(new BadRequestException("Evidence e-1 does not belong to control c-1"));

            mockMvc.perform(post("/evidence-collection/v1/jobs").contentType(MediaType.APPLICATION_JSON).content(ENQUEUE_BODY))
                   .andExpect(status().isBadRequest())
                   .andExpect(jsonPath("$.displayMessage").value("Evidence e-1 does not belong to control c-1"));
        }

        @Test
        @DisplayName("A job saved but not published is reported as 503")
        void publishFailure() throws Exception {
            when(jobEnqueueService.enqueue(any(EnqueueJobRequest.class)))
                    .thenThrow(new QueuePublishException("Failed to publish job job-1", new IllegalStateException()));

            mockMvc.perform(post("/evidence-collection/v1/jobs").contentType(MediaType.APPLICATION_JSON).content(ENQUEUE_BODY))
                   .andExpect(status().isServiceUnavailable())
                   .andExpect(jsonPath("$.statusCode").value(503))
                   .andExpect(jsonPath("$.errorDetail").value("Failed to publish job job-1"));
        }
    }

    @Nested
    @DisplayName("GET endpoints")
    class QueryTest {

        @Test
        void returnsJob() throws Exception {
            JobExecution succeeded = job(JobStatus.SUCCEEDED);
            succeeded.setAggregateStatus(AggregateStatus.COMPLIANT);
            succeeded.setResultJson("{\"aggregateStatus\":\"compliant\"}");
            when(jobQueryService.getJob("job-1")).thenReturn(JobExecutionResponse.from(succeeded));

            mockMvc.perform(get("/evidence-collection/v1/jobs/job-1"))
                   .andExpect(status().isOk())
                   .andExpect(jsonPath("$.response.status").value("SUCCEEDED"))
                   .andExpect(jsonPath("$.response.aggregateStatus").value("compliant"))
                   .andExpect(jsonPath("$.response.result.aggregateStatus").value("compliant"));
        }

        @Test
        void unknownJobIsNotFound() throws Exception {
            when(jobQueryService.getJob("nope")).thenThrow(new NotFoundException("Job not found with ID: nope"));

            mockMvc.perform(get("/evidence-collection/v1/jobs/nope"))
                   .andExpect(status().isNotFound())
                   .andExpect(jsonPath("$.statusCode").value(404));
        }

        @Test
        void listsJobsForEvidence() throws Exception {
            when(jobQueryService.getJobsForEvidence("e-1")).thenReturn(List.of(
                    JobExecutionResponse.from(job(JobStatus.FAILED)), JobExecutionResponse.from(job(JobStatus.SUCCEEDED))));

            mockMvc.perform(get("/evidence-collection/v1/evidence/e-1/jobs"))
                   .andExpect(status().isOk())
                   .andExpect(jsonPath("$.response.length()").value(2))
                   .andExpect(jsonPath("$.response[0].status").value("FAILED"));
        }
    }

    @Nested
    @DisplayName("POST /v1/jobs/{jobId}/retry")
    class RetryTest {

        @Test
        void retryIsAccepted() throws Exception {
            when(jobEnqueueService.retry("job-1")).thenReturn(job(JobStatus.QUEUED));

            mockMvc.perform(post("/evidence-collection/v1/jobs/job-1/retry"))
                   .andExpect(status().isAccepted())
                   .andExpect(jsonPath("$.response.status").value("QUEUED"));
        }

        @Test
        @DisplayName("Retrying a succeeded job is a 409")
        void retryOfSucceededJobConflicts() throws Exception {
            when(jobEnqueueService.retry("job-1")).thenThrow(new ConflictException("Job job-1 cannot be retried"));

            mockMvc.perform(post("/evidence-collection/v1/jobs/job-1/retry"))
                   .andExpect(status().isConflict())
                   .andExpect(jsonPath("$.statusCode").value(409));
        }
    }
}
