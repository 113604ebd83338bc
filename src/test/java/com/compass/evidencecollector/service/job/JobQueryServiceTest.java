package com.compass.evidencecollector.service.job;

import com.compass.evidencecollector.dto.job.response.JobExecutionResponse;
import com.compass.evidencecollector.exception.NotFoundException;
import com.compass.evidencecollector.model.JobExecution;
import com.compass.evidencecollector.model.JobStatus;
import com.compass.evidencecollector.repository.EvidenceRepository;
import com.compass.evidencecollector.repository.JobExecutionRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobQueryServiceTest {

    @Mock
    private JobExecutionRepository jobExecutionRepository;
    @Mock
    private EvidenceRepository evidenceRepository;

    @InjectMocks
    private JobQueryService jobQueryService;

    private static JobExecution job(String id, JobStatus status) {
        JobExecution job = new JobExecution();
        job.setId(id);
        job.setEvidenceId("e-1");
        job.setStatus(status);
        job.setAttemptCount(2);
        return job;
    }

    @Test
    void mapsStoredJob() {
        when(jobExecutionRepository.findById("job-1")).thenReturn(Optional.of(job("job-1", JobStatus.FAILED)));

        JobExecutionResponse response = jobQueryService.getJob("job-1");

        assertThat(response.getJobId()).isEqualTo("job-1");
        assertThat(response.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(response.getAttemptCount()).isEqualTo(2);
    }

    @Test
    void unknownJobIsNotFound() {
        when(jobExecutionRepository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> jobQueryService.getJob("nope")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void historyKeepsRepositoryOrder() {
        when(evidenceRepository.existsById("e-1")).thenReturn(true);
        when(jobExecutionRepository.findByEvidenceIdOrderByCreatedAtDesc("e-1"))
                .thenReturn(List.of(job("job-new", JobStatus.RUNNING), job("job-old", JobStatus.SUCCEEDED)));

        assertThat(jobQueryService.getJobsForEvidence("e-1"))
                .extracting(JobExecutionResponse::getJobId)
                .containsExactly("job-new", "job-old");
    }

    @Test
    void historyOfUnknownEvidenceIsNotFound() {
        when(evidenceRepository.existsById("e-missing")).thenReturn(false);

        assertThatThrownBy(() -> jobQueryService.getJobsForEvidence("e-missing")).isInstanceOf(NotFoundException.class);
        verify(jobExecutionRepository, never()).findByEvidenceIdOrderByCreatedAtDesc("e-missing");
    }
}
