package com.compass.evidencecollector.service.job;

import com.compass.evidencecollector.dto.job.response.JobExecutionResponse;
import com.compass.evidencecollector.exception.NotFoundException;
import com.compass.evidencecollector.repository.EvidenceRepository;
import com.compass.evidencecollector.repository.JobExecutionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JobQueryService {

    private final JobExecutionRepository jobExecutionRepository;
    private final EvidenceRepository evidenceRepository;

    public JobExecutionResponse getJob(final String jobId) {
        return jobExecutionRepository.findById(jobId)
                                     .map(JobExecutionResponse::from)
                                     .orElseThrow(() -> new NotFoundException("Job not found with ID: " + jobId));
    }

    /**
     * Job history of an evidence record, newest first.
     */
    public List<JobExecutionResponse> getJobsForEvidence(final String evidenceId) {
        if (!evidenceRepository.existsById(evidenceId)) {
            throw new NotFoundException("Evidence not found with ID: " + evidenceId);
        }
        return jobExecutionRepository.findByEvidenceIdOrderByCreatedAtDesc(evidenceId).stream()
                                     .map(JobExecutionResponse::from)
                                     .toList();
    }
}
