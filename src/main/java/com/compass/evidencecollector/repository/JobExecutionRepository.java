package com.compass.evidencecollector.repository;

import com.compass.evidencecollector.model.JobExecution;
import com.compass.evidencecollector.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for the {@link JobExecution} entity.
 */
@Repository
public interface JobExecutionRepository extends JpaRepository<JobExecution, String> {

    /**
     * Job history for one evidence record, newest first.
     */
    List<JobExecution> findByEvidenceIdOrderByCreatedAtDesc(String evidenceId);

    List<JobExecution> findByStatus(JobStatus status);
}
