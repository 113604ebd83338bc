package com.compass.evidencecollector.repository;

import com.compass.evidencecollector.model.JobTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JobTemplateRepository extends JpaRepository<JobTemplate, String> {

    Optional<JobTemplate> findByIdAndActiveTrue(String id);
}
