package com.compass.evidencecollector.repository;

import com.compass.evidencecollector.model.Evidence;
import com.compass.evidencecollector.model.EvidenceType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for the {@link Evidence} entity.
 */
@Repository
public interface EvidenceRepository extends JpaRepository<Evidence, String> {

    /**
     * Finds the evidence records the scheduler can collect: automated ones that name both a
     * template and a target account.
     */
    List<Evidence> findByEvidenceTypeAndJobTemplateIdIsNotNullAndAwsAccountIdIsNotNull(EvidenceType evidenceType);
}
