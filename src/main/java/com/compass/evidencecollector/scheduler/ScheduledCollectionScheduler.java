package com.compass.evidencecollector.scheduler;

import com.compass.evidencecollector.model.Evidence;
import com.compass.evidencecollector.model.EvidenceType;
import com.compass.evidencecollector.repository.EvidenceRepository;
import com.compass.evidencecollector.service.job.JobEnqueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.util.List;

/**
 * Periodically enqueues a fresh collection job for every automated-collection evidence record
 * that names both a job template and a target account.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.collection.scheduler", name = "enabled", havingValue = "true")
public class ScheduledCollectionScheduler {

    private final EvidenceRepository evidenceRepository;
    private final JobEnqueueService jobEnqueueService;

    @Scheduled(cron = "${app.collection.scheduler.cron}")
    public void enqueueScheduledCollections() {
        final List<Evidence> candidates = evidenceRepository
                .findByEvidenceTypeAndJobTemplateIdIsNotNullAndAwsAccountIdIsNotNull(EvidenceType.AUTOMATED_COLLECTION);
        if (CollectionUtils.isEmpty(candidates)) {
            log.info("Scheduled collection: no automated evidence to collect.");
            return;
        }

        log.info("Scheduled collection: enqueueing jobs for {} evidence record(s).", candidates.size());
        int queued = 0;
        for (final Evidence evidence : candidates) {
            // Each evidence is enqueued in its own transaction; one bad record must not stop the run.
            try {
                jobEnqueueService.enqueueForEvidence(evidence);
                queued++;
            } catch (final RuntimeException e) {
                log.error("Scheduled collection: could not enqueue a job for evidence {}.", evidence.getId(), e);
            }
        }
        log.info("Scheduled collection finished. Queued {} of {} job(s).", queued, candidates.size());
    }
}
