package com.compass.evidencecollector.scheduler;

import com.compass.evidencecollector.service.sqs.DeadLetterQueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.OptionalLong;

/**
 * Logs the depth of the job dead-letter queue so that dead-lettered jobs get an operator's attention.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeadLetterQueueMonitor {

    private final DeadLetterQueueService deadLetterQueueService;

    @Scheduled(cron = "${app.collection.scheduler.dead-letter-monitor-cron}")
    public void reportDeadLetterDepth() {
        if (!deadLetterQueueService.isConfigured()) {
            return;
        }
        final OptionalLong depth = deadLetterQueueService.approximateDepth();
        if (depth.isEmpty()) {
            log.warn("Dead-letter queue depth is unknown.");
        } else if (depth.getAsLong() > 0) {
            log.error("[DLQ] {} job message(s) are waiting in the dead-letter queue for manual intervention.",
                      depth.getAsLong());
        } else {
            log.debug("Dead-letter queue is empty.");
        }
    }
}
