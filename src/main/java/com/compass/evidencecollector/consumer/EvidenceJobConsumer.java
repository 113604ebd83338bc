package com.compass.evidencecollector.consumer;

import com.compass.evidencecollector.exception.MessageProcessingFailedException;
import com.compass.evidencecollector.model.evaluation.JobOutcome;
import com.compass.evidencecollector.model.evaluation.QueuedJobMessage;
import com.compass.evidencecollector.service.job.JobBatchProcessor;
import com.compass.evidencecollector.service.sqs.DeadLetterQueueService;
import io.awspring.cloud.sqs.annotation.SqsListener;
import io.awspring.cloud.sqs.listener.SqsHeaders;
import io.awspring.cloud.sqs.listener.acknowledgement.BatchAcknowledgement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An SQS batch consumer for evidence collection jobs.
 * <p>
 * Acknowledgement is per message: successful jobs are deleted from the queue, permanent failures
 * are copied to the dead-letter queue and then deleted, and retryable failures are left alone so
 * that they become visible again once their visibility timeout expires. After the queue's
 * max-receive-count, SQS moves a repeatedly failing message to the dead-letter queue itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EvidenceJobConsumer {

    private final JobBatchProcessor jobBatchProcessor;
    private final DeadLetterQueueService deadLetterQueueService;

    @SqsListener(value = "${app.collection.queue.name}", factory = "evidenceJobContainerFactory")
    public void onJobBatch(final List<Message<String>> messages, final BatchAcknowledgement<String> acknowledgement) {
        log.debug("Received batch of {} evidence job message(s).", messages.size());

        final List<QueuedJobMessage> queued = messages.stream().map(EvidenceJobConsumer::toQueuedMessage).toList();
        final List<JobOutcome> outcomes;
        try {
            outcomes = jobBatchProcessor.processBatch(queued);
        } catch (final RuntimeException e) {
            log.error("Batch of {} message(s) could not be processed. Leaving all for redelivery.", messages.size(), e);
            throw new MessageProcessingFailedException("Batch processing failed", e);
        }

        final List<Message<String>> toAcknowledge = new ArrayList<>();
        int retryable = 0;
        int deadLettered = 0;
        for (int i = 0; i < messages.size(); i++) {
            final Message<String> message = messages.get(i);
            final JobOutcome outcome = outcomes.get(i);
            switch (outcome.result()) {
                case SUCCESS -> toAcknowledge.add(message);
                case PERMANENT_FAILURE -> {
                    if (deadLetterQueueService.forward(message.getPayload(), outcome.reason())) {
                        toAcknowledge.add(message);
                        deadLettered++;
                    } else {
                        // Redelivery ends in the queue's own dead-letter routing.
                        retryable++;
                    }
                }
                case RETRYABLE_FAILURE -> retryable++;
            }
        }

        if (!toAcknowledge.isEmpty()) {
            acknowledgement.acknowledge(toAcknowledge);
        }
        log.info("Batch done: {} succeeded, {} dead-lettered, {} left for redelivery.",
                 toAcknowledge.size() - deadLettered, deadLettered, retryable);
    }

    static QueuedJobMessage toQueuedMessage(final Message<String> message) {
        final String messageId = Objects.toString(message.getHeaders().getId(), null);
        return new QueuedJobMessage(messageId, message.getPayload(), receiveCount(message));
    }

    private static Integer receiveCount(final Message<String> message) {
        final Object value = message.getHeaders().get(SqsHeaders.MessageSystemAttributes.SQS_APPROXIMATE_RECEIVE_COUNT);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.toString());
        } catch (final NumberFormatException e) {
            log.debug("Ignoring unparseable receive count '{}'.", value);
            return null;
        }
    }
}
