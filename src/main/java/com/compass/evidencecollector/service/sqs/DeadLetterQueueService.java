package com.compass.evidencecollector.service.sqs;

import com.compass.evidencecollector.config.EvidenceCollectionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.CompletionException;

/**
 * Operations on the job dead-letter queue: forwarding messages that can never succeed, and
 * reporting how many messages are waiting there for an operator.
 */
@Slf4j
@Service
public class DeadLetterQueueService {

    static final String FAILURE_REASON_ATTRIBUTE = "failure-reason";

    private final SqsAsyncClient sqsAsyncClient;
    private final String deadLetterQueueName;
    private volatile String deadLetterQueueUrl;

    public DeadLetterQueueService(SqsAsyncClient sqsAsyncClient, EvidenceCollectionProperties properties) {
        this.sqsAsyncClient = sqsAsyncClient;
        this.deadLetterQueueName = properties.getQueue().getDeadLetterName();
    }

    public boolean isConfigured() {
        return StringUtils.hasText(deadLetterQueueName);
    }

    /**
     * Copies a message body to the dead-letter queue, tagged with the failure reason.
     *
     * @return true if the message was accepted by the dead-letter queue
     */
    public boolean forward(final String body, final String reason) {
        if (!isConfigured()) {
            log.error("No dead-letter queue configured. Cannot forward message (reason {}).", reason);
            return false;
        }
        try {
            final SendMessageRequest request = SendMessageRequest.builder()
                    .queueUrl(queueUrl())
                    .messageBody(body == null ? "" : body)
                    .messageAttributes(Map.of(FAILURE_REASON_ATTRIBUTE, MessageAttributeValue.builder()
                            .dataType("String")
                            .stringValue(reason)
                            .build()))
                    .build();
            final String messageId = sqsAsyncClient.sendMessage(request).join().messageId();
            log.warn("Forwarded message to dead-letter queue {} as {} (reason {}).", deadLetterQueueName, messageId,
                     reason);
            return true;
        } catch (final CompletionException e) {
            log.error("Failed to forward message to dead-letter queue {} (reason {}).", deadLetterQueueName, reason,
                      e.getCause());
            return false;
        }
    }

    /**
     * Returns the approximate number of visible messages in the dead-letter queue, or empty if
     * it cannot be determined.
     */
    public OptionalLong approximateDepth() {
        if (!isConfigured()) {
            return OptionalLong.empty();
        }
        try {
            final Map<QueueAttributeName, String> attributes = sqsAsyncClient.getQueueAttributes(
                    GetQueueAttributesRequest.builder()
                            .queueUrl(queueUrl())
                            .attributeNames(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES)
                            .build()).join().attributes();
            final String depth = attributes.get(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES);
            return depth == null ? OptionalLong.empty() : OptionalLong.of(Long.parseLong(depth));
        } catch (final CompletionException | NumberFormatException e) {
            log.error("Could not read the depth of dead-letter queue {}.", deadLetterQueueName, e);
            return OptionalLong.empty();
        }
    }

    private String queueUrl() {
        String url = deadLetterQueueUrl;
        if (url == null) {
            url = sqsAsyncClient.getQueueUrl(GetQueueUrlRequest.builder().queueName(deadLetterQueueName).build())
                                .join().queueUrl();
            deadLetterQueueUrl = url;
        }
        return url;
    }
}
