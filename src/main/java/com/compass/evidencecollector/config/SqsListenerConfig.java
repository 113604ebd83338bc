package com.compass.evidencecollector.config;

import io.awspring.cloud.sqs.config.SqsMessageListenerContainerFactory;
import io.awspring.cloud.sqs.listener.ListenerMode;
import io.awspring.cloud.sqs.listener.acknowledgement.handler.AcknowledgementMode;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.MessageSystemAttributeName;

import java.util.List;

@Configuration
public class SqsListenerConfig {

    /**
     * Creates the batch container factory for the evidence job queue.
     * <p>
     * Acknowledgement is MANUAL: the consumer deletes exactly the messages that succeeded (or were
     * dead-lettered), and everything else becomes visible again once the visibility timeout expires.
     */
    @Bean("evidenceJobContainerFactory") // The bean name is critical!
    public SqsMessageListenerContainerFactory<Object> evidenceJobContainerFactory(SqsAsyncClient sqsAsyncClient,
                                                                                  EvidenceCollectionProperties properties) {
        EvidenceCollectionProperties.Queue queue = properties.getQueue();
        if (queue.getMaxMessagesPerPoll() < 1 || queue.getMaxMessagesPerPoll() > 10) {
            throw new IllegalArgumentException(
                    "app.collection.queue.max-messages-per-poll must be between 1 and 10, was " + queue.getMaxMessagesPerPoll());
        }

        SqsMessageListenerContainerFactory<Object> factory = new SqsMessageListenerContainerFactory<>();
        factory.setSqsAsyncClient(sqsAsyncClient);
        factory.configure(options -> options.acknowledgementMode(AcknowledgementMode.MANUAL)
                                            .listenerMode(ListenerMode.BATCH)
                                            .maxConcurrentMessages(Math.max(queue.getMaxConcurrentMessages(), queue.getMaxMessagesPerPoll()))
                                            .maxMessagesPerPoll(queue.getMaxMessagesPerPoll())
                                            .pollTimeout(queue.getPollTimeout())
                                            .messageSystemAttributeNames(
                                                    List.of(MessageSystemAttributeName.APPROXIMATE_RECEIVE_COUNT)));
        return factory;
    }
}
