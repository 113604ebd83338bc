package com.compass.evidencecollector.model.evaluation;

/**
 * A raw job message as received from the queue.
 *
 * @param messageId    the queue's message identifier, stable across redeliveries
 * @param body         the unparsed message body
 * @param receiveCount how many times the queue has delivered this message, or null if unknown
 */
public record QueuedJobMessage(String messageId, String body, Integer receiveCount) {
}
