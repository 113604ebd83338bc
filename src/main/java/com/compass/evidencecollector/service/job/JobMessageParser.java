package com.compass.evidencecollector.service.job;

import com.compass.evidencecollector.common.json.JsonParser;
import com.compass.evidencecollector.dto.message.EvidenceJobMessage;
import com.compass.evidencecollector.exception.MalformedMessageException;
import com.compass.evidencecollector.exception.json.JsonParsingException;
import com.compass.evidencecollector.model.evaluation.JobReference;
import com.compass.evidencecollector.model.evaluation.QueuedJobMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns a raw queue message into a {@link JobReference}, failing fast on anything that
 * redelivery could never fix.
 */
@Component
@RequiredArgsConstructor
public class JobMessageParser {

    private static final Pattern ACCOUNT_ID_PATTERN = Pattern.compile("\\d{12}");

    private final JsonParser jsonParser;

    /**
     * @throws MalformedMessageException if the body is not JSON, a required field is missing, or
     *                                   the target account id is not a twelve-digit AWS account id
     */
    public JobReference parse(final QueuedJobMessage message) {
        if (!StringUtils.hasText(message.body())) {
            throw new MalformedMessageException("Message " + message.messageId() + " has an empty body");
        }

        final EvidenceJobMessage payload;
        try {
            payload = jsonParser.parseObject(message.body(), EvidenceJobMessage.class);
        } catch (final JsonParsingException e) {
            throw new MalformedMessageException("Message " + message.messageId() + " is not a valid job message", e);
        }
        if (payload == null) {
            throw new MalformedMessageException("Message " + message.messageId() + " has a null payload");
        }

        final List<String> missing = new ArrayList<>();
        requireText(payload.assessmentId(), "assessment_id", missing);
        requireText(payload.controlId(), "control_id", missing);
        requireText(payload.evidenceId(), "evidence_id", missing);
        requireText(payload.targetAccountId(), "target_account_id", missing);
        requireText(payload.jobTemplateId(), "job_template_id", missing);
        if (!missing.isEmpty()) {
            throw new MalformedMessageException(
                    "Message " + message.messageId() + " is missing required fields: " + String.join(", ", missing));
        }
        if (!ACCOUNT_ID_PATTERN.matcher(payload.targetAccountId()).matches()) {
            throw new MalformedMessageException(
                    "Message " + message.messageId() + " has an invalid target_account_id: " + payload.targetAccountId());
        }

        // Without an explicit job id the message id keys the job: it is stable across redeliveries.
        final String jobId = StringUtils.hasText(payload.jobId()) ? payload.jobId() : message.messageId();
        if (!StringUtils.hasText(jobId)) {
            throw new MalformedMessageException("Message has neither a job_id nor a message id");
        }
        return new JobReference(jobId, payload.assessmentId(), payload.controlId(), payload.evidenceId(),
                                payload.targetAccountId(), payload.jobTemplateId());
    }

    private static void requireText(final String value, final String field, final List<String> missing) {
        if (!StringUtils.hasText(value)) {
            missing.add(field);
        }
    }
}
