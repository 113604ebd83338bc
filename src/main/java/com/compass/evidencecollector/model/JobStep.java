package com.compass.evidencecollector.model;

/**
 * Identifies the pipeline step that produced a failure, so operators can tell an unreachable
 * account apart from a throttling source or an unavailable record store.
 */
public enum JobStep {
    MESSAGE_PARSING,
    TEMPLATE_LOOKUP,
    ROLE_ASSUMPTION,
    RULE_EVALUATION,
    AGGREGATION,
    PERSISTENCE
}
