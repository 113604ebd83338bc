package com.compass.evidencecollector.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The evidence-level compliance status written back to the evidence record.
 */
public enum AggregateStatus {
    COMPLIANT("compliant"),
    NON_COMPLIANT("non_compliant"),
    ERROR("error"),
    INSUFFICIENT_DATA("insufficient_data"),
    NOT_APPLICABLE("not_applicable");

    private final String value;

    AggregateStatus(final String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
