package com.compass.evidencecollector.model.evaluation;

import java.util.Arrays;

/**
 * The compliance state of a single rule as reported by the evaluation source.
 */
public enum ComplianceType {
    COMPLIANT,
    NON_COMPLIANT,
    INSUFFICIENT_DATA,
    NOT_APPLICABLE;

    /**
     * Maps a raw source value to a compliance type. Absent or unrecognised values become
     * {@link #INSUFFICIENT_DATA} so that missing data is never read as compliant.
     */
    public static ComplianceType fromSourceValue(final String value) {
        if (value == null) {
            return INSUFFICIENT_DATA;
        }
        return Arrays.stream(values())
                     .filter(type -> type.name().equals(value))
                     .findFirst()
                     .orElse(INSUFFICIENT_DATA);
    }
}
