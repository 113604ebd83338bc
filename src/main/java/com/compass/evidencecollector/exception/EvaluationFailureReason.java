package com.compass.evidencecollector.exception;

public enum EvaluationFailureReason {
    ACCESS_DENIED,
    /**
     * The only reason retried locally, with bounded exponential backoff.
     */
    THROTTLED,
    UNAVAILABLE
}
