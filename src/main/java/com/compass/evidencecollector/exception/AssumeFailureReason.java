package com.compass.evidencecollector.exception;

public enum AssumeFailureReason {
    /**
     * The trust relationship is missing or the caller is not allowed to assume the role.
     */
    DENIED,
    /**
     * The role does not exist in the target account.
     */
    NOT_FOUND,
    /**
     * The call did not complete within the configured bound.
     */
    TIMEOUT
}
