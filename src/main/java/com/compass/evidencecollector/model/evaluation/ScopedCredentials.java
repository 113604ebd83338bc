package com.compass.evidencecollector.model.evaluation;

import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;

import java.time.Clock;
import java.time.Instant;

/**
 * Short-lived credentials scoped to a single target account. Never cached across jobs.
 */
public record ScopedCredentials(String accountId,
                                String roleArn,
                                String accessKeyId,
                                String secretAccessKey,
                                String sessionToken,
                                Instant expiration) {

    public boolean isExpired(final Clock clock) {
        return expiration != null && !clock.instant().isBefore(expiration);
    }

    public AwsCredentialsProvider toCredentialsProvider() {
        return StaticCredentialsProvider.create(
                AwsSessionCredentials.create(accessKeyId, secretAccessKey, sessionToken));
    }

    @Override
    public String toString() {
        return "ScopedCredentials[accountId=" + accountId + ", roleArn=" + roleArn + ", expiration=" + expiration + "]";
    }
}
