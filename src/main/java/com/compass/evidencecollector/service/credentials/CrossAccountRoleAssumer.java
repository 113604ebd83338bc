package com.compass.evidencecollector.service.credentials;

import com.compass.evidencecollector.config.EvidenceCollectionProperties;
import com.compass.evidencecollector.exception.AssumeFailureReason;
import com.compass.evidencecollector.exception.RoleAssumptionException;
import com.compass.evidencecollector.model.evaluation.ScopedCredentials;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleResponse;
import software.amazon.awssdk.services.sts.model.Credentials;

import java.time.Clock;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Obtains short-lived credentials for a monitored account by assuming the well-known
 * collection role in that account.
 * <p>
 * Every call performs a fresh assumption. Credentials are never cached or shared between jobs,
 * so one tenant's credentials can never be used against another tenant's account.
 */
@Slf4j
@Service
public class CrossAccountRoleAssumer {

    private static final Pattern ACCOUNT_ID_PATTERN = Pattern.compile("\\d{12}");
    private static final Set<String> NOT_FOUND_ERROR_CODES = Set.of("NoSuchEntity", "NoSuchEntityException");

    private final StsClient stsClient;
    private final EvidenceCollectionProperties.Role roleProperties;
    private final Clock clock;

    public CrossAccountRoleAssumer(StsClient stsClient, EvidenceCollectionProperties properties, Clock clock) {
        this.stsClient = stsClient;
        this.roleProperties = properties.getRole();
        this.clock = clock;
    }

    /**
     * Assumes the configured collection role in the target account.
     */
    public ScopedCredentials assume(final String targetAccountId) {
        return assume(targetAccountId, roleProperties.getName());
    }

    /**
     * Assumes {@code roleName} in the target account.
     *
     * @throws RoleAssumptionException with {@link AssumeFailureReason#DENIED} when the trust relationship is missing,
     *                                 {@link AssumeFailureReason#NOT_FOUND} when the role does not exist, or
     *                                 {@link AssumeFailureReason#TIMEOUT} when the call exceeds its bound
     */
    public ScopedCredentials assume(final String targetAccountId, final String roleName) {
        final String roleArn = roleArnFor(targetAccountId, roleName);
        log.info("Assuming role {} for account {}", roleArn, targetAccountId);

        final AssumeRoleRequest request = AssumeRoleRequest.builder()
                .roleArn(roleArn)
                .roleSessionName(roleProperties.getSessionName())
                .durationSeconds((int) roleProperties.getSessionDuration().toSeconds())
                .build();

        final AssumeRoleResponse response;
        try {
            response = stsClient.assumeRole(request);
        } catch (final SdkException e) {
            throw translate(roleArn, e);
        }

        final Credentials credentials = response.credentials();
        if (credentials == null) {
            throw new RoleAssumptionException(AssumeFailureReason.DENIED, roleArn,
                    "STS returned no credentials for " + roleArn, null);
        }
        final ScopedCredentials scoped = new ScopedCredentials(targetAccountId, roleArn, credentials.accessKeyId(),
                credentials.secretAccessKey(), credentials.sessionToken(), credentials.expiration());
        if (scoped.isExpired(clock)) {
            throw new RoleAssumptionException(AssumeFailureReason.DENIED, roleArn,
                    "STS returned already-expired credentials for " + roleArn, null);
        }

        log.info("Assumed role {} (credentials expire at {})", roleArn, scoped.expiration());
        return scoped;
    }

    /**
     * Builds the role ARN for an account. The account id must be exactly twelve digits.
     */
    public static String roleArnFor(final String accountId, final String roleName) {
        if (accountId == null || !ACCOUNT_ID_PATTERN.matcher(accountId).matches()) {
            throw new IllegalArgumentException("Invalid AWS account id: " + accountId);
        }
        return String.format("arn:aws:iam::%s:role/%s", accountId, roleName);
    }

    private RoleAssumptionException translate(final String roleArn, final SdkException e) {
        final AssumeFailureReason reason = classify(e);
        log.warn("Role assumption for {} failed ({}): {}", roleArn, reason, e.getMessage());
        return new RoleAssumptionException(reason, roleArn,
                String.format("Could not assume %s: %s", roleArn, e.getMessage()), e);
    }

    static AssumeFailureReason classify(final SdkException e) {
        if (e instanceof ApiCallTimeoutException || e instanceof ApiCallAttemptTimeoutException) {
            return AssumeFailureReason.TIMEOUT;
        }
        if (e instanceof AwsServiceException serviceException) {
            final String errorCode = serviceException.awsErrorDetails() != null
                    ? serviceException.awsErrorDetails().errorCode()
                    : null;
            if (serviceException.statusCode() == 404 || NOT_FOUND_ERROR_CODES.contains(errorCode)) {
                return AssumeFailureReason.NOT_FOUND;
            }
            return AssumeFailureReason.DENIED;
        }
        if (e instanceof SdkClientException) {
            // Network-level failure: STS could not be reached within the bound.
            return AssumeFailureReason.TIMEOUT;
        }
        return AssumeFailureReason.DENIED;
    }
}
