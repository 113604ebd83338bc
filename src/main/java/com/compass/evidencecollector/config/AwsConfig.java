package com.compass.evidencecollector.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.SqsAsyncClientBuilder;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.StsClientBuilder;

import java.net.URI;

/**
 * Configures and provides AWS SDK client beans for SQS and STS.
 * This configuration dynamically selects the credential strategy based on the active Spring profile.
 * Clients for the monitored accounts are not beans: they are built per job from assumed credentials.
 */
@Slf4j
@Configuration
public class AwsConfig {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${aws.access-key:}")
    private String accessKey;

    @Value("${aws.secret-key:}")
    private String secretKey;

    /**
     * Optional endpoint override, e.g. LocalStack in the 'local' profile.
     */
    @Value("${aws.endpoint:}")
    private String endpoint;

    @Value("${aws.sqs.retry-count:4}")
    private int sqsRetryCount;

    /**
     * Determines which credentials provider to use based on the active Spring profile.
     * These are the collector's own credentials, used to call STS and SQS only.
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider(Environment environment) {
        if (environment.acceptsProfiles(Profiles.of("local"))) {
            log.info("Local profile active. Using StaticCredentialsProvider.");
            if (!StringUtils.hasText(accessKey) || !StringUtils.hasText(secretKey)) {
                throw new IllegalArgumentException(
                        "aws.access-key and aws.secret-key must be set for the 'local' profile.");
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        } else {
            log.info("Non-local profile active. Using DefaultCredentialsProvider (for IAM role).");
            return DefaultCredentialsProvider.create();
        }
    }

    /**
     * Creates the STS client used for cross-account role assumption. SDK retries are disabled:
     * an assumption failure is surfaced to the pipeline, which leaves retrying to the queue.
     */
    @Bean(destroyMethod = "close")
    public StsClient stsClient(AwsCredentialsProvider credentialsProvider, EvidenceCollectionProperties properties) {
        log.info("Configuring AWS StsClient for region: {} (timeout: {})", awsRegion, properties.getRole().getTimeout());
        ClientOverrideConfiguration overrideConfiguration = ClientOverrideConfiguration.builder()
                .apiCallTimeout(properties.getRole().getTimeout())
                .retryPolicy(RetryPolicy.none())
                .build();
        StsClientBuilder builder = StsClient.builder()
                .credentialsProvider(credentialsProvider)
                .region(Region.of(awsRegion))
                .overrideConfiguration(overrideConfiguration);
        if (StringUtils.hasText(endpoint)) {
            builder.endpointOverride(URI.create(endpoint));
        }
        return builder.build();
    }

    /**
     * A shared HTTP client for the per-job rule evaluation clients. Those clients are built from
     * assumed credentials and closed after each job; the connection pool outlives them.
     */
    @Bean(destroyMethod = "close")
    public SdkHttpClient evaluationHttpClient(EvidenceCollectionProperties properties) {
        return ApacheHttpClient.builder()
                .maxConnections(Math.max(properties.getQueue().getMaxConcurrentMessages(), 10) * 2)
                .build();
    }

    /**
     * Creates the SQS async client shared by the listener container, the job publisher and
     * the dead-letter service.
     */
    @Bean
    public SqsAsyncClient sqsAsyncClient(AwsCredentialsProvider credentialsProvider) {
        log.info("Configuring AWS SqsAsyncClient for region: {}", awsRegion);
        RetryPolicy adaptiveRetryPolicy = RetryPolicy.forRetryMode(RetryMode.ADAPTIVE).toBuilder()
                .numRetries(sqsRetryCount).build();
        SqsAsyncClientBuilder builder = SqsAsyncClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(credentialsProvider)
                .overrideConfiguration(ClientOverrideConfiguration.builder().retryPolicy(adaptiveRetryPolicy).build());
        if (StringUtils.hasText(endpoint)) {
            builder.endpointOverride(URI.create(endpoint));
        }
        return builder.build();
    }
}
