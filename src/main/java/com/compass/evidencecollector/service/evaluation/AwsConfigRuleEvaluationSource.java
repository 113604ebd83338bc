package com.compass.evidencecollector.service.evaluation;

import com.compass.evidencecollector.config.EvidenceCollectionProperties;
import com.compass.evidencecollector.exception.EvaluationFailureReason;
import com.compass.evidencecollector.exception.RuleEvaluationException;
import com.compass.evidencecollector.model.evaluation.ComplianceType;
import com.compass.evidencecollector.model.evaluation.RuleEvaluation;
import com.compass.evidencecollector.model.evaluation.RulePage;
import com.compass.evidencecollector.model.evaluation.ScopedCredentials;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.config.ConfigClient;
import software.amazon.awssdk.services.config.ConfigClientBuilder;
import software.amazon.awssdk.services.config.model.Compliance;
import software.amazon.awssdk.services.config.model.ComplianceByConfigRule;
import software.amazon.awssdk.services.config.model.ConfigRule;
import software.amazon.awssdk.services.config.model.DescribeComplianceByConfigRuleRequest;
import software.amazon.awssdk.services.config.model.DescribeComplianceByConfigRuleResponse;
import software.amazon.awssdk.services.config.model.DescribeConfigRulesRequest;
import software.amazon.awssdk.services.config.model.DescribeConfigRulesResponse;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * A {@link RuleEvaluationSource} backed by AWS Config rules in the target account.
 * <p>
 * SDK-level retries are disabled; throttling is surfaced as {@link EvaluationFailureReason#THROTTLED}
 * so that {@link RuleEvaluationClient} can apply its own bounded backoff.
 */
@Slf4j
@Component
public class AwsConfigRuleEvaluationSource implements RuleEvaluationSource {

    private static final Set<String> ACCESS_DENIED_ERROR_CODES = Set.of(
            "AccessDenied", "AccessDeniedException", "UnauthorizedOperation", "UnrecognizedClientException",
            "ExpiredToken", "ExpiredTokenException");

    private final SdkHttpClient httpClient;
    private final EvidenceCollectionProperties.Evaluation evaluationProperties;
    private final String endpoint;

    public AwsConfigRuleEvaluationSource(SdkHttpClient evaluationHttpClient,
                                         EvidenceCollectionProperties properties,
                                         @Value("${aws.endpoint:}") String endpoint) {
        this.httpClient = evaluationHttpClient;
        this.evaluationProperties = properties.getEvaluation();
        this.endpoint = endpoint;
    }

    @Override
    public Session open(final ScopedCredentials credentials, final String region) {
        final ConfigClientBuilder builder = ConfigClient.builder()
                .region(Region.of(region))
                .credentialsProvider(credentials.toCredentialsProvider())
                .httpClient(httpClient)
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                                                                  .apiCallTimeout(evaluationProperties.getTimeout())
                                                                  .retryPolicy(RetryPolicy.none())
                                                                  .build());
        if (StringUtils.hasText(endpoint)) {
            builder.endpointOverride(URI.create(endpoint));
        }
        log.debug("Opened AWS Config session for account {} in {}", credentials.accountId(), region);
        return new AwsConfigSession(builder.build());
    }

    /**
     * One job's view of AWS Config, bound to that job's assumed credentials.
     */
    static class AwsConfigSession implements Session {

        private final ConfigClient configClient;

        AwsConfigSession(final ConfigClient configClient) {
            this.configClient = configClient;
        }

        @Override
        public RulePage listRules(final String nextToken) {
            final DescribeConfigRulesResponse response = call("DescribeConfigRules", () ->
                    configClient.describeConfigRules(DescribeConfigRulesRequest.builder().nextToken(nextToken).build()));
            final List<String> names = response.configRules().stream().map(ConfigRule::configRuleName).toList();
            return new RulePage(names, response.nextToken());
        }

        @Override
        public List<RuleEvaluation> describeCompliance(final List<String> ruleNames) {
            final List<RuleEvaluation> evaluations = new ArrayList<>();
            String nextToken = null;
            do {
                final String token = nextToken;
                final DescribeComplianceByConfigRuleResponse response = call("DescribeComplianceByConfigRule", () ->
                        configClient.describeComplianceByConfigRule(DescribeComplianceByConfigRuleRequest.builder()
                                                                                                        .configRuleNames(ruleNames)
                                                                                                        .nextToken(token)
                                                                                                        .build()));
                response.complianceByConfigRules().forEach(item -> evaluations.add(toEvaluation(item)));
                nextToken = response.nextToken();
            } while (StringUtils.hasText(nextToken));
            return evaluations;
        }

        @Override
        public void close() {
            configClient.close();
        }

        static RuleEvaluation toEvaluation(final ComplianceByConfigRule item) {
            final Compliance compliance = item.compliance();
            if (compliance == null) {
                return RuleEvaluation.insufficientData(item.configRuleName());
            }
            final Integer count = compliance.complianceContributorCount() != null
                    ? compliance.complianceContributorCount().cappedCount()
                    : null;
            return new RuleEvaluation(item.configRuleName(),
                                      ComplianceType.fromSourceValue(compliance.complianceTypeAsString()),
                                      count);
        }

        private static <T> T call(final String operation, final Supplier<T> request) {
            try {
                return request.get();
            } catch (final SdkException e) {
                final EvaluationFailureReason reason = classify(e);
                throw new RuleEvaluationException(reason,
                        String.format("AWS Config %s failed (%s): %s", operation, reason, e.getMessage()), e);
            }
        }

        static EvaluationFailureReason classify(final SdkException e) {
            if (e instanceof AwsServiceException serviceException) {
                if (serviceException.isThrottlingException()) {
                    return EvaluationFailureReason.THROTTLED;
                }
                final String errorCode = serviceException.awsErrorDetails() != null
                        ? serviceException.awsErrorDetails().errorCode()
                        : null;
                if (serviceException.statusCode() == 403 || ACCESS_DENIED_ERROR_CODES.contains(errorCode)) {
                    return EvaluationFailureReason.ACCESS_DENIED;
                }
                return EvaluationFailureReason.UNAVAILABLE;
            }
            if (e instanceof SdkClientException) {
                return EvaluationFailureReason.UNAVAILABLE;
            }
            return EvaluationFailureReason.UNAVAILABLE;
        }
    }
}
