package com.compass.evidencecollector.service.evaluation;

import com.compass.evidencecollector.exception.EvaluationFailureReason;
import com.compass.evidencecollector.exception.RuleEvaluationException;
import com.compass.evidencecollector.model.evaluation.ComplianceType;
import com.compass.evidencecollector.model.evaluation.RuleEvaluation;
import com.compass.evidencecollector.model.evaluation.RulePage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.config.ConfigClient;
import software.amazon.awssdk.services.config.model.Compliance;
import software.amazon.awssdk.services.config.model.ComplianceByConfigRule;
import software.amazon.awssdk.services.config.model.ComplianceContributorCount;
import software.amazon.awssdk.services.config.model.ConfigException;
import software.amazon.awssdk.services.config.model.ConfigRule;
import software.amazon.awssdk.services.config.model.DescribeComplianceByConfigRuleRequest;
import software.amazon.awssdk.services.config.model.DescribeComplianceByConfigRuleResponse;
import software.amazon.awssdk.services.config.model.DescribeConfigRulesRequest;
import software.amazon.awssdk.services.config.model.DescribeConfigRulesResponse;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AwsConfigRuleEvaluationSourceTest {

    @Mock
    private ConfigClient configClient;

    private AwsConfigRuleEvaluationSource.AwsConfigSession session;

    @BeforeEach
    void setUp() {
        session = new AwsConfigRuleEvaluationSource.AwsConfigSession(configClient);
    }

    @Test
    void listRulesReturnsNamesAndToken() {
        when(configClient.describeConfigRules(any(DescribeConfigRulesRequest.class))).thenReturn(
                DescribeConfigRulesResponse.builder()
                                           .configRules(ConfigRule.builder().configRuleName("rule-a").build(),
                                                        ConfigRule.builder().configRuleName("rule-b").build())
                                           .nextToken("next")
                                           .build());

        RulePage page = session.listRules(null);

        assertThat(page.ruleNames()).containsExactly("rule-a", "rule-b");
        assertThat(page.hasNextPage()).isTrue();
    }

    @Test
    void describeComplianceFollowsPagesAndMapsTypes() {
        when(configClient.describeComplianceByConfigRule(any(DescribeComplianceByConfigRuleRequest.class)))
                .thenReturn(DescribeComplianceByConfigRuleResponse.builder()
                                                                  .complianceByConfigRules(item("rule-a", "NON_COMPLIANT", 4))
                                                                  .nextToken("p2")
                                                                  .build())
                .thenReturn(DescribeComplianceByConfigRuleResponse.builder()
                                                                  .complianceByConfigRules(item("rule-b", "COMPLIANT", null),
                                                                                           item("rule-c", "SOMETHING_NEW", null))
                                                                  .build());

        List<RuleEvaluation> evaluations = session.describeCompliance(List.of("rule-a", "rule-b", "rule-c"));

        assertThat(evaluations).containsExactly(
                new RuleEvaluation("rule-a", ComplianceType.NON_COMPLIANT, 4),
                new RuleEvaluation("rule-b", ComplianceType.COMPLIANT, null),
                new RuleEvaluation("rule-c", ComplianceType.INSUFFICIENT_DATA, null));
    }

    @Test
    void ruleWithoutComplianceIsInsufficientData() {
        RuleEvaluation evaluation = AwsConfigRuleEvaluationSource.AwsConfigSession.toEvaluation(
                ComplianceByConfigRule.builder().configRuleName("rule-x").build());

        assertThat(evaluation).isEqualTo(RuleEvaluation.insufficientData("rule-x"));
    }

    @Test
    void throttlingIsClassifiedAsThrottled() {
        when(configClient.describeConfigRules(any(DescribeConfigRulesRequest.class)))
                .thenThrow(configError(400, "ThrottlingException"));

        assertThatThrownBy(() -> session.listRules(null))
                .isInstanceOfSatisfying(RuleEvaluationException.class,
                        e -> assertThat(e.getFailureReason()).isEqualTo(EvaluationFailureReason.THROTTLED));
    }

    @Test
    void accessDeniedIsClassified() {
        assertThat(AwsConfigRuleEvaluationSource.AwsConfigSession.classify(configError(400, "AccessDeniedException")))
                .isEqualTo(EvaluationFailureReason.ACCESS_DENIED);
        assertThat(AwsConfigRuleEvaluationSource.AwsConfigSession.classify(configError(503, "ServiceUnavailable")))
                .isEqualTo(EvaluationFailureReason.UNAVAILABLE);
    }

    @Test
    void closeClosesTheClient() {
        session.close();

        verify(configClient).close();
    }

    private static ComplianceByConfigRule item(String name, String type, Integer count) {
        Compliance.Builder compliance = Compliance.builder().complianceType(type);
        if (count != null) {
            compliance.complianceContributorCount(ComplianceContributorCount.builder().cappedCount(count).build());
        }
        return ComplianceByConfigRule.builder().configRuleName(name).compliance(compliance.build()).build();
    }

    private static ConfigException configError(int status, String code) {
        return (ConfigException) ConfigException.builder()
                                                .statusCode(status)
                                                .awsErrorDetails(AwsErrorDetails.builder().errorCode(code).build())
                                                .message(code)
                                                .build();
    }
}
