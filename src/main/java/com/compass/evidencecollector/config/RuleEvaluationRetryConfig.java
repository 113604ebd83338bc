package com.compass.evidencecollector.config;

import com.compass.evidencecollector.service.evaluation.RuleEvaluationRetryListener;
import com.compass.evidencecollector.service.evaluation.ThrottlingRetryPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Builds the retry template that absorbs transient throttling from the rule evaluation source.
 */
@Configuration
public class RuleEvaluationRetryConfig {

    @Bean("ruleEvaluationRetryTemplate")
    public RetryTemplate ruleEvaluationRetryTemplate(EvidenceCollectionProperties properties,
                                                     RuleEvaluationRetryListener retryListener) {
        EvidenceCollectionProperties.RetryConfig retry = properties.getEvaluation().getRetry();

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(retry.getInitialDelayMs());
        backOffPolicy.setMultiplier(retry.getMultiplier());
        backOffPolicy.setMaxInterval(retry.getMaxDelayMs());

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new ThrottlingRetryPolicy(retry.getAttempts()));
        template.setBackOffPolicy(backOffPolicy);
        template.registerListener(retryListener);
        return template;
    }
}
