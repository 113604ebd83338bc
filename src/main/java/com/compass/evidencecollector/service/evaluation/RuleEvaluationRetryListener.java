package com.compass.evidencecollector.service.evaluation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component("ruleEvaluationRetryListener")
public class RuleEvaluationRetryListener implements RetryListener {

    /**
     * Called after a failed attempt. The label is the context prefix set by {@link RuleEvaluationClient}.
     */
    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
        Object label = context.getAttribute(RetryContext.NAME);
        log.warn("[{}] Rule evaluation call failed on attempt {}. Error: {}",
                label != null ? label : "Unknown Context",
                context.getRetryCount(),
                throwable.getMessage());
    }

    @Override
    public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
        if (throwable != null && context.getRetryCount() > 1) {
            log.error("[{}] Rule evaluation gave up after {} attempts.", context.getAttribute(RetryContext.NAME),
                    context.getRetryCount());
        }
    }
}
