package com.compass.evidencecollector.service.evaluation;

import com.compass.evidencecollector.exception.EvaluationFailureReason;
import com.compass.evidencecollector.exception.RuleEvaluationException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

/**
 * Retries only {@link EvaluationFailureReason#THROTTLED} failures, up to a fixed number of attempts.
 * Access and availability failures escalate immediately.
 */
public class ThrottlingRetryPolicy extends SimpleRetryPolicy {

    public ThrottlingRetryPolicy(int maxAttempts) {
        super(maxAttempts);
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable lastThrowable = context.getLastThrowable();
        if (lastThrowable != null && !isThrottled(lastThrowable)) {
            return false;
        }
        return super.canRetry(context);
    }

    private static boolean isThrottled(Throwable throwable) {
        return throwable instanceof RuleEvaluationException evaluationException
                && evaluationException.getFailureReason() == EvaluationFailureReason.THROTTLED;
    }
}
