package com.compass.evidencecollector.service.evaluation;

import com.compass.evidencecollector.model.evaluation.RuleEvaluation;
import com.compass.evidencecollector.model.evaluation.RulePage;
import com.compass.evidencecollector.model.evaluation.ScopedCredentials;

import java.util.List;

/**
 * An account-scoped source of compliance rule evaluations, reached only through credentials
 * returned by the role assumer.
 */
public interface RuleEvaluationSource {

    /**
     * Opens a session bound to one set of scoped credentials. The session must be closed when
     * the job is done with it and must not be reused by another job.
     */
    Session open(ScopedCredentials credentials, String region);

    interface Session extends AutoCloseable {

        /**
         * Lists one page of rule names.
         *
         * @param nextToken the token from the previous page, or null for the first page
         * @throws com.compass.evidencecollector.exception.RuleEvaluationException on source errors
         */
        RulePage listRules(String nextToken);

        /**
         * Describes the aggregate compliance of the named rules. Rules the source has no data for
         * may be missing from the result.
         *
         * @throws com.compass.evidencecollector.exception.RuleEvaluationException on source errors
         */
        List<RuleEvaluation> describeCompliance(List<String> ruleNames);

        @Override
        void close();
    }
}
