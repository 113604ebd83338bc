package com.compass.evidencecollector.service.evaluation;

import com.compass.evidencecollector.config.EvidenceCollectionProperties;
import com.compass.evidencecollector.exception.EvaluationFailureReason;
import com.compass.evidencecollector.exception.RuleEvaluationException;
import com.compass.evidencecollector.model.evaluation.ComplianceType;
import com.compass.evidencecollector.model.evaluation.RuleEvaluation;
import com.compass.evidencecollector.model.evaluation.RulePage;
import com.compass.evidencecollector.model.evaluation.ScopedCredentials;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.RetryContext;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Lists the compliance rules visible to a job's scoped credentials, keeps those whose name
 * starts with one of the template prefixes, and fetches each matching rule's compliance state.
 * <ul>
 *     <li>Every listing page is read before filtering, so rules on later pages are never dropped.</li>
 *     <li>A matching rule the source reports nothing for, or reports zero evaluated resources for,
 *     is kept as {@code INSUFFICIENT_DATA}.</li>
 *     <li>Throttled calls are retried with exponential backoff; other failures escalate at once.</li>
 *     <li>The whole listing and describing must finish within the configured evaluation timeout.</li>
 * </ul>
 */
@Slf4j
@Service
public class RuleEvaluationClient {

    private final RuleEvaluationSource source;
    private final RetryTemplate retryTemplate;
    private final EvidenceCollectionProperties.Evaluation evaluationProperties;
    private final Clock clock;

    public RuleEvaluationClient(RuleEvaluationSource source,
                                @Qualifier("ruleEvaluationRetryTemplate") RetryTemplate retryTemplate,
                                EvidenceCollectionProperties properties,
                                Clock clock) {
        this.source = source;
        this.retryTemplate = retryTemplate;
        this.evaluationProperties = properties.getEvaluation();
        this.clock = clock;
    }

    /**
     * Returns the evaluations of every rule matching any of {@code prefixes}, sorted by rule name.
     *
     * @throws RuleEvaluationException when the source denies access, stays throttled after the
     *                                 retry budget, is unavailable, or the timeout is exceeded
     */
    public List<RuleEvaluation> listMatchingRules(final ScopedCredentials credentials,
                                                  final String region,
                                                  final Collection<String> prefixes) {
        final String contextInfo = "account=" + credentials.accountId() + " region=" + region;
        final Instant deadline = clock.instant().plus(evaluationProperties.getTimeout());

        try (RuleEvaluationSource.Session session = source.open(credentials, region)) {
            final List<String> allRules = listAllRules(session, credentials, deadline, contextInfo);
            final List<String> matching = filterByPrefixes(allRules, prefixes);
            log.info("[{}] {} of {} rules match prefixes {}", contextInfo, matching.size(), allRules.size(), prefixes);

            if (matching.isEmpty()) {
                return List.of();
            }
            return describe(session, credentials, matching, deadline, contextInfo);
        }
    }

    /**
     * Keeps rule names that start with any of the prefixes. Matching is a case-sensitive,
     * literal prefix comparison; duplicates are removed and input order is kept.
     */
    public static List<String> filterByPrefixes(final Collection<String> ruleNames, final Collection<String> prefixes) {
        final Set<String> matching = new LinkedHashSet<>();
        for (final String ruleName : ruleNames) {
            if (ruleName != null && prefixes.stream().anyMatch(ruleName::startsWith)) {
                matching.add(ruleName);
            }
        }
        return new ArrayList<>(matching);
    }

    private List<String> listAllRules(final RuleEvaluationSource.Session session,
                                      final ScopedCredentials credentials,
                                      final Instant deadline,
                                      final String contextInfo) {
        final List<String> ruleNames = new ArrayList<>();
        String nextToken = null;
        int pages = 0;
        do {
            checkBudget(credentials, deadline, contextInfo);
            final String token = nextToken;
            final RulePage page = withRetry(contextInfo + " listRules", () -> session.listRules(token));
            ruleNames.addAll(page.ruleNames());
            nextToken = page.hasNextPage() ? page.nextToken() : null;
            pages++;
        } while (nextToken != null);
        log.debug("[{}] Listed {} rules across {} page(s)", contextInfo, ruleNames.size(), pages);
        return ruleNames;
    }

    private List<RuleEvaluation> describe(final RuleEvaluationSource.Session session,
                                          final ScopedCredentials credentials,
                                          final List<String> ruleNames,
                                          final Instant deadline,
                                          final String contextInfo) {
        final int batchSize = Math.max(1, evaluationProperties.getDescribeBatchSize());
        final Map<String, RuleEvaluation> byName = new HashMap<>();

        for (int from = 0; from < ruleNames.size(); from += batchSize) {
            checkBudget(credentials, deadline, contextInfo);
            final List<String> chunk = ruleNames.subList(from, Math.min(from + batchSize, ruleNames.size()));
            final List<RuleEvaluation> described =
                    withRetry(contextInfo + " describeCompliance", () -> session.describeCompliance(List.copyOf(chunk)));
            for (final RuleEvaluation evaluation : described) {
                if (chunk.contains(evaluation.ruleName())) {
                    byName.put(evaluation.ruleName(), evaluation);
                }
            }
        }

        final List<RuleEvaluation> evaluations = new ArrayList<>(ruleNames.size());
        for (final String ruleName : ruleNames) {
            final RuleEvaluation evaluation = byName.get(ruleName);
            if (evaluation == null) {
                log.info("[{}] No compliance data for rule {}; recording INSUFFICIENT_DATA", contextInfo, ruleName);
                evaluations.add(RuleEvaluation.insufficientData(ruleName));
            } else if (Integer.valueOf(0).equals(evaluation.evaluatedResourceCount())
                    && evaluation.complianceType() != ComplianceType.INSUFFICIENT_DATA) {
                log.info("[{}] Rule {} reported {} over zero resources; recording INSUFFICIENT_DATA",
                        contextInfo, ruleName, evaluation.complianceType());
                evaluations.add(new RuleEvaluation(ruleName, ComplianceType.INSUFFICIENT_DATA, 0));
            } else {
                evaluations.add(evaluation);
            }
        }
        evaluations.sort(Comparator.comparing(RuleEvaluation::ruleName));
        return evaluations;
    }

    private <T> T withRetry(final String label, final Supplier<T> call) {
        return retryTemplate.execute((RetryContext context) -> {
            context.setAttribute(RetryContext.NAME, label);
            return call.get();
        });
    }

    private void checkBudget(final ScopedCredentials credentials, final Instant deadline, final String contextInfo) {
        final Instant now = clock.instant();
        if (!now.isBefore(deadline)) {
            throw new RuleEvaluationException(EvaluationFailureReason.UNAVAILABLE, String.format(
                    "[%s] Rule evaluation exceeded its %s budget", contextInfo, evaluationProperties.getTimeout()));
        }
        if (credentials.isExpired(clock)) {
            throw new RuleEvaluationException(EvaluationFailureReason.UNAVAILABLE, String.format(
                    "[%s] Scoped credentials expired at %s during rule evaluation", contextInfo, credentials.expiration()));
        }
    }
}
