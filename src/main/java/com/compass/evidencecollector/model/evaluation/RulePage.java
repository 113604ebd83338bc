package com.compass.evidencecollector.model.evaluation;

import java.util.List;

/**
 * One page of rule names from the evaluation source.
 *
 * @param ruleNames the rule names on this page
 * @param nextToken the continuation token, or null on the last page
 */
public record RulePage(List<String> ruleNames, String nextToken) {

    public boolean hasNextPage() {
        return nextToken != null && !nextToken.isEmpty();
    }
}
