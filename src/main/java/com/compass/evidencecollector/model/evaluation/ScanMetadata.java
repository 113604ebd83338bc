package com.compass.evidencecollector.model.evaluation;

import java.util.List;

/**
 * @param ruleCategories the template's rule categories with their documentation links, in template order
 */
public record ScanMetadata(String templateId,
                           String region,
                           List<String> rulePrefixes,
                           List<RuleSelector> ruleCategories,
                           String roleArn) {

    public ScanMetadata {
        rulePrefixes = List.copyOf(rulePrefixes);
        ruleCategories = List.copyOf(ruleCategories);
    }
}
