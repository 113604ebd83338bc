package com.compass.evidencecollector.model.evaluation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A read-only view of a job template, taken once per job attempt. Edits made to the
 * template while the job runs do not affect it.
 */
public record JobTemplateSnapshot(String id,
                                  String name,
                                  String documentationLink,
                                  String region,
                                  List<RuleSelector> rules) {

    public JobTemplateSnapshot {
        rules = List.copyOf(rules);
    }

    /**
     * The configured prefixes in template order, without duplicates.
     */
    public Set<String> prefixes() {
        final Set<String> prefixes = new LinkedHashSet<>();
        rules.forEach(rule -> prefixes.add(rule.prefix()));
        return prefixes;
    }
}
