package com.compass.evidencecollector.model.evaluation;

/**
 * Immutable copy of a template rule entry taken at dispatch time.
 */
public record RuleSelector(String prefix, String link) {
}
