package com.compass.evidencecollector.model;

/**
 * The furthest point a job attempt reached in the collection pipeline.
 */
public enum PipelineStage {
    RECEIVED,
    ROLE_ASSUMED,
    RULES_FETCHED,
    AGGREGATED,
    PERSISTED,
    FAILED
}
