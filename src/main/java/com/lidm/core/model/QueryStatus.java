package com.lidm.core.model;

/**
 * Lifecycle status of a query moving through the delegation graph.
 */
public enum QueryStatus {
    RECEIVED,
    CLASSIFIED,
    DECOMPOSED,
    DIRECT,
    AGGREGATING,
    VERIFYING,
    DONE,
    FAILED
}
