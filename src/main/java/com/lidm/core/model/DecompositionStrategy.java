package com.lidm.core.model;

/**
 * Whether a query was answered by a single backend call or split into subtasks.
 */
public enum DecompositionStrategy {
    DIRECT,
    DECOMPOSE
}
