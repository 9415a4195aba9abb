package com.lidm.core.backend;

import com.lidm.core.model.Tier;

/**
 * Thrown when the pool has no live backend for a tier or any fallback.
 */
public class NoBackendAvailableException extends RuntimeException {

    public NoBackendAvailableException(Tier requested) {
        super("No live backend for tier " + requested + " or any fallback tier");
    }
}
