package com.lidm.core.model;

/**
 * Outcome of one attempt to reach a backend, as recorded in the execution trace.
 */
public enum DispatchOutcome {
    /** Served by the requested tier. */
    SUCCESS,
    /** Call reached the backend and failed or timed out. */
    FAILURE,
    /** Served by a tier other than the one requested. */
    FALLBACK,
    CIRCUIT_OPEN,
    RATE_LIMITED,
    /** No backend could be tried at all. */
    UNAVAILABLE;

    public boolean succeeded() {
        return this == SUCCESS || this == FALLBACK;
    }
}
