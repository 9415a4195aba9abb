package com.lidm.core.resilience;

/**
 * Why a guard refused to let a call through.
 */
public enum RejectionReason {
    CIRCUIT_OPEN,
    RATE_LIMITED
}
