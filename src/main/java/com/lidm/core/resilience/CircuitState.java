package com.lidm.core.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
