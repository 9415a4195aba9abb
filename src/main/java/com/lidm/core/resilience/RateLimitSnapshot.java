package com.lidm.core.resilience;

/**
 * Point-in-time view of a token bucket.
 */
public record RateLimitSnapshot(
    String name,
    double rate,
    int burst,
    double availableTokens,
    long grantedRequests,
    long rejectedRequests
) {}
