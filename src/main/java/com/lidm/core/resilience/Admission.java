package com.lidm.core.resilience;

/**
 * Decision of a guard (circuit breaker or rate limiter) about a single call.
 * Rejections are ordinary values, not exceptions.
 *
 * @param allowed           whether the call may proceed
 * @param reason            why it was refused, null when allowed
 * @param retryAfterSeconds hint for when a retry could succeed, 0 when unknown or allowed
 */
public record Admission(boolean allowed, RejectionReason reason, double retryAfterSeconds) {

    private static final Admission ALLOWED = new Admission(true, null, 0.0);

    public static Admission allow() {
        return ALLOWED;
    }

    public static Admission reject(RejectionReason reason, double retryAfterSeconds) {
        return new Admission(false, reason, Math.max(0.0, retryAfterSeconds));
    }

    public boolean isRejected() {
        return !allowed;
    }
}
