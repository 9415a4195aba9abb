package com.lidm.core.resilience;

import java.util.Optional;

/**
 * Result of running an operation through a {@link CircuitBreaker}: either the
 * operation's value or the admission that refused it.
 */
public final class GuardedCall<T> {

    private final T value;
    private final Admission admission;

    private GuardedCall(T value, Admission admission) {
        this.value = value;
        this.admission = admission;
    }

    static <T> GuardedCall<T> completed(T value) {
        return new GuardedCall<>(value, Admission.allow());
    }

    static <T> GuardedCall<T> rejected(Admission admission) {
        return new GuardedCall<>(null, admission);
    }

    public boolean isRejected() {
        return admission.isRejected();
    }

    public Admission admission() {
        return admission;
    }

    /** The operation's value; empty when rejected or when the operation returned null. */
    public Optional<T> value() {
        return Optional.ofNullable(value);
    }
}
