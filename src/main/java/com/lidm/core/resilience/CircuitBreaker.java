package com.lidm.core.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Three-state circuit breaker guarding one named resource (a backend tier).
 * <p>
 * CLOSED passes every call and opens after {@code failureThreshold} consecutive
 * failures. OPEN rejects every call until the current backoff has elapsed since
 * the last failure, then moves to HALF_OPEN. HALF_OPEN admits at most
 * {@code successThreshold} concurrent probes: a probe failure re-opens the
 * circuit with a longer backoff, enough probe successes close it and restore
 * the initial backoff.
 * <p>
 * The lock only protects bookkeeping; callers run the guarded operation
 * outside of it. Transition listeners are notified after the lock is released.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final Consumer<CircuitTransition> transitionListener;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private int probesInFlight;
    private Instant lastFailureTime;
    private Duration currentBackoff;

    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private long rejectedCalls;
    private long stateChanges;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC(), transition -> {});
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock,
                          Consumer<CircuitTransition> transitionListener) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.transitionListener = transitionListener == null ? transition -> {} : transitionListener;
        this.currentBackoff = config.recoveryTimeout();
    }

    public String name() {
        return name;
    }

    /**
     * Asks whether a call may proceed. An allowed admission must be followed by
     * exactly one of {@link #recordSuccess()}, {@link #recordFailure()} or
     * {@link #releasePermission()}.
     */
    public Admission tryAcquire() {
        CircuitTransition transition = null;
        Admission admission;
        lock.lock();
        try {
            Instant now = clock.instant();
            if (state == CircuitState.OPEN && backoffElapsed(now)) {
                transition = moveTo(CircuitState.HALF_OPEN, now);
            }
            switch (state) {
                case CLOSED -> {
                    totalCalls++;
                    admission = Admission.allow();
                }
                case HALF_OPEN -> {
                    if (probesInFlight < config.successThreshold()) {
                        probesInFlight++;
                        totalCalls++;
                        admission = Admission.allow();
                    } else {
                        rejectedCalls++;
                        admission = Admission.reject(RejectionReason.CIRCUIT_OPEN, 0.0);
                    }
                }
                default -> {
                    rejectedCalls++;
                    admission = Admission.reject(RejectionReason.CIRCUIT_OPEN, remainingBackoffSeconds(now));
                }
            }
        } finally {
            lock.unlock();
        }
        notifyListener(transition);
        return admission;
    }

    public void recordSuccess() {
        CircuitTransition transition = null;
        lock.lock();
        try {
            successfulCalls++;
            consecutiveFailures = 0;
            consecutiveSuccesses++;
            if (state == CircuitState.HALF_OPEN) {
                probesInFlight = Math.max(0, probesInFlight - 1);
                if (consecutiveSuccesses >= config.successThreshold()) {
                    transition = moveTo(CircuitState.CLOSED, clock.instant());
                }
            }
        } finally {
            lock.unlock();
        }
        notifyListener(transition);
    }

    public void recordFailure() {
        CircuitTransition transition = null;
        lock.lock();
        try {
            Instant now = clock.instant();
            failedCalls++;
            consecutiveSuccesses = 0;
            consecutiveFailures++;
            lastFailureTime = now;
            if (state == CircuitState.HALF_OPEN) {
                probesInFlight = Math.max(0, probesInFlight - 1);
                transition = moveTo(CircuitState.OPEN, now);
            } else if (state == CircuitState.CLOSED && consecutiveFailures >= config.failureThreshold()) {
                transition = moveTo(CircuitState.OPEN, now);
            }
        } finally {
            lock.unlock();
        }
        notifyListener(transition);
    }

    /**
     * Gives back an admission that was never used, e.g. because a rate limiter
     * refused the call after the breaker allowed it.
     */
    public void releasePermission() {
        lock.lock();
        try {
            totalCalls = Math.max(0, totalCalls - 1);
            if (state == CircuitState.HALF_OPEN) {
                probesInFlight = Math.max(0, probesInFlight - 1);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code operation} if the circuit admits it. Exceptions thrown by the
     * operation are recorded as failures and rethrown unchanged.
     */
    public <T> GuardedCall<T> call(Callable<T> operation) throws Exception {
        Admission admission = tryAcquire();
        if (admission.isRejected()) {
            return GuardedCall.rejected(admission);
        }
        boolean succeeded = false;
        try {
            T value = operation.call();
            succeeded = true;
            return GuardedCall.completed(value);
        } finally {
            if (succeeded) {
                recordSuccess();
            } else {
                recordFailure();
            }
        }
    }

    /** Forces the circuit closed and clears counters that drive transitions. */
    public void reset() {
        CircuitTransition transition = null;
        lock.lock();
        try {
            if (state != CircuitState.CLOSED) {
                transition = moveTo(CircuitState.CLOSED, clock.instant());
            }
            consecutiveFailures = 0;
            consecutiveSuccesses = 0;
            probesInFlight = 0;
            lastFailureTime = null;
            currentBackoff = config.recoveryTimeout();
        } finally {
            lock.unlock();
        }
        notifyListener(transition);
    }

    /**
     * Current state. Reading it does not trigger the OPEN to HALF_OPEN move;
     * only an admission attempt does.
     */
    public CircuitState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            return new CircuitBreakerSnapshot(name, state, consecutiveFailures, consecutiveSuccesses,
                    lastFailureTime, currentBackoff, totalCalls, successfulCalls, failedCalls,
                    rejectedCalls, stateChanges);
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private CircuitTransition moveTo(CircuitState target, Instant now) {
        CircuitState previous = state;
        state = target;
        stateChanges++;
        switch (target) {
            case OPEN -> {
                currentBackoff = min(multiply(currentBackoff, config.backoffMultiplier()), config.maxBackoff());
                probesInFlight = 0;
            }
            case HALF_OPEN -> {
                consecutiveSuccesses = 0;
                probesInFlight = 0;
            }
            case CLOSED -> {
                consecutiveFailures = 0;
                currentBackoff = config.recoveryTimeout();
            }
        }
        return new CircuitTransition(name, previous, target, currentBackoff, now);
    }

    private boolean backoffElapsed(Instant now) {
        return lastFailureTime == null || !now.isBefore(lastFailureTime.plus(currentBackoff));
    }

    private double remainingBackoffSeconds(Instant now) {
        if (lastFailureTime == null) {
            return 0.0;
        }
        Duration remaining = Duration.between(now, lastFailureTime.plus(currentBackoff));
        return remaining.isNegative() ? 0.0 : remaining.toMillis() / 1000.0;
    }

    private void notifyListener(CircuitTransition transition) {
        if (transition == null) {
            return;
        }
        log.info("Circuit '{}' {} -> {} (backoff {}s)", name, transition.from(), transition.to(),
                transition.currentBackoff().toSeconds());
        try {
            transitionListener.accept(transition);
        } catch (Exception e) {
            log.warn("Circuit transition listener failed for '{}': {}", name, e.getMessage(), e);
        }
    }

    private static Duration multiply(Duration duration, double factor) {
        return Duration.ofMillis(Math.round(duration.toMillis() * factor));
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
