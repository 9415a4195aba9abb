package com.lidm.core.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket holding at most {@code burst} tokens and refilled continuously at
 * {@code rate} tokens per second. Tokens are only ever added by elapsed time and
 * only ever removed by a successful acquire.
 * <p>
 * {@link #acquireOrWait(int, Duration)} sleeps outside the lock.
 */
public class TokenBucketRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);
    private static final long MIN_SLEEP_MILLIS = 1;

    private final String name;
    private final double rate;
    private final int burst;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private Instant lastRefill;
    private long grantedRequests;
    private long rejectedRequests;

    public TokenBucketRateLimiter(String name, double rate, int burst) {
        this(name, rate, burst, Clock.systemUTC());
    }

    public TokenBucketRateLimiter(String name, double rate, int burst, Clock clock) {
        if (!(rate > 0.0) || Double.isInfinite(rate)) {
            throw new IllegalArgumentException("rate must be a positive number, got " + rate);
        }
        if (burst < 1) {
            throw new IllegalArgumentException("burst must be >= 1, got " + burst);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.rate = rate;
        this.burst = burst;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.tokens = burst;
        this.lastRefill = clock.instant();
    }

    public String name() {
        return name;
    }

    public double rate() {
        return rate;
    }

    public int burst() {
        return burst;
    }

    public boolean tryAcquire() {
        return tryAcquire(1);
    }

    /** Takes {@code n} tokens if available; never blocks. */
    public boolean tryAcquire(int n) {
        return admit(n).allowed();
    }

    /**
     * Like {@link #tryAcquire(int)} but returns the refusal as data, carrying the
     * time until {@code n} tokens would be available.
     */
    public Admission admit(int n) {
        requirePositive(n);
        lock.lock();
        try {
            refill();
            if (tokens >= n) {
                tokens -= n;
                grantedRequests++;
                return Admission.allow();
            }
            rejectedRequests++;
            return Admission.reject(RejectionReason.RATE_LIMITED, secondsUntil(n));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Retries {@link #tryAcquire(int)} until it succeeds or {@code maxWait} runs out,
     * sleeping for the shorter of the time to refill and the time left. A request
     * larger than the burst can never be satisfied and fails immediately.
     * An interrupt stops waiting, keeps the interrupt flag set and returns false.
     */
    public boolean acquireOrWait(int n, Duration maxWait) {
        requirePositive(n);
        if (n > burst) {
            log.debug("Rate limiter '{}' cannot grant {} tokens with burst {}", name, n, burst);
            return false;
        }
        // The wait budget is real elapsed time, independent of the refill clock.
        long deadline = System.nanoTime() + maxWait.toNanos();
        while (true) {
            Admission admission = admit(n);
            if (admission.allowed()) {
                return true;
            }
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis <= 0) {
                return false;
            }
            long refillMillis = (long) Math.ceil(admission.retryAfterSeconds() * 1000.0);
            long sleepMillis = Math.max(MIN_SLEEP_MILLIS, Math.min(refillMillis, remainingMillis));
            try {
                TimeUnit.MILLISECONDS.sleep(sleepMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    /** Seconds until {@code n} tokens will be available; 0 if they already are. */
    public double retryAfter(int n) {
        requirePositive(n);
        lock.lock();
        try {
            refill();
            return secondsUntil(n);
        } finally {
            lock.unlock();
        }
    }

    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    /** Refills the bucket to full capacity. */
    public void reset() {
        lock.lock();
        try {
            tokens = burst;
            lastRefill = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    public RateLimitSnapshot snapshot() {
        lock.lock();
        try {
            refill();
            return new RateLimitSnapshot(name, rate, burst, tokens, grantedRequests, rejectedRequests);
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private void refill() {
        Instant now = clock.instant();
        if (now.isAfter(lastRefill)) {
            double elapsedSeconds = Duration.between(lastRefill, now).toNanos() / 1_000_000_000.0;
            tokens = Math.min(burst, tokens + elapsedSeconds * rate);
            lastRefill = now;
        }
    }

    // Caller holds the lock.
    private double secondsUntil(int n) {
        if (tokens >= n) {
            return 0.0;
        }
        return (n - tokens) / rate;
    }

    private static void requirePositive(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("token count must be >= 1, got " + n);
        }
    }
}
