package com.lidm.core.resilience;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketRateLimiterTest {

    private MutableClock clock;
    private TokenBucketRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        limiter = new TokenBucketRateLimiter("openai", 10.0, 5, clock);
    }

    @Nested
    @DisplayName("tryAcquire")
    class TryAcquire {

        @Test
        @DisplayName("starts full and grants up to the burst")
        void grantsBurst() {
            for (int i = 0; i < 5; i++) {
                assertTrue(limiter.tryAcquire(), "token " + i);
            }
            assertFalse(limiter.tryAcquire());
        }

        @Test
        @DisplayName("refills at the configured rate")
        void refills() {
            assertTrue(limiter.tryAcquire(5));
            clock.advance(Duration.ofMillis(200));

            assertEquals(2.0, limiter.availableTokens(), 1e-9);
            assertTrue(limiter.tryAcquire(2));
            assertFalse(limiter.tryAcquire());
        }

        @Test
        @DisplayName("never refills beyond the burst")
        void capsAtBurst() {
            clock.advance(Duration.ofHours(1));
            assertEquals(5.0, limiter.availableTokens(), 1e-9);
        }

        @Test
        @DisplayName("rejects token counts below one")
        void rejectsNonPositive() {
            assertThrows(IllegalArgumentException.class, () -> limiter.tryAcquire(0));
        }
    }

    @Test
    @DisplayName("a rejection reports when enough tokens will be available")
    void rejectionCarriesRetryAfter() {
        limiter.tryAcquire(5);

        Admission admission = limiter.admit(3);

        assertTrue(admission.isRejected());
        assertEquals(RejectionReason.RATE_LIMITED, admission.reason());
        assertEquals(0.3, admission.retryAfterSeconds(), 1e-9);
        assertEquals(0.3, limiter.retryAfter(3), 1e-9);
    }

    @Nested
    @DisplayName("acquireOrWait")
    class AcquireOrWait {

        @Test
        @DisplayName("returns immediately when tokens are available")
        void immediate() {
            assertTrue(limiter.acquireOrWait(1, Duration.ZERO));
        }

        @Test
        @DisplayName("fails fast for requests larger than the burst")
        void largerThanBurst() {
            assertFalse(limiter.acquireOrWait(6, Duration.ofSeconds(10)));
        }

        @Test
        @DisplayName("gives up when the wait budget is exhausted")
        void givesUp() {
            var slow = new TokenBucketRateLimiter("slow", 0.01, 1);
            assertTrue(slow.tryAcquire());

            assertFalse(slow.acquireOrWait(1, Duration.ofMillis(50)));
        }

        @Test
        @DisplayName("waits for a refill on the system clock")
        void waitsForRefill() {
            var real = new TokenBucketRateLimiter("local", 50.0, 1);
            assertTrue(real.tryAcquire());
            long start = System.nanoTime();

            assertTrue(real.acquireOrWait(1, Duration.ofSeconds(2)));
            assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 2000);
        }

        @Test
        @DisplayName("an interrupt stops waiting and keeps the flag")
        void interrupted() {
            var real = new TokenBucketRateLimiter("slow", 0.01, 1);
            real.tryAcquire();
            Thread.currentThread().interrupt();
            try {
                assertFalse(real.acquireOrWait(1, Duration.ofSeconds(5)));
                assertTrue(Thread.currentThread().isInterrupted());
            } finally {
                Thread.interrupted();
            }
        }
    }

    @Test
    @DisplayName("concurrent callers never get more tokens than the bucket holds")
    void concurrentAcquireIsBounded() throws Exception {
        var bucket = new TokenBucketRateLimiter("anthropic", 0.001, 40, clock);
        var granted = new AtomicInteger();
        var start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 200; i++) {
                pool.submit(() -> {
                    start.await();
                    if (bucket.tryAcquire()) {
                        granted.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(40, granted.get());
        assertEquals(40, bucket.snapshot().grantedRequests());
        assertEquals(160, bucket.snapshot().rejectedRequests());
    }

    @Test
    @DisplayName("reset refills the bucket")
    void reset() {
        limiter.tryAcquire(5);
        limiter.reset();
        assertEquals(5.0, limiter.availableTokens(), 1e-9);
    }

    @Test
    @DisplayName("constructor validates rate and burst")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBucketRateLimiter("x", 0.0, 1));
        assertThrows(IllegalArgumentException.class, () -> new TokenBucketRateLimiter("x", 1.0, 0));
    }
}
