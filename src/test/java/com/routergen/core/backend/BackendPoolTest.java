package com.routergen.core.backend;

import com.routergen.config.PoolSettings;
import com.routergen.core.example.GenerationTask;
import com.routergen.core.schema.ToolKind;
import com.routergen.llm.BackendErrorKind;
import com.routergen.llm.LLMClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class BackendPoolTest {

    private static final GenerationTask TASK =
            new GenerationTask(1, "Fraud Detection System", "DBA", ToolKind.SANDBOX_EXEC, "casual");

    private final AtomicLong clock = new AtomicLong(0);

    private Backend a;
    private Backend b;
    private Backend c;

    @BeforeEach
    void setUp() {
        a = backend("a");
        b = backend("b");
        c = backend("c");
    }

    // =========================================================================
    // Failover
    // =========================================================================

    @Test
    void testRetriesWalkRotationOrderAndWrap() {
        BackendPool pool = pool(new WeightedRotationStrategy(42), settings(3, 3));

        assertSame(b, pool.acquire(TASK, a));
        assertSame(c, pool.acquire(TASK, b));
        assertSame(a, pool.acquire(TASK, c));
    }

    @Test
    void testRoundRobinHandsOutInOrder() {
        BackendPool pool = pool(new RoundRobinStrategy(), settings(3, 3));

        assertSame(a, pool.acquire(TASK, null));
        assertSame(b, pool.acquire(TASK, null));
        assertSame(c, pool.acquire(TASK, null));
        assertSame(a, pool.acquire(TASK, null));
    }

    // =========================================================================
    // Rate limits
    // =========================================================================

    @Test
    void testRateLimitedBackendSkippedUntilCooldownEnds() {
        BackendPool pool = pool(new RoundRobinStrategy(), settings(3, 3));

        pool.reportFailure(a, BackendErrorKind.RATE_LIMITED);

        assertSame(b, pool.acquire(TASK, null));
        assertTrue(status(pool, "a").isCoolingDown());

        clock.addAndGet(Duration.ofSeconds(2).toNanos());
        assertFalse(status(pool, "a").isCoolingDown());
    }

    @Test
    void testCooldownDoublesUpToCap() {
        PoolSettings settings = new PoolSettings(Duration.ofSeconds(2), Duration.ofSeconds(5), 3, 3,
                Duration.ofSeconds(1), PoolSettings.Strategy.ROUND_ROBIN);
        BackendPool pool = pool(new RoundRobinStrategy(), settings);

        pool.reportFailure(a, BackendErrorKind.RATE_LIMITED);
        pool.reportFailure(a, BackendErrorKind.RATE_LIMITED);   // 4s window
        clock.addAndGet(Duration.ofMillis(3_900).toNanos());
        assertTrue(status(pool, "a").isCoolingDown());
        clock.addAndGet(Duration.ofMillis(200).toNanos());
        assertFalse(status(pool, "a").isCoolingDown());

        pool.reportFailure(a, BackendErrorKind.RATE_LIMITED);   // 8s capped to 5s
        clock.addAndGet(Duration.ofMillis(5_100).toNanos());
        assertFalse(status(pool, "a").isCoolingDown());
    }

    @Test
    void testAcquireWaitsForCooldownToEnd() {
        PoolSettings settings = new PoolSettings(Duration.ofMillis(100), Duration.ofMillis(100), 3, 3,
                Duration.ofSeconds(5), PoolSettings.Strategy.ROUND_ROBIN);
        BackendPool pool = new BackendPool(List.of(a), new RoundRobinStrategy(), settings);

        pool.reportFailure(a, BackendErrorKind.RATE_LIMITED);

        long start = System.nanoTime();
        assertSame(a, pool.acquire(TASK, null));
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 50);
    }

    @Test
    void testAcquireTimesOutWhileEverythingCoolsDown() {
        PoolSettings settings = new PoolSettings(Duration.ofSeconds(10), Duration.ofSeconds(10), 3, 3,
                Duration.ofMillis(50), PoolSettings.Strategy.ROUND_ROBIN);
        BackendPool pool = new BackendPool(List.of(a), new RoundRobinStrategy(), settings);

        pool.reportFailure(a, BackendErrorKind.RATE_LIMITED);

        NoBackendAvailableException e = assertThrows(NoBackendAvailableException.class,
                () -> pool.acquire(TASK, null));
        assertFalse(e.isFatal());
    }

    // =========================================================================
    // Hard failures and auth
    // =========================================================================

    @Test
    void testDemotionAfterConsecutiveHardFailures() {
        BackendPool pool = pool(new RoundRobinStrategy(), settings(3, 3));

        pool.reportFailure(a, BackendErrorKind.TIMEOUT);
        pool.reportFailure(a, BackendErrorKind.UNAVAILABLE);
        assertEquals(List.of(a, b, c), pool.rotationOrder());

        pool.reportFailure(a, BackendErrorKind.MALFORMED_RESPONSE);
        assertEquals(List.of(b, c, a), pool.rotationOrder());
        assertFalse(status(pool, "a").isDisabled());
    }

    @Test
    void testSuccessClearsFailureStreak() {
        BackendPool pool = pool(new RoundRobinStrategy(), settings(3, 3));

        pool.reportFailure(a, BackendErrorKind.TIMEOUT);
        pool.reportFailure(a, BackendErrorKind.TIMEOUT);
        pool.reportSuccess(a);
        pool.reportFailure(a, BackendErrorKind.TIMEOUT);
        pool.reportFailure(a, BackendErrorKind.TIMEOUT);

        assertEquals(List.of(a, b, c), pool.rotationOrder());
        assertEquals(1, status(pool, "a").getSuccesses());
        assertEquals(4, status(pool, "a").getFailures());
    }

    @Test
    void testSingleAuthFailureNeverDisables() {
        BackendPool pool = pool(new RoundRobinStrategy(), settings(3, 3));

        pool.reportFailure(a, BackendErrorKind.AUTH_FAILED);
        pool.reportFailure(a, BackendErrorKind.AUTH_FAILED);
        assertFalse(status(pool, "a").isDisabled());

        pool.reportFailure(a, BackendErrorKind.AUTH_FAILED);
        assertTrue(status(pool, "a").isDisabled());
        assertFalse(pool.isExhausted());

        for (int i = 0; i < 10; i++) {
            assertNotSame(a, pool.acquire(TASK, null));
        }
    }

    @Test
    void testAllBackendsDisabledIsFatal() {
        BackendPool pool = pool(new RoundRobinStrategy(), settings(3, 1));

        pool.reportFailure(a, BackendErrorKind.AUTH_FAILED);
        pool.reportFailure(b, BackendErrorKind.AUTH_FAILED);
        pool.reportFailure(c, BackendErrorKind.AUTH_FAILED);

        assertTrue(pool.isExhausted());
        NoBackendAvailableException e = assertThrows(NoBackendAvailableException.class,
                () -> pool.acquire(TASK, null));
        assertTrue(e.isFatal());
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private BackendPool pool(BackendSelectionStrategy strategy, PoolSettings settings) {
        return new BackendPool(List.of(a, b, c), strategy, settings, clock::get);
    }

    private static PoolSettings settings(int demotionThreshold, int authFailureLimit) {
        return new PoolSettings(Duration.ofSeconds(2), Duration.ofSeconds(60), demotionThreshold,
                authFailureLimit, Duration.ofSeconds(1), PoolSettings.Strategy.ROUND_ROBIN);
    }

    private static BackendStatus status(BackendPool pool, String id) {
        return pool.snapshot().stream().filter(s -> s.getId().equals(id)).findFirst().orElseThrow();
    }

    private static Backend backend(String id) {
        return new Backend(id, new SilentClient(id), 1.0, Set.of());
    }

    /** Never called by the pool; backends only need a client to exist. */
    private static final class SilentClient implements LLMClient {

        private final String model;

        SilentClient(String model) {
            this.model = model;
        }

        @Override
        public String generate(String prompt, double temperature) {
            throw new UnsupportedOperationException("not used by pool tests");
        }

        @Override
        public String getModel() {
            return model;
        }
    }
}
