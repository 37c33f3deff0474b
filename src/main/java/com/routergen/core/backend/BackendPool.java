package com.routergen.core.backend;

import com.routergen.config.PoolSettings;
import com.routergen.core.example.GenerationTask;
import com.routergen.llm.BackendErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

/**
 * BackendPool - health-aware rotation over the configured backends.
 *
 * State per backend:
 *   - cooldown window after RATE_LIMITED, doubling per consecutive rate limit up to maxCooldown
 *   - consecutive hard failures (TIMEOUT / UNAVAILABLE / MALFORMED_RESPONSE); reaching the
 *     demotion threshold moves the backend to the back of the rotation
 *   - consecutive AUTH_FAILED; reaching authFailureLimit disables the backend for the process
 *
 * All state is guarded by one lock. acquire() waits on a condition while every
 * live backend is cooling down; report() signals it. No lock is held while a
 * backend request is in flight.
 */
public class BackendPool {

    private static final Logger log = LoggerFactory.getLogger(BackendPool.class);

    private final PoolSettings             settings;
    private final BackendSelectionStrategy strategy;
    private final LongSupplier             nanoClock;

    private final ReentrantLock lock     = new ReentrantLock();
    private final Condition     changed  = lock.newCondition();

    private final List<Backend>               rotation = new ArrayList<>();
    private final Map<Backend, BackendHealth> health   = new HashMap<>();

    public BackendPool(List<Backend> backends, BackendSelectionStrategy strategy, PoolSettings settings) {
        this(backends, strategy, settings, System::nanoTime);
    }

    BackendPool(List<Backend> backends, BackendSelectionStrategy strategy, PoolSettings settings,
                LongSupplier nanoClock) {
        this.settings  = settings;
        this.strategy  = strategy;
        this.nanoClock = nanoClock;
        for (Backend b : backends) {
            rotation.add(b);
            health.put(b, new BackendHealth());
        }
        log.info("[BackendPool] Initialized with {} backend(s): {}", backends.size(), rotation);
    }

    // =========================================================================
    // Acquire
    // =========================================================================

    /**
     * Hand out a backend for one attempt of {@code task}.
     *
     * @param previous backend of the previous attempt of the same task, or null
     * @throws NoBackendAvailableException fatal when every backend is disabled;
     *         non-fatal on acquire timeout or interruption
     */
    public Backend acquire(GenerationTask task, Backend previous) {
        lock.lock();
        try {
            long deadline = nanoClock.getAsLong() + settings.getAcquireTimeout().toNanos();

            while (true) {
                long now = nanoClock.getAsLong();

                List<Backend> live = rotation.stream()
                        .filter(b -> !health.get(b).disabled)
                        .collect(Collectors.toList());
                if (live.isEmpty()) {
                    throw new NoBackendAvailableException("All backends are permanently disabled", true);
                }

                List<Backend> available = live.stream()
                        .filter(b -> health.get(b).cooldownUntil <= now)
                        .collect(Collectors.toList());
                if (!available.isEmpty()) {
                    Backend chosen = strategy.select(task, available, List.copyOf(rotation), previous);
                    log.debug("[BackendPool] {} -> {} (previous={})", task, chosen, previous);
                    return chosen;
                }

                long earliestEnd = live.stream()
                        .mapToLong(b -> health.get(b).cooldownUntil)
                        .min()
                        .orElse(now);
                long remaining = deadline - now;
                if (remaining <= 0) {
                    throw new NoBackendAvailableException(
                            "Timed out after " + settings.getAcquireTimeout() + " waiting for a backend", false);
                }

                long waitNanos = Math.max(1, Math.min(earliestEnd - now, remaining));
                log.debug("[BackendPool] All live backends cooling down; waiting {} ms",
                        TimeUnit.NANOSECONDS.toMillis(waitNanos));
                try {
                    changed.awaitNanos(waitNanos);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new NoBackendAvailableException("Interrupted while waiting for a backend", false);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    // =========================================================================
    // Report
    // =========================================================================

    public void reportSuccess(Backend backend) {
        lock.lock();
        try {
            BackendHealth h = health.get(backend);
            h.successes++;
            h.consecutiveRateLimits = 0;
            h.consecutiveHardFailures = 0;
            h.consecutiveAuthFailures = 0;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void reportFailure(Backend backend, BackendErrorKind kind) {
        lock.lock();
        try {
            BackendHealth h = health.get(backend);
            h.failures++;

            switch (kind) {
                case RATE_LIMITED -> {
                    h.consecutiveRateLimits++;
                    long cooldown = cooldownNanos(h.consecutiveRateLimits);
                    h.cooldownUntil = nanoClock.getAsLong() + cooldown;
                    log.warn("[BackendPool] {} rate limited ({} in a row); cooling down {} ms",
                            backend, h.consecutiveRateLimits, TimeUnit.NANOSECONDS.toMillis(cooldown));
                }
                case AUTH_FAILED -> {
                    h.consecutiveAuthFailures++;
                    if (h.consecutiveAuthFailures >= settings.getAuthFailureLimit() && !h.disabled) {
                        h.disabled = true;
                        log.error("[BackendPool] {} disabled after {} consecutive auth failures",
                                backend, h.consecutiveAuthFailures);
                    } else {
                        log.warn("[BackendPool] {} auth failure {}/{}",
                                backend, h.consecutiveAuthFailures, settings.getAuthFailureLimit());
                    }
                }
                case TIMEOUT, UNAVAILABLE, MALFORMED_RESPONSE -> {
                    h.consecutiveHardFailures++;
                    if (h.consecutiveHardFailures >= settings.getDemotionThreshold()) {
                        rotation.remove(backend);
                        rotation.add(backend);
                        h.consecutiveHardFailures = 0;
                        log.warn("[BackendPool] {} demoted to back of rotation after {} ({}); rotation={}",
                                backend, settings.getDemotionThreshold(), kind, rotation);
                    } else {
                        log.debug("[BackendPool] {} failure {} ({}/{})",
                                backend, kind, h.consecutiveHardFailures, settings.getDemotionThreshold());
                    }
                }
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private long cooldownNanos(int consecutive) {
        long base = settings.getRateLimitCooldown().toNanos();
        long cap  = settings.getMaxCooldown().toNanos();
        long value = base;
        for (int i = 1; i < consecutive && value < cap; i++) {
            value *= 2;
        }
        return Math.min(value, cap);
    }

    // =========================================================================
    // Introspection
    // =========================================================================

    public boolean isExhausted() {
        lock.lock();
        try {
            return health.values().stream().allMatch(h -> h.disabled);
        } finally {
            lock.unlock();
        }
    }

    public List<Backend> rotationOrder() {
        lock.lock();
        try {
            return List.copyOf(rotation);
        } finally {
            lock.unlock();
        }
    }

    public List<BackendStatus> snapshot() {
        lock.lock();
        try {
            long now = nanoClock.getAsLong();
            List<BackendStatus> result = new ArrayList<>();
            for (int i = 0; i < rotation.size(); i++) {
                Backend b = rotation.get(i);
                BackendHealth h = health.get(b);
                int consecutive = Math.max(h.consecutiveHardFailures,
                        Math.max(h.consecutiveRateLimits, h.consecutiveAuthFailures));
                result.add(new BackendStatus(b.getId(), i, h.disabled, h.cooldownUntil > now,
                        consecutive, h.successes, h.failures));
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /** Mutable per-backend health; only touched with the pool lock held. */
    private static final class BackendHealth {
        long    cooldownUntil = Long.MIN_VALUE;
        int     consecutiveRateLimits;
        int     consecutiveHardFailures;
        int     consecutiveAuthFailures;
        boolean disabled;
        long    successes;
        long    failures;
    }
}
