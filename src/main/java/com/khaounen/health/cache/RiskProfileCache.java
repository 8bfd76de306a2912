package com.khaounen.health.cache;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.khaounen.health.errors.ComputationException;
import com.khaounen.health.errors.ValidationException;
import com.khaounen.health.risk.RiskProfile;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Memoizes risk assessments per customer.
 *
 * <p>Each customer maps to one shared future. The first caller to find the
 * slot empty installs a future and runs the computation on its own thread;
 * everyone else arriving meanwhile blocks on that same future. Different
 * customers never contend. A failed computation is removed before its
 * waiters are released, so the next call starts from an empty slot.
 *
 * <p>Entries expire {@code ttl} after the computation completes. An entry
 * computed from a different metrics fingerprint is treated as stale.
 */
@Slf4j
public class RiskProfileCache {

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);

    public enum EntryState {
        ABSENT,
        COMPUTING,
        FRESH
    }

    private final AsyncCache<String, CachedProfile> entries;

    public RiskProfileCache() {
        this(DEFAULT_TTL, Ticker.systemTicker());
    }

    public RiskProfileCache(Duration ttl) {
        this(ttl, Ticker.systemTicker());
    }

    public RiskProfileCache(Duration ttl, Ticker ticker) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new ValidationException("Cache ttl must be positive", "ttl");
        }
        this.entries = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .buildAsync();
    }

    public RiskProfile getOrCompute(String customerId, Supplier<RiskProfile> computeFn) {
        return getOrCompute(customerId, null, computeFn, null);
    }

    public RiskProfile getOrCompute(String customerId, String fingerprint, Supplier<RiskProfile> computeFn) {
        return getOrCompute(customerId, fingerprint, computeFn, null);
    }

    /**
     * @param fingerprint hash of the metrics the caller is about to score, or null to accept any fresh entry
     * @param timeout     how long this caller waits for an in-flight computation; null waits indefinitely.
     *                    Giving up never cancels the shared computation.
     */
    public RiskProfile getOrCompute(
            String customerId,
            String fingerprint,
            Supplier<RiskProfile> computeFn,
            Duration timeout
    ) {
        requireCustomerId(customerId);
        Objects.requireNonNull(computeFn, "computeFn");
        ConcurrentMap<String, CompletableFuture<CachedProfile>> slots = entries.asMap();
        while (true) {
            CompletableFuture<CachedProfile> current = slots.get(customerId);
            if (current == null) {
                CompletableFuture<CachedProfile> created = new CompletableFuture<>();
                CompletableFuture<CachedProfile> raced = slots.putIfAbsent(customerId, created);
                if (raced == null) {
                    log.debug("risk cache miss customer={}", customerId);
                    return compute(customerId, fingerprint, computeFn, created).profile();
                }
                current = raced;
            }
            CachedProfile cached = await(customerId, current, timeout);
            if (cached.matches(fingerprint)) {
                log.debug("risk cache hit customer={}", customerId);
                return cached.profile();
            }
            log.debug("risk cache entry stale for customer={}, recomputing", customerId);
            slots.remove(customerId, current);
        }
    }

    public Optional<RiskProfile> getIfPresent(String customerId) {
        CompletableFuture<CachedProfile> current = entries.asMap().get(customerId);
        if (current == null || !current.isDone() || current.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(current.join().profile());
    }

    public EntryState state(String customerId) {
        CompletableFuture<CachedProfile> current = entries.asMap().get(customerId);
        if (current == null || current.isCompletedExceptionally()) {
            return EntryState.ABSENT;
        }
        return current.isDone() ? EntryState.FRESH : EntryState.COMPUTING;
    }

    public void invalidate(String customerId) {
        requireCustomerId(customerId);
        if (entries.asMap().remove(customerId) != null) {
            log.debug("risk cache invalidated customer={}", customerId);
        }
    }

    /**
     * Evicts the entry only while it still holds {@code expected}, so a newer
     * computation installed meanwhile is left alone.
     */
    public void invalidate(String customerId, RiskProfile expected) {
        requireCustomerId(customerId);
        ConcurrentMap<String, CompletableFuture<CachedProfile>> slots = entries.asMap();
        CompletableFuture<CachedProfile> current = slots.get(customerId);
        if (current == null || !current.isDone() || current.isCompletedExceptionally()) {
            return;
        }
        if (current.join().profile() == expected && slots.remove(customerId, current)) {
            log.debug("risk cache dropped superseded entry customer={}", customerId);
        }
    }

    public void invalidateAll() {
        entries.synchronous().invalidateAll();
    }

    public long size() {
        return entries.asMap().size();
    }

    private CachedProfile compute(
            String customerId,
            String fingerprint,
            Supplier<RiskProfile> computeFn,
            CompletableFuture<CachedProfile> slot
    ) {
        try {
            RiskProfile profile = computeFn.get();
            if (profile == null) {
                throw new ComputationException("Risk computation returned no profile", customerId);
            }
            CachedProfile cached = new CachedProfile(fingerprint, profile);
            slot.complete(cached);
            return cached;
        } catch (RuntimeException | Error ex) {
            entries.asMap().remove(customerId, slot);
            slot.completeExceptionally(ex);
            throw ex;
        }
    }

    private static CachedProfile await(String customerId, CompletableFuture<CachedProfile> shared, Duration timeout) {
        try {
            if (timeout == null) {
                return shared.get();
            }
            return shared.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException ex) {
            throw propagate(customerId, ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ComputationException("Interrupted while waiting for risk assessment", customerId, ex);
        } catch (TimeoutException ex) {
            throw new ComputationException("Timed out after " + timeout + " waiting for risk assessment", customerId, ex);
        }
    }

    private static RuntimeException propagate(String customerId, Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new ComputationException("Risk assessment failed for customer " + customerId, customerId, cause);
    }

    private static void requireCustomerId(String customerId) {
        if (customerId == null || customerId.isBlank()) {
            throw new ValidationException("Customer id is required", "customerId");
        }
    }

    private record CachedProfile(String fingerprint, RiskProfile profile) {
        boolean matches(String requested) {
            return requested == null || requested.equals(fingerprint);
        }
    }
}
