package org.gopti.planner.travel;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Expiring key/value store where a miss runs the loader exactly once per key:
 * concurrent readers of an in-flight key wait for that load instead of
 * starting their own. A failed load is not cached. Expired entries are
 * swept on writes, at most once per sweep interval.
 */
public class SingleFlightCache<K, V> {

    private static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);

    private final ConcurrentMap<K, Slot<V>> slots = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;
    private final AtomicReference<Instant> nextSweep;

    public SingleFlightCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
        this.nextSweep = new AtomicReference<>(clock.instant().plus(SWEEP_INTERVAL));
    }

    public V get(K key, Supplier<V> loader) {
        evictExpired();
        var fresh = new Slot<V>();
        var slot = slots.compute(key, (k, existing) ->
            existing == null || existing.isExpired(clock.instant()) ? fresh : existing);

        if (slot != fresh) {
            return slot.await();
        }

        try {
            V value = loader.get();
            fresh.complete(value, clock.instant().plus(ttl));
            return value;
        } catch (RuntimeException ex) {
            slots.remove(key, fresh);
            fresh.fail(ex);
            throw ex;
        }
    }

    /* Completed, unexpired value only; never waits */
    public Optional<V> getIfPresent(K key) {
        var slot = slots.get(key);
        if (slot == null || !slot.isReady() || slot.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.ofNullable(slot.future.getNow(null));
    }

    public void put(K key, V value) {
        evictExpired();
        var slot = new Slot<V>();
        slot.complete(value, clock.instant().plus(ttl));
        slots.put(key, slot);
    }

    public int size() {
        return slots.size();
    }

    public void invalidateAll() {
        slots.clear();
    }

    /* In-flight slots have no expiry yet and are never swept */
    void evictExpired() {
        var now = clock.instant();
        var due = nextSweep.get();
        if (now.isBefore(due) || !nextSweep.compareAndSet(due, now.plus(SWEEP_INTERVAL))) {
            return;
        }
        slots.values().removeIf(slot -> slot.isExpired(now));
    }

    private static final class Slot<V> {
        private final CompletableFuture<V> future = new CompletableFuture<>();
        /* null while the load is in flight */
        private volatile Instant expiresAt;

        void complete(V value, Instant expiresAt) {
            this.expiresAt = expiresAt;
            future.complete(value);
        }

        void fail(RuntimeException ex) {
            future.completeExceptionally(ex);
        }

        boolean isReady() {
            return future.isDone() && !future.isCompletedExceptionally();
        }

        boolean isExpired(Instant now) {
            var expiry = expiresAt;
            return expiry != null && !now.isBefore(expiry);
        }

        V await() {
            try {
                return future.join();
            } catch (CompletionException ex) {
                if (ex.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) ex.getCause();
                }
                throw ex;
            }
        }
    }
}
