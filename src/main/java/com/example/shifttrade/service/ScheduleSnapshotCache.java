package com.example.shifttrade.service;

import com.example.shifttrade.config.TradeConfig;
import com.example.shifttrade.model.ScheduleSnapshot;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Short-lived memo of the last snapshot. Readers always see one whole snapshot; only one
 * thread runs the loader at a time. A zero or negative TTL disables caching.
 */
@Component
public class ScheduleSnapshotCache {

    private final Duration ttl;
    private final Clock clock;
    private final AtomicReference<CachedSnapshot> current = new AtomicReference<>();
    private final Object refreshLock = new Object();

    public ScheduleSnapshotCache(TradeConfig config, Clock clock) {
        this.ttl = config.getCacheTtl();
        this.clock = clock;
    }

    public ScheduleSnapshot get(Supplier<ScheduleSnapshot> loader) {
        CachedSnapshot cached = current.get();
        if (isFresh(cached)) {
            return cached.snapshot();
        }
        synchronized (refreshLock) {
            cached = current.get();
            if (isFresh(cached)) {
                return cached.snapshot();
            }
            return load(loader);
        }
    }

    /** Loads unconditionally and replaces whatever is cached. */
    public ScheduleSnapshot refresh(Supplier<ScheduleSnapshot> loader) {
        synchronized (refreshLock) {
            return load(loader);
        }
    }

    public void invalidate() {
        current.set(null);
    }

    public Optional<Instant> loadedAt() {
        return Optional.ofNullable(current.get()).map(CachedSnapshot::loadedAt);
    }

    private ScheduleSnapshot load(Supplier<ScheduleSnapshot> loader) {
        ScheduleSnapshot snapshot = loader.get();
        current.set(new CachedSnapshot(snapshot, clock.instant()));
        return snapshot;
    }

    private boolean isFresh(CachedSnapshot cached) {
        if (cached == null || ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        return clock.instant().isBefore(cached.loadedAt().plus(ttl));
    }

    private record CachedSnapshot(ScheduleSnapshot snapshot, Instant loadedAt) {}
}
