package com.williamcallahan.literature_search_engine.service.source;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Enforces a minimum spacing between request starts for one source.
 *
 * <p>Each caller reserves the next free slot under a lock and then waits for it without holding
 * the lock, so concurrent callers queue up one interval apart. Spacing is tracked per instance;
 * every source owns its own limiter.</p>
 */
public class SourceRateLimiter {

    private final long intervalNanos;
    private final LongSupplier clock;
    private long lastStartNanos;
    private boolean started;

    public SourceRateLimiter(Duration minInterval) {
        this(minInterval, System::nanoTime);
    }

    SourceRateLimiter(Duration minInterval, LongSupplier clock) {
        this.intervalNanos = minInterval == null || minInterval.isNegative() ? 0L : minInterval.toNanos();
        this.clock = clock;
    }

    /**
     * Completes once the caller may start its request.
     */
    public Mono<Void> acquire() {
        if (intervalNanos <= 0) {
            return Mono.empty();
        }
        return Mono.defer(() -> {
            long waitNanos = reserve();
            return waitNanos > 0 ? Mono.delay(Duration.ofNanos(waitNanos)).then() : Mono.<Void>empty();
        });
    }

    /**
     * Claims the next start slot and returns how long the caller must wait for it.
     */
    synchronized long reserve() {
        long now = clock.getAsLong();
        long release = started ? Math.max(now, lastStartNanos + intervalNanos) : now;
        lastStartNanos = release;
        started = true;
        return release - now;
    }
}
