package com.portico.backend.global.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.TimeMeter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Per-client token buckets: capacity {@code B}, one token added every refill period.
 *
 * <p>Each key owns its own bucket, so clients never contend with each other; concurrent
 * calls for the same key are serialized by the bucket's atomic state. Memory is bounded by
 * {@link #evictStaleEntries()}: idle keys are dropped and, past the high-water mark, the
 * whole table is reset (returning clients simply get a fresh, full bucket).
 */
@Component
public class ClientRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(ClientRateLimiter.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final long capacity;
    private final Duration refillPeriod;
    private final Duration idleTimeout;
    private final int highWaterMark;
    private final Clock clock;
    private final TimeMeter timeMeter;

    public ClientRateLimiter(
            @Value("${app.rate-limit.capacity:5}") long capacity,
            @Value("${app.rate-limit.refill-period:PT2S}") Duration refillPeriod,
            @Value("${app.rate-limit.idle-timeout:PT10M}") Duration idleTimeout,
            @Value("${app.rate-limit.high-water-mark:10000}") int highWaterMark,
            Clock clock
    ) {
        if (capacity < 1) {
            throw new IllegalArgumentException("app.rate-limit.capacity must be >= 1");
        }
        if (refillPeriod.isZero() || refillPeriod.isNegative()) {
            throw new IllegalArgumentException("app.rate-limit.refill-period must be positive");
        }
        this.capacity = capacity;
        this.refillPeriod = refillPeriod;
        this.idleTimeout = idleTimeout;
        this.highWaterMark = highWaterMark;
        this.clock = clock;
        this.timeMeter = new ClockTimeMeter(clock);
    }

    public boolean tryAcquire(String key) {
        return tryAcquireWithRetry(key).allowed();
    }

    public RateLimitDecision tryAcquireWithRetry(String key) {
        Entry entry = entries.computeIfAbsent(normalizeKey(key), k -> new Entry(newBucket()));
        entry.lastSeenMillis = clock.millis();
        ConsumptionProbe probe = entry.bucket.tryConsumeAndReturnRemaining(1);
        if (probe.isConsumed()) {
            return RateLimitDecision.allow(probe.getRemainingTokens());
        }
        return RateLimitDecision.deny(Duration.ofNanos(probe.getNanosToWaitForRefill()));
    }

    @Scheduled(
            fixedDelayString = "${app.rate-limit.sweep-interval:PT5M}",
            initialDelayString = "${app.rate-limit.sweep-interval:PT5M}"
    )
    public int evictStaleEntries() {
        long cutoff = clock.millis() - idleTimeout.toMillis();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().lastSeenMillis < cutoff);
        int remaining = entries.size();
        if (remaining > highWaterMark) {
            log.warn("Rate limiter table reset: trackedKeys={} highWaterMark={}", remaining, highWaterMark);
            entries.clear();
            remaining = 0;
        }
        int evicted = before - remaining;
        if (evicted > 0) {
            log.debug("Rate limiter evicted {} entries, {} remain", evicted, remaining);
        }
        return evicted;
    }

    public int trackedKeys() {
        return entries.size();
    }

    private Bucket newBucket() {
        Bandwidth limit = Bandwidth.builder()
                .capacity(capacity)
                .refillGreedy(1, refillPeriod)
                .build();
        return Bucket.builder()
                .addLimit(limit)
                .withCustomTimePrecision(timeMeter)
                .build();
    }

    private static String normalizeKey(String key) {
        return (key == null || key.isBlank()) ? "unknown" : key;
    }

    private static final class Entry {
        private final Bucket bucket;
        private volatile long lastSeenMillis;

        private Entry(Bucket bucket) {
            this.bucket = bucket;
        }
    }
}
