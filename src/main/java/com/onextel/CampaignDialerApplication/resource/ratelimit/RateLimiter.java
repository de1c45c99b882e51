package com.onextel.CampaignDialerApplication.resource.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Fixed-window request counters keyed by policy and caller identity.
 * <p>
 * A key's window opens on its first request and is replaced once it has fully elapsed.
 * Entries idle for longer than {@link #IDLE_EVICTION} are dropped by {@link #sweep()}.
 */
@Component
@Slf4j
public class RateLimiter {
    static final Duration IDLE_EVICTION = Duration.ofHours(1);
    private static final int TOP_KEYS = 20;
    private static final long MAX_TRACKED_KEYS = 500_000;

    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Cache<String, Window> store = Caffeine.newBuilder()
            .maximumSize(MAX_TRACKED_KEYS)
            .build();

    public RateLimiter(Clock clock, MeterRegistry meterRegistry) {
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Builds the store key: {@code user:{id}} when a user is known, otherwise {@code ip:{address}}.
     */
    public static String resolveKey(RateLimitPolicy policy, String userId, String address) {
        String origin = address == null || address.isBlank() ? "unknown" : address;
        String identity = userId != null && !userId.isBlank() ? "user:" + userId : "ip:" + origin;
        return policy.keyPrefix() + ":" + identity;
    }

    public RateLimitDecision tryAcquire(RateLimitPolicy policy, String userId, String address) {
        return tryAcquire(policy, resolveKey(policy, userId, address));
    }

    public RateLimitDecision tryAcquire(RateLimitPolicy policy, String key) {
        long now = clock.millis();
        long windowMs = policy.getWindow().toMillis();

        Window window = store.asMap().compute(key, (k, existing) -> {
            if (existing == null || now - existing.start >= windowMs) {
                return new Window(now, 1, now);
            }
            return new Window(existing.start, existing.count + 1, now);
        });

        int remaining = Math.max(0, policy.getMaxRequests() - window.count);
        long resetSeconds = Math.max(0, (window.start + windowMs - now + 999) / 1000);
        boolean allowed = window.count <= policy.getMaxRequests();
        if (!allowed) {
            log.debug("Rate limit hit for {} ({} requests in window)", key, window.count);
            meterRegistry.counter("ratelimit.rejected", "policy", policy.name()).increment();
        }
        return new RateLimitDecision(key, allowed, policy.getMaxRequests(), remaining, resetSeconds);
    }

    @Scheduled(fixedDelayString = "${app.rate-limit.sweep-interval-ms:60000}")
    public int sweep() {
        long cutoff = clock.millis() - IDLE_EVICTION.toMillis();
        int before = store.asMap().size();
        store.asMap().entrySet().removeIf(e -> e.getValue().lastRequest < cutoff);
        int removed = before - store.asMap().size();
        if (removed > 0) {
            log.debug("Rate limit sweep evicted {} idle keys", removed);
        }
        return Math.max(0, removed);
    }

    public RateLimitStats stats() {
        Map<String, Window> snapshot = Map.copyOf(store.asMap());
        List<RateLimitStats.KeyUsage> top = snapshot.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, Window> e) -> e.getValue().count).reversed())
                .limit(TOP_KEYS)
                .map(e -> new RateLimitStats.KeyUsage(e.getKey(), e.getValue().count, e.getValue().start))
                .toList();
        return new RateLimitStats(snapshot.size(), top);
    }

    private static final class Window {
        final long start;
        final int count;
        final long lastRequest;

        Window(long start, int count, long lastRequest) {
            this.start = start;
            this.count = count;
            this.lastRequest = lastRequest;
        }
    }
}
