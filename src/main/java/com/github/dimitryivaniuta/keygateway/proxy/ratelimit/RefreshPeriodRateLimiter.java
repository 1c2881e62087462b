package com.github.dimitryivaniuta.keygateway.proxy.ratelimit;

import com.github.dimitryivaniuta.keygateway.proxy.support.KeyMasking;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.internal.AtomicRateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resilience4j-backed alternative: one {@link RateLimiter} per key with
 * {@code limitForPeriod = ceiling} and {@code limitRefreshPeriod = window}.
 *
 * <p>Refresh cycles are aligned to limiter creation rather than to the first request after
 * a window elapses. Admission never waits (zero timeout). Resilience4j keeps its own
 * nanosecond time base; the clock only stamps the reset instants reported by {@link #usage()}.
 */
@Slf4j
public final class RefreshPeriodRateLimiter implements KeyRateLimiter {

    private final int ceiling;
    private final Duration window;
    private final Clock clock;
    private final Map<String, Entry> limiters;

    public RefreshPeriodRateLimiter(List<String> credentials, int ceiling, Duration window, Clock clock) {
        if (ceiling <= 0) throw new IllegalArgumentException("ceiling must be > 0");
        this.ceiling = ceiling;
        this.window = window;
        this.clock = clock;

        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(ceiling)
                .limitRefreshPeriod(window)
                .timeoutDuration(Duration.ZERO) // fail fast, the gateway tries the next key
                .build();

        Map<String, Entry> m = new LinkedHashMap<>();
        for (int i = 0; i < credentials.size(); i++) {
            String key = credentials.get(i);
            String alias = KeyMasking.alias(i);
            m.putIfAbsent(key, new Entry(alias, KeyMasking.mask(key), RateLimiter.of("gateway:" + alias, config)));
        }
        this.limiters = Collections.unmodifiableMap(m);
    }

    @Override
    public boolean tryAdmit(String credential) {
        Entry e = (credential == null) ? null : limiters.get(credential);
        if (e == null) {
            log.warn("Admission requested for unconfigured key {}; rejecting", KeyMasking.mask(credential));
            return false;
        }
        return e.limiter().acquirePermission();
    }

    @Override
    public Duration timeUntilNextAdmission() {
        long min = Long.MAX_VALUE;
        for (Entry e : limiters.values()) {
            if (e.limiter().getMetrics().getAvailablePermissions() > 0) return Duration.ZERO;
            min = Math.min(min, nanosToWait(e.limiter()));
        }
        return (min == Long.MAX_VALUE) ? Duration.ZERO : Duration.ofNanos(min);
    }

    @Override
    public List<KeyUsage> usage() {
        Instant now = clock.instant();
        List<KeyUsage> out = new ArrayList<>(limiters.size());
        for (Entry e : limiters.values()) {
            int available = e.limiter().getMetrics().getAvailablePermissions();
            int remaining = Math.max(0, Math.min(ceiling, available));
            Instant resetsAt = now.plusNanos(nanosToWait(e.limiter()));
            out.add(new KeyUsage(e.alias(), e.maskedKey(), ceiling - remaining, remaining, null, resetsAt));
        }
        return out;
    }

    // Only the atomic implementation exposes the wait; anything else is assumed a full period away.
    private long nanosToWait(RateLimiter limiter) {
        RateLimiter.Metrics metrics = limiter.getMetrics();
        if (metrics instanceof AtomicRateLimiter.AtomicRateLimiterMetrics) {
            return Math.max(0L, ((AtomicRateLimiter.AtomicRateLimiterMetrics) metrics).getNanosToWait());
        }
        return window.toNanos();
    }

    private record Entry(String alias, String maskedKey, RateLimiter limiter) {}
}
