package com.github.dimitryivaniuta.keygateway.proxy.ratelimit;

import com.github.dimitryivaniuta.keygateway.proxy.support.KeyMasking;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory fixed-window limiter: each key may be admitted {@code ceiling} times per window.
 *
 * <p>A window starts at startup (or at the first request after the previous one elapsed) and
 * lasts {@code window}. The counter is not sliding, so a key may serve {@code ceiling} requests
 * just before a boundary and {@code ceiling} more right after it.
 *
 * <p>Limitations:
 * <ul>
 *   <li>State is local to this process and lost on restart</li>
 *   <li>Only keys passed at construction are tracked; any other key is rejected</li>
 * </ul>
 */
@Slf4j
public final class FixedWindowRateLimiter implements KeyRateLimiter {

    private final int ceiling;
    private final Duration window;
    private final Clock clock;

    // Built once, never mutated: lookups need no lock, each counter guards itself.
    private final Map<String, WindowCounter> counters;

    public FixedWindowRateLimiter(List<String> credentials, int ceiling, Duration window, Clock clock) {
        if (ceiling <= 0) throw new IllegalArgumentException("ceiling must be > 0");
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.ceiling = ceiling;
        this.window = window;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        Instant now = clock.instant();
        Map<String, WindowCounter> m = new LinkedHashMap<>();
        for (int i = 0; i < credentials.size(); i++) {
            String key = credentials.get(i);
            m.putIfAbsent(key, new WindowCounter(KeyMasking.alias(i), KeyMasking.mask(key), now));
        }
        this.counters = Collections.unmodifiableMap(m);
    }

    @Override
    public boolean tryAdmit(String credential) {
        WindowCounter counter = (credential == null) ? null : counters.get(credential);
        if (counter == null) {
            log.warn("Admission requested for unconfigured key {}; rejecting", KeyMasking.mask(credential));
            return false;
        }
        return counter.tryAdmit(clock.instant());
    }

    @Override
    public Duration timeUntilNextAdmission() {
        Instant now = clock.instant();
        Duration min = null;
        for (WindowCounter c : counters.values()) {
            Duration wait = c.timeUntilAvailable(now);
            if (wait.isZero()) return Duration.ZERO;
            if (min == null || wait.compareTo(min) < 0) min = wait;
        }
        return (min == null) ? Duration.ZERO : min;
    }

    @Override
    public List<KeyUsage> usage() {
        Instant now = clock.instant();
        List<KeyUsage> out = new ArrayList<>(counters.size());
        for (WindowCounter c : counters.values()) {
            out.add(c.snapshot(now));
        }
        return out;
    }

    private final class WindowCounter {
        private final String alias;
        private final String maskedKey;

        private Instant windowStart;
        private int count;

        WindowCounter(String alias, String maskedKey, Instant windowStart) {
            this.alias = alias;
            this.maskedKey = maskedKey;
            this.windowStart = windowStart;
        }

        synchronized boolean tryAdmit(Instant now) {
            rollIfElapsed(now);
            if (count < ceiling) {
                count++;
                return true;
            }
            return false;
        }

        synchronized Duration timeUntilAvailable(Instant now) {
            if (elapsed(now) || count < ceiling) return Duration.ZERO;
            return Duration.between(now, windowStart.plus(window));
        }

        // Read-only: an elapsed window is reported as empty without being reset.
        synchronized KeyUsage snapshot(Instant now) {
            if (elapsed(now)) {
                return new KeyUsage(alias, maskedKey, 0, ceiling, now, now.plus(window));
            }
            return new KeyUsage(alias, maskedKey, count, ceiling - count, windowStart, windowStart.plus(window));
        }

        private void rollIfElapsed(Instant now) {
            if (elapsed(now)) {
                windowStart = now;
                count = 0;
            }
        }

        private boolean elapsed(Instant now) {
            return Duration.between(windowStart, now).compareTo(window) >= 0;
        }
    }
}
