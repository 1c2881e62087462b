package com.github.dimitryivaniuta.keygateway.proxy.ratelimit;

import java.time.Duration;
import java.util.List;

/**
 * Per-key admission control. Implementations must be linearizable per key and must not
 * serialize admissions for different keys behind a single lock.
 */
public interface KeyRateLimiter {

    /**
     * Consumes one unit of the key's quota if any is left in the current window.
     *
     * @return {@code true} if admitted; {@code false} if saturated or the key is not configured
     */
    boolean tryAdmit(String credential);

    /**
     * Shortest wait until some key can be admitted again; {@link Duration#ZERO} if one already can.
     */
    Duration timeUntilNextAdmission();

    /** Point-in-time view of every configured key, in configured order. */
    List<KeyUsage> usage();
}
