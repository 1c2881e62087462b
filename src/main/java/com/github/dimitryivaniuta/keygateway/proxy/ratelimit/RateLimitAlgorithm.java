package com.github.dimitryivaniuta.keygateway.proxy.ratelimit;

public enum RateLimitAlgorithm {
    /** Counter per key, reset by the first request that arrives after the window has elapsed. */
    FIXED_WINDOW,
    /** Resilience4j refresh-period limiter, cycles aligned to limiter creation. */
    REFRESH_PERIOD
}
