package com.github.dimitryivaniuta.keygateway.proxy.ratelimit;

import java.time.Instant;

/**
 * Snapshot of one key's quota. {@code maskedKey} never contains the raw key.
 * {@code windowStart} is null when the algorithm does not track it.
 */
public record KeyUsage(
        String alias,
        String maskedKey,
        int used,
        int remaining,
        Instant windowStart,
        Instant windowResetsAt
) {}
