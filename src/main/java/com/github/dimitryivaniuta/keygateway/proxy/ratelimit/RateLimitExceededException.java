package com.github.dimitryivaniuta.keygateway.proxy.ratelimit;

import lombok.Getter;

/**
 * Every configured key is saturated in its current window. Surfaces as HTTP 429.
 */
@Getter
public class RateLimitExceededException extends RuntimeException {

    private final long retryAfterSeconds;

    public RateLimitExceededException(String message, long retryAfterSeconds) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
