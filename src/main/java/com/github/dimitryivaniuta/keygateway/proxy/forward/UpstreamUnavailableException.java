package com.github.dimitryivaniuta.keygateway.proxy.forward;

import lombok.Getter;

/**
 * Transport-level failure reaching the target API (connect error, timeout, broken stream).
 * Surfaces as HTTP 504 when {@code timeout} is set, 502 otherwise. Never retried.
 */
@Getter
public class UpstreamUnavailableException extends RuntimeException {

    private final boolean timeout;

    public UpstreamUnavailableException(String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }
}
