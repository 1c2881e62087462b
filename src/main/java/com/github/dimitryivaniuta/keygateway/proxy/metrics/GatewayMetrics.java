package com.github.dimitryivaniuta.keygateway.proxy.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

public class GatewayMetrics {

    private final MeterRegistry registry;

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Key admission ----
    public void keyAdmitted(String keyAlias) {
        Counter.builder("gateway_key_admitted_total")
                .tag("key", keyAlias) // key-0, key-1, ... never the raw key
                .register(registry)
                .increment();
    }

    public void keyRejected(String keyAlias) {
        Counter.builder("gateway_key_rejected_total")
                .tag("key", keyAlias)
                .register(registry)
                .increment();
    }

    public void keysExhausted() {
        Counter.builder("gateway_keys_exhausted_total")
                .register(registry)
                .increment();
    }

    // ---- Upstream ----
    public void upstreamResponse(int status) {
        Counter.builder("gateway_upstream_responses_total")
                .tag("status", String.valueOf(status))
                .register(registry)
                .increment();
    }

    public void upstreamFailure(String kind) {
        Counter.builder("gateway_upstream_failures_total")
                .tag("kind", kind) // timeout | transport
                .register(registry)
                .increment();
    }

    public void recordUpstreamDuration(String method, long nanos) {
        Timer.builder("gateway_upstream_duration_seconds")
                .tag("method", method)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }
}
