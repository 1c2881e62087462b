package com.github.dimitryivaniuta.keygateway.proxy.forward;

import com.github.dimitryivaniuta.keygateway.proxy.key.KeySelector;
import com.github.dimitryivaniuta.keygateway.proxy.metrics.GatewayMetrics;
import com.github.dimitryivaniuta.keygateway.proxy.ratelimit.KeyRateLimiter;
import com.github.dimitryivaniuta.keygateway.proxy.ratelimit.RateLimitExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.net.URI;
import java.time.Duration;

/**
 * Forwards one inbound request upstream with a rotated, rate-limited API key.
 *
 * <p>Flow:
 * <ol>
 *   <li>Ask the selector for up to N candidates (N = number of keys); the first one the
 *       limiter admits is used. If none is admitted, fail with {@link RateLimitExceededException}
 *       without contacting the upstream.</li>
 *   <li>Strip hop-by-hop headers, inject the key, send once. The upstream answer is returned
 *       unchanged whatever its status.</li>
 *   <li>A transport failure raises {@link UpstreamUnavailableException}. It is not retried with
 *       another key, and the consumed quota is not given back.</li>
 * </ol>
 */
@Slf4j
@RequiredArgsConstructor
public class ForwardingGateway {

    private final KeySelector keySelector;
    private final KeyRateLimiter rateLimiter;
    private final CredentialInjector credentialInjector;
    private final UpstreamClient upstreamClient;
    private final GatewayMetrics metrics;

    public UpstreamResponse forward(ForwardRequest request) {
        String key = admitKey();
        String alias = keySelector.aliasOf(key);

        URI uri = credentialInjector.targetUri(request, key);
        HttpHeaders headers = HopByHopHeaders.forUpstream(request.headers());
        credentialInjector.applyHeader(headers, key);

        log.debug("Forwarding {} /{} via {}", request.method(), request.path(), alias);

        long start = System.nanoTime();
        try {
            UpstreamResponse response = upstreamClient.exchange(request.method(), uri, headers, request.body());
            metrics.upstreamResponse(response.status());
            return response;
        } catch (UpstreamUnavailableException ex) {
            metrics.upstreamFailure(ex.isTimeout() ? "timeout" : "transport");
            log.warn("Upstream call via {} failed: {}", alias, ex.getMessage());
            throw ex;
        } finally {
            metrics.recordUpstreamDuration(request.method().name(), System.nanoTime() - start);
        }
    }

    private String admitKey() {
        int attempts = keySelector.size();
        for (int i = 0; i < attempts; i++) {
            String candidate = keySelector.next();
            if (rateLimiter.tryAdmit(candidate)) {
                metrics.keyAdmitted(keySelector.aliasOf(candidate));
                return candidate;
            }
            metrics.keyRejected(keySelector.aliasOf(candidate));
        }

        metrics.keysExhausted();
        long retryAfter = retryAfterSeconds(rateLimiter.timeUntilNextAdmission());
        log.info("All {} API keys are rate limited; retry after {}s", attempts, retryAfter);
        throw new RateLimitExceededException("All API keys have reached their rate limit", retryAfter);
    }

    // Whole seconds, rounded up, at least 1 (Retry-After has second granularity).
    public static long retryAfterSeconds(Duration wait) {
        if (wait == null || wait.isNegative() || wait.isZero()) return 1L;
        long s = wait.getSeconds() + (wait.getNano() > 0 ? 1 : 0);
        return Math.max(1L, s);
    }
}
