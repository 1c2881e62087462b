package com.github.dimitryivaniuta.keygateway.web;

import com.github.dimitryivaniuta.keygateway.proxy.GatewayProperties;
import com.github.dimitryivaniuta.keygateway.proxy.forward.ForwardingGateway;
import com.github.dimitryivaniuta.keygateway.proxy.key.KeySelector;
import com.github.dimitryivaniuta.keygateway.proxy.ratelimit.KeyRateLimiter;
import com.github.dimitryivaniuta.keygateway.proxy.ratelimit.KeyUsage;
import com.github.dimitryivaniuta.keygateway.proxy.ratelimit.RateLimitAlgorithm;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

/**
 * Read-only view of the key pool. Only masked keys are ever returned.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/keys")
public class KeyStatusController {

    private final KeySelector keySelector;
    private final KeyRateLimiter rateLimiter;
    private final GatewayProperties props;

    public record KeyPoolStatus(
            RateLimitAlgorithm algorithm,
            int limit,
            long windowSeconds,
            long rotationSlotsIssued,
            long retryAfterSeconds,
            List<KeyUsage> keys
    ) {}

    @GetMapping
    public KeyPoolStatus status() {
        GatewayProperties.RateLimit rl = props.getRateLimit();
        return new KeyPoolStatus(
                rl.getAlgorithm(),
                rl.getLimit(),
                rl.getWindow().toSeconds(),
                keySelector.slotsIssued(),
                retryAfterSeconds(rateLimiter.timeUntilNextAdmission()),
                rateLimiter.usage()
        );
    }

    // 0 while some key can admit now; otherwise the same value a 429 would carry.
    static long retryAfterSeconds(Duration wait) {
        if (wait == null || wait.isNegative() || wait.isZero()) return 0L;
        return ForwardingGateway.retryAfterSeconds(wait);
    }
}
