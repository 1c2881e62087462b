package com.github.dimitryivaniuta.keygateway.proxy;

import com.github.dimitryivaniuta.keygateway.proxy.forward.CredentialMode;
import com.github.dimitryivaniuta.keygateway.proxy.ratelimit.RateLimitAlgorithm;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /**
     * Upstream API keys. Each entry may itself hold several keys separated by ';'
     * (the API_KEYS environment variable format).
     */
    private List<String> apiKeys = new ArrayList<>();

    /** Base URL every proxied request is sent to. */
    @NotBlank
    private String targetUrl;

    @Valid
    @NotNull
    private RateLimit rateLimit = new RateLimit();

    @Valid
    @NotNull
    private Credential credential = new Credential();

    @Valid
    @NotNull
    private Upstream upstream = new Upstream();

    /**
     * Keys in configured order, split on ';', trimmed, blanks and duplicates dropped.
     */
    public List<String> credentials() {
        Set<String> keys = new LinkedHashSet<>();
        if (apiKeys == null) return List.of();
        for (String entry : apiKeys) {
            if (entry == null) continue;
            for (String part : entry.split(";")) {
                String key = part.trim();
                if (!key.isEmpty()) keys.add(key);
            }
        }
        return List.copyOf(keys);
    }

    @Getter
    @Setter
    public static class RateLimit {
        /** Requests each key may make per window. */
        @Min(1)
        private int limit = 15;

        @NotNull
        private Duration window = Duration.ofSeconds(60);

        @NotNull
        private RateLimitAlgorithm algorithm = RateLimitAlgorithm.FIXED_WINDOW;
    }

    @Getter
    @Setter
    public static class Credential {
        @NotNull
        private CredentialMode mode = CredentialMode.HEADER;

        @NotBlank
        private String headerName = "Authorization";

        // may be empty for APIs expecting the bare key
        private String headerPrefix = "Bearer ";

        @NotBlank
        private String queryParam = "key";
    }

    @Getter
    @Setter
    public static class Upstream {
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(180);
    }
}
