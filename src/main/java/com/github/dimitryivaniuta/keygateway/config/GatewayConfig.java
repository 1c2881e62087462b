package com.github.dimitryivaniuta.keygateway.config;

import com.github.dimitryivaniuta.keygateway.proxy.GatewayConfigurationException;
import com.github.dimitryivaniuta.keygateway.proxy.GatewayProperties;
import com.github.dimitryivaniuta.keygateway.proxy.forward.CredentialInjector;
import com.github.dimitryivaniuta.keygateway.proxy.forward.ForwardingGateway;
import com.github.dimitryivaniuta.keygateway.proxy.forward.RestClientUpstreamClient;
import com.github.dimitryivaniuta.keygateway.proxy.forward.UpstreamClient;
import com.github.dimitryivaniuta.keygateway.proxy.key.KeySelector;
import com.github.dimitryivaniuta.keygateway.proxy.metrics.GatewayMetrics;
import com.github.dimitryivaniuta.keygateway.proxy.ratelimit.FixedWindowRateLimiter;
import com.github.dimitryivaniuta.keygateway.proxy.ratelimit.KeyRateLimiter;
import com.github.dimitryivaniuta.keygateway.proxy.ratelimit.RefreshPeriodRateLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;

/**
 * Composition root: every gateway component is created once here and shared by reference.
 *
 * <p>Startup fails with {@link GatewayConfigurationException} when no API key is configured
 * or the target URL is not an absolute http(s) URL.
 */
@Slf4j
@Configuration
public class GatewayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public KeySelector keySelector(GatewayProperties props) {
        List<String> keys = props.credentials();
        if (keys.isEmpty()) {
            throw new GatewayConfigurationException(
                    "No API keys configured: set API_KEYS (keys separated by ';') or gateway.api-keys");
        }
        validateTargetUrl(props.getTargetUrl());
        log.info("Gateway configured with {} API key(s), limit {} per {}, target {}",
                keys.size(), props.getRateLimit().getLimit(), props.getRateLimit().getWindow(), props.getTargetUrl());
        return new KeySelector(keys);
    }

    @Bean
    public KeyRateLimiter keyRateLimiter(KeySelector keySelector, GatewayProperties props, Clock clock) {
        GatewayProperties.RateLimit rl = props.getRateLimit();
        return switch (rl.getAlgorithm()) {
            case FIXED_WINDOW -> new FixedWindowRateLimiter(keySelector.credentials(), rl.getLimit(), rl.getWindow(), clock);
            case REFRESH_PERIOD -> new RefreshPeriodRateLimiter(keySelector.credentials(), rl.getLimit(), rl.getWindow(), clock);
        };
    }

    @Bean
    public RestClient upstreamRestClient(RestClient.Builder builder, GatewayProperties props) {
        GatewayProperties.Upstream u = props.getUpstream();
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(u.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(u.getReadTimeout());
        return builder.requestFactory(factory).build();
    }

    @Bean
    public UpstreamClient upstreamClient(RestClient upstreamRestClient) {
        return new RestClientUpstreamClient(upstreamRestClient);
    }

    @Bean
    public GatewayMetrics gatewayMetrics(MeterRegistry registry) {
        return new GatewayMetrics(registry);
    }

    @Bean
    public ForwardingGateway forwardingGateway(KeySelector keySelector,
                                               KeyRateLimiter keyRateLimiter,
                                               UpstreamClient upstreamClient,
                                               GatewayMetrics gatewayMetrics,
                                               GatewayProperties props) {
        CredentialInjector injector = new CredentialInjector(props.getTargetUrl(), props.getCredential());
        return new ForwardingGateway(keySelector, keyRateLimiter, injector, upstreamClient, gatewayMetrics);
    }

    static void validateTargetUrl(String targetUrl) {
        if (targetUrl == null || targetUrl.isBlank()) {
            throw new GatewayConfigurationException(
                    "No target URL configured: set TARGET_API_URL or gateway.target-url");
        }
        try {
            URI uri = new URI(targetUrl.trim());
            String scheme = uri.getScheme();
            if (!uri.isAbsolute() || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new GatewayConfigurationException("Target URL must be an absolute http(s) URL: " + targetUrl);
            }
        } catch (URISyntaxException ex) {
            throw new GatewayConfigurationException("Target URL is malformed: " + targetUrl, ex);
        }
    }
}
