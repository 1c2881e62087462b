package com.github.dimitryivaniuta.keygateway.proxy.forward;

import com.github.dimitryivaniuta.keygateway.proxy.GatewayProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Builds the outbound target URI and attaches the admitted key to the request,
 * as a header ({@code Authorization: Bearer <key>} by default) or a query parameter.
 * A value of the same name sent by the caller is replaced.
 */
public final class CredentialInjector {

    private final String targetBase;
    private final GatewayProperties.Credential settings;

    public CredentialInjector(String targetUrl, GatewayProperties.Credential settings) {
        Objects.requireNonNull(targetUrl, "targetUrl must not be null");
        this.targetBase = stripTrailingSlash(targetUrl.trim());
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public URI targetUri(ForwardRequest request, String key) {
        StringBuilder sb = new StringBuilder(targetBase);
        String path = stripLeadingSlash(request.path());
        if (!path.isEmpty()) sb.append('/').append(path);
        if (request.query() != null && !request.query().isEmpty()) sb.append('?').append(request.query());

        if (settings.getMode() != CredentialMode.QUERY) {
            return URI.create(sb.toString());
        }
        return UriComponentsBuilder.fromUriString(sb.toString())
                .replaceQueryParam(settings.getQueryParam(), UriUtils.encode(key, StandardCharsets.UTF_8))
                .build(true)
                .toUri();
    }

    public void applyHeader(HttpHeaders headers, String key) {
        if (settings.getMode() != CredentialMode.HEADER) return;
        String prefix = (settings.getHeaderPrefix() == null) ? "" : settings.getHeaderPrefix();
        headers.set(settings.getHeaderName(), prefix + key);
    }

    private static String stripTrailingSlash(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '/') end--;
        return s.substring(0, end);
    }

    private static String stripLeadingSlash(String s) {
        if (s == null) return "";
        int start = 0;
        while (start < s.length() && s.charAt(start) == '/') start++;
        return s.substring(start);
    }
}
