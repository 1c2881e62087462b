package com.github.dimitryivaniuta.keygateway.proxy.forward;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

/**
 * Inbound request as seen by the gateway.
 *
 * @param path  path below the proxy mount point, already URL-encoded, without leading slash (may be empty)
 * @param query raw (encoded) query string without '?', or null
 */
public record ForwardRequest(
        HttpMethod method,
        String path,
        String query,
        HttpHeaders headers,
        byte[] body
) {}
