package com.github.dimitryivaniuta.keygateway.proxy.forward;

import org.springframework.http.HttpHeaders;

/**
 * Upstream answer relayed to the caller as-is, whatever the status code.
 */
public record UpstreamResponse(int status, HttpHeaders headers, byte[] body) {}
