package com.github.dimitryivaniuta.keygateway.proxy.forward;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.net.URI;

/**
 * Outbound HTTP capability. Any status returned by the upstream is data, not an error.
 */
public interface UpstreamClient {

    /**
     * @throws UpstreamUnavailableException if the upstream could not be reached or did not answer in time
     */
    UpstreamResponse exchange(HttpMethod method, URI uri, HttpHeaders headers, byte[] body);
}
