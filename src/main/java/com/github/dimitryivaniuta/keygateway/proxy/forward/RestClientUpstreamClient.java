package com.github.dimitryivaniuta.keygateway.proxy.forward;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.util.Objects;

/**
 * {@link UpstreamClient} on Spring's {@link RestClient}. Uses {@code exchange(...)} so
 * 4xx/5xx answers are returned as data instead of raising.
 */
public final class RestClientUpstreamClient implements UpstreamClient {

    private final RestClient restClient;

    public RestClientUpstreamClient(RestClient restClient) {
        this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
    }

    @Override
    public UpstreamResponse exchange(HttpMethod method, URI uri, HttpHeaders headers, byte[] body) {
        try {
            RestClient.RequestBodySpec spec = restClient.method(method)
                    .uri(uri)
                    .headers(h -> h.addAll(headers));
            if (body != null && body.length > 0) {
                spec.body(body);
            }
            return spec.exchange((request, response) -> {
                HttpHeaders copy = new HttpHeaders();
                copy.addAll(response.getHeaders());
                byte[] payload = StreamUtils.copyToByteArray(response.getBody());
                return new UpstreamResponse(response.getStatusCode().value(), copy, payload);
            });
        } catch (ResourceAccessException ex) {
            throw new UpstreamUnavailableException(
                    "Error contacting the target API: " + ex.getMostSpecificCause().getMessage(),
                    isTimeout(ex),
                    ex
            );
        }
    }

    private static boolean isTimeout(Throwable ex) {
        for (Throwable t = ex; t != null; t = (t.getCause() == t) ? null : t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) return true;
        }
        return false;
    }
}
