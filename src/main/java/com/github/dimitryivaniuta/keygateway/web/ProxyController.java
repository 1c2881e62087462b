package com.github.dimitryivaniuta.keygateway.web;

import com.github.dimitryivaniuta.keygateway.proxy.forward.ForwardRequest;
import com.github.dimitryivaniuta.keygateway.proxy.forward.ForwardingGateway;
import com.github.dimitryivaniuta.keygateway.proxy.forward.HopByHopHeaders;
import com.github.dimitryivaniuta.keygateway.proxy.forward.UpstreamResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StreamUtils;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;

/**
 * Single catch-all endpoint: everything under /proxy/ is forwarded to the target URL with
 * the remaining path and the raw query string appended.
 */
@RestController
@RequiredArgsConstructor
public class ProxyController {

    static final String MOUNT = "/proxy";

    private final ForwardingGateway gateway;

    @RequestMapping(
            value = {MOUNT, MOUNT + "/**"},
            method = {RequestMethod.GET, RequestMethod.POST, RequestMethod.PUT, RequestMethod.DELETE,
                    RequestMethod.PATCH, RequestMethod.HEAD, RequestMethod.OPTIONS}
    )
    public ResponseEntity<byte[]> proxy(HttpServletRequest request,
                                        @RequestHeader HttpHeaders headers) throws IOException {
        // Raw bytes as received: form bodies must not go through parameter parsing.
        byte[] body = StreamUtils.copyToByteArray(request.getInputStream());
        ForwardRequest fr = new ForwardRequest(
                HttpMethod.valueOf(request.getMethod()),
                remainingPath(request),
                request.getQueryString(),
                headers,
                (body.length == 0) ? null : body
        );

        UpstreamResponse upstream = gateway.forward(fr);

        return ResponseEntity.status(upstream.status())
                .headers(HopByHopHeaders.forCaller(upstream.headers()))
                .body(upstream.body());
    }

    // Raw (still encoded) path below the mount point, without leading slash.
    static String remainingPath(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String prefix = request.getContextPath() + MOUNT;
        String rest = uri.startsWith(prefix) ? uri.substring(prefix.length()) : "";
        int start = 0;
        while (start < rest.length() && rest.charAt(start) == '/') start++;
        return rest.substring(start);
    }
}
