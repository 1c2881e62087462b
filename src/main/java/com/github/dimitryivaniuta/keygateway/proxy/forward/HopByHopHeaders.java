package com.github.dimitryivaniuta.keygateway.proxy.forward;

import org.springframework.http.HttpHeaders;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Connection-specific headers (RFC 7230 section 6.1) plus the ones the HTTP client
 * or servlet container must compute itself. Any header named in a {@code Connection}
 * value is connection-specific too and is dropped along with the fixed set.
 */
public final class HopByHopHeaders {
    private HopByHopHeaders() {}

    private static final Set<String> REQUEST = Set.of(
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "te",
            "trailer",
            "transfer-encoding",
            "upgrade",
            "host",
            "content-length",
            "expect"
    );

    private static final Set<String> RESPONSE = Set.of(
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "te",
            "trailer",
            "transfer-encoding",
            "upgrade",
            "content-length"
    );

    public static HttpHeaders forUpstream(HttpHeaders inbound) {
        return copyWithout(inbound, REQUEST);
    }

    public static HttpHeaders forCaller(HttpHeaders upstream) {
        return copyWithout(upstream, RESPONSE);
    }

    private static HttpHeaders copyWithout(HttpHeaders source, Set<String> skip) {
        HttpHeaders out = new HttpHeaders();
        if (source == null) return out;
        Set<String> named = connectionTokens(source);
        source.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (!skip.contains(lower) && !named.contains(lower)) {
                out.addAll(name, values);
            }
        });
        return out;
    }

    // "Connection: close, X-Internal" -> {close, x-internal}
    static Set<String> connectionTokens(HttpHeaders headers) {
        List<String> values = headers.get(HttpHeaders.CONNECTION);
        if (values == null || values.isEmpty()) return Set.of();
        Set<String> out = new HashSet<>();
        for (String value : values) {
            if (value == null) continue;
            for (String token : value.split(",")) {
                String t = token.trim();
                if (!t.isEmpty()) out.add(t.toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }
}
