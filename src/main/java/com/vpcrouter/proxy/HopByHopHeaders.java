package com.vpcrouter.proxy;

import org.springframework.http.HttpHeaders;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Connection-management headers that belong to a single hop and are never relayed.
 */
public final class HopByHopHeaders {

    private static final Set<String> NAMES = Set.of(
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "proxy-connection",
            "te",
            "trailer",
            "trailers",
            "transfer-encoding",
            "upgrade",
            // set by the client library for the new hop
            "host",
            "content-length");

    private HopByHopHeaders() {
    }

    public static boolean isHopByHop(String name) {
        return NAMES.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Copy of {@code headers} without hop-by-hop fields, including any listed in {@code Connection}.
     */
    public static HttpHeaders strip(HttpHeaders headers) {
        Set<String> extra = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (String value : headers.getOrEmpty(HttpHeaders.CONNECTION)) {
            for (String token : value.split(",")) {
                if (!token.isBlank()) {
                    extra.add(token.trim());
                }
            }
        }
        HttpHeaders stripped = new HttpHeaders();
        headers.forEach((name, values) -> {
            if (!isHopByHop(name) && !extra.contains(name)) {
                stripped.addAll(name, values);
            }
        });
        return stripped;
    }
}
