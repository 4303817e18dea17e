package com.vpcrouter.router;

import java.util.Locale;

/**
 * How a route's path value is compared with the request path. Declared from the
 * least to the most specific; {@link #rank()} is used when several routes match.
 */
public enum PathMatchKind {
    WILDCARD,
    PREFIX,
    EXACT;

    public int rank() {
        return ordinal();
    }

    public static PathMatchKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return PREFIX;
        }
        return PathMatchKind.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
