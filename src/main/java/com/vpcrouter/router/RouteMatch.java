package com.vpcrouter.router;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Match rule of a route: path rule plus optional method, header and query-parameter predicates.
 */
@Value
@Builder
public class RouteMatch {

    private static final String WILDCARD_SUFFIX = "/*";

    PathMatchKind kind;
    String path;
    /** Upper-cased; empty means any method. */
    @Singular
    Set<String> methods;
    /** Header name to required value. Names compare case-insensitively. */
    @Singular
    Map<String, String> headers;
    @Singular
    Map<String, String> queryParams;

    public boolean matches(RouteQuery query) {
        return matchesPath(query.getPath())
                && matchesMethod(query.getMethod())
                && matchesHeaders(query)
                && matchesQueryParams(query);
    }

    public boolean matchesPath(String requestPath) {
        if (requestPath == null) {
            return false;
        }
        return switch (kind) {
            case EXACT -> path.equals(requestPath);
            case PREFIX -> matchesPrefix(requestPath);
            case WILDCARD -> matchesUnder(wildcardBase(), requestPath);
        };
    }

    public boolean matchesMethod(String method) {
        return methods.isEmpty() || (method != null && methods.contains(method.toUpperCase(Locale.ROOT)));
    }

    private boolean matchesHeaders(RouteQuery query) {
        for (Map.Entry<String, String> predicate : headers.entrySet()) {
            List<String> values = query.getHeaders().get(predicate.getKey());
            if (values == null || !values.contains(predicate.getValue())) {
                return false;
            }
        }
        return true;
    }

    private boolean matchesQueryParams(RouteQuery query) {
        for (Map.Entry<String, String> predicate : queryParams.entrySet()) {
            List<String> values = query.getQueryParams().get(predicate.getKey());
            if (values == null || !values.contains(predicate.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Length of the significant part of the path rule; longer means more specific
     * within the same {@link PathMatchKind}.
     */
    public int specificity() {
        return kind == PathMatchKind.WILDCARD ? wildcardBase().length() : path.length();
    }

    private boolean matchesPrefix(String requestPath) {
        if (path.endsWith("/")) {
            return requestPath.startsWith(path);
        }
        return matchesUnder(path, requestPath);
    }

    // base itself, or anything below it on a segment boundary
    private static boolean matchesUnder(String base, String requestPath) {
        if (requestPath.equals(base)) {
            return true;
        }
        return requestPath.startsWith(base + "/");
    }

    private String wildcardBase() {
        if (path.endsWith(WILDCARD_SUFFIX)) {
            return path.substring(0, path.length() - WILDCARD_SUFFIX.length());
        }
        if (path.endsWith("*")) {
            return path.substring(0, path.length() - 1);
        }
        return path;
    }
}
