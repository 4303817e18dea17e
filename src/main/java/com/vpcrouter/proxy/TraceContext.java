package com.vpcrouter.proxy;

import lombok.Value;

import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * W3C trace context carried in the {@code traceparent} header:
 * {@code version-traceId-spanId-flags}.
 */
@Value
public class TraceContext {

    public static final String TRACEPARENT_HEADER = "traceparent";

    private static final Pattern TRACE_ID = Pattern.compile("[0-9a-f]{32}");
    private static final Pattern SPAN_ID = Pattern.compile("[0-9a-f]{16}");
    private static final Pattern FLAGS = Pattern.compile("[0-9a-f]{2}");
    private static final String INVALID_TRACE_ID = "0".repeat(32);
    private static final String INVALID_SPAN_ID = "0".repeat(16);

    String traceId;
    String spanId;
    String flags;

    /**
     * Parse a {@code traceparent} value; null when absent or malformed.
     */
    public static TraceContext parse(String header) {
        if (header == null) {
            return null;
        }
        String[] parts = header.trim().toLowerCase(Locale.ROOT).split("-");
        if (parts.length < 4) {
            return null;
        }
        String traceId = parts[1];
        String spanId = parts[2];
        String flags = parts[3];
        if (!TRACE_ID.matcher(traceId).matches() || traceId.equals(INVALID_TRACE_ID)
                || !SPAN_ID.matcher(spanId).matches() || spanId.equals(INVALID_SPAN_ID)
                || !FLAGS.matcher(flags).matches()) {
            return null;
        }
        return new TraceContext(traceId, spanId, flags);
    }

    public static TraceContext generate() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        String traceId = hex(random.nextLong()) + hex(random.nextLong());
        String spanId = hex(random.nextLong());
        return new TraceContext(traceId, spanId, "01");
    }

    public String toHeader() {
        return "00-" + traceId + "-" + spanId + "-" + flags;
    }

    private static String hex(long value) {
        // all-zero ids are invalid per the W3C format
        return String.format("%016x", value == 0 ? 1 : value);
    }
}
