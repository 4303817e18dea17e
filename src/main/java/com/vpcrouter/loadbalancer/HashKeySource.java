package com.vpcrouter.loadbalancer;

import lombok.Value;

import java.util.Locale;

/**
 * Where a consistent-hash route takes its request key from.
 */
@Value
public class HashKeySource {

    public enum Type {
        PATH,
        HEADER,
        CLIENT_ADDRESS
    }

    Type type;
    String headerName;

    public static HashKeySource path() {
        return new HashKeySource(Type.PATH, null);
    }

    public static HashKeySource header(String headerName) {
        return new HashKeySource(Type.HEADER, headerName);
    }

    public static HashKeySource clientAddress() {
        return new HashKeySource(Type.CLIENT_ADDRESS, null);
    }

    public static HashKeySource of(String type, String headerName) {
        if (type == null || type.isBlank()) {
            return clientAddress();
        }
        Type parsed = Type.valueOf(type.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        return parsed == Type.HEADER ? header(headerName) : new HashKeySource(parsed, null);
    }

    /**
     * Key for this request; a missing header falls back to the client address.
     */
    public String resolve(SelectionContext context) {
        return switch (type) {
            case PATH -> context.getPath();
            case HEADER -> {
                String value = context.getHeaders().getFirst(headerName);
                yield value != null ? value : context.getClientAddress();
            }
            case CLIENT_ADDRESS -> context.getClientAddress();
        };
    }
}
