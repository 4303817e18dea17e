package com.vpcrouter.loadbalancer;

import java.nio.charset.StandardCharsets;

final class HashFunctions {

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private HashFunctions() {
    }

    /**
     * 64-bit FNV-1a over the UTF-8 bytes. Stable across JVMs, unlike {@link String#hashCode()}.
     */
    static long fnv1a(String value) {
        long hash = FNV_OFFSET_BASIS;
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }

    /**
     * FNV-1a followed by the murmur3 finalizer; short, similar keys such as
     * {@code host:port:17} otherwise land close together on the ring.
     */
    static long ringHash(String value) {
        long h = fnv1a(value);
        h ^= h >>> 33;
        h *= 0xff51afd7ed558ccdL;
        h ^= h >>> 33;
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= h >>> 33;
        return h;
    }
}
