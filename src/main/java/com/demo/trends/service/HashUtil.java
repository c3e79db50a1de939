package com.demo.trends.service;

import java.nio.charset.StandardCharsets;

public class HashUtil {

    private static final int FNV_OFFSET = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    /** 32-bit FNV-1a over UTF-8 bytes, returned unsigned. Same input gives the same value on every JVM. */
    public static long fnv1a(String key) {
        int h = FNV_OFFSET;
        for (byte b : key.getBytes(StandardCharsets.UTF_8)) {
            h ^= (b & 0xff);
            h *= FNV_PRIME;
        }
        return Integer.toUnsignedLong(h);
    }

    public static int bucket(String key, int modulo) {
        return (int) (fnv1a(key) % modulo);
    }
}
