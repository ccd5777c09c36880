package com.configline.backend.override;

import java.nio.charset.StandardCharsets;

/** FNV-1a 32-bit bucketing; SDKs implement the same function so buckets agree everywhere. */
public final class Segmentation {
    private Segmentation() {}

    private static final int FNV_OFFSET = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    public static long fnv1a32(String input) {
        int hash = FNV_OFFSET;
        for (byte b : input.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return Integer.toUnsignedLong(hash);
    }

    /** Maps the hash of {@code value + seed} into [0, 1). */
    public static double unit(String value, String seed) {
        return fnv1a32(value + seed) / 4294967296.0;
    }

    public static boolean inRange(double unit, double fromPercentage, double toPercentage) {
        return unit >= fromPercentage / 100.0 && unit < toPercentage / 100.0;
    }
}
