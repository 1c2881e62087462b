package com.github.dimitryivaniuta.keygateway.proxy.support;

public final class KeyMasking {
    private KeyMasking() {}

    private static final int VISIBLE_SUFFIX = 4;

    // Never log or expose a raw key; keep only the last few characters.
    public static String mask(String key) {
        if (key == null || key.isEmpty()) return "****";
        if (key.length() <= VISIBLE_SUFFIX * 2) return "****";
        return "****" + key.substring(key.length() - VISIBLE_SUFFIX);
    }

    // Low-cardinality, stable label for metrics and logs.
    public static String alias(int index) {
        return "key-" + index;
    }
}
