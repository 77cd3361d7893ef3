package dev.matchengine.model;

import java.util.Locale;

public enum CacheStrategy {
    /** Serve a fresh cached ranking, otherwise compute and store. */
    HYBRID,
    /** Always compute; the cache is neither read nor written. */
    OFF;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CacheStrategy parse(String value) {
        if (value == null || value.isBlank()) {
            return HYBRID;
        }
        return "off".equals(value.trim().toLowerCase(Locale.ROOT)) ? OFF : HYBRID;
    }
}
