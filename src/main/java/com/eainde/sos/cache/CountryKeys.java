package com.eainde.sos.cache;

import java.util.Locale;

/**
 * Normalizes country names into cache keys, so "United  Kingdom " and
 * "united kingdom" share one entry.
 */
public final class CountryKeys {

    private CountryKeys() {}

    public static String normalize(String country) {
        if (country == null) {
            throw new IllegalArgumentException("country must not be null");
        }
        String key = country.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("country must not be blank");
        }
        return key;
    }

    /** Trims and collapses whitespace but keeps the caller's casing for display. */
    public static String displayName(String country) {
        return country.trim().replaceAll("\\s+", " ");
    }
}
