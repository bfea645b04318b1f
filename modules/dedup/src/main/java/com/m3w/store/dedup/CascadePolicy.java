package com.m3w.store.dedup;

import java.util.Locale;

/**
 * Whether a library or playlist row is removed when some of its songs could
 * not be cleaned up.
 */
public enum CascadePolicy {
    /** Always remove the parent row; per-song failures are only reported. */
    BEST_EFFORT,
    /** Keep the parent row when any song failed, so the deletion can be retried. */
    STRICT;

    /**
     * Parses {@code best-effort} / {@code strict} (case-insensitive, {@code _} or {@code -}).
     */
    public static CascadePolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return BEST_EFFORT;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown cascade policy: " + value, e);
        }
    }
}
