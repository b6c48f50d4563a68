package io.github.yok.flexpipeline.model;

import java.util.Locale;

/**
 * Kind of relation a projection materializes.
 *
 * @author Yasuharu.Okawauchi
 */
public enum ProjectionKind {

    // Logical relation, re-evaluated on every read.
    VIEW,

    // Materialized relation, frozen at creation time.
    TABLE;

    /**
     * Resolves a kind from its configuration value.
     *
     * @param value {@code view} or {@code table} (case-insensitive)
     * @return matching kind
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static ProjectionKind fromValue(String value) {
        String key = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        for (ProjectionKind kind : values()) {
            if (kind.name().equals(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported projection type: " + value);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
