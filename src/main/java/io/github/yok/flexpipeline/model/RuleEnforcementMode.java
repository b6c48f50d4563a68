package io.github.yok.flexpipeline.model;

import java.util.Locale;

/**
 * Enforcement mode applied when a custom rule (or, for {@link #STOP}, the schema) is violated.
 *
 * @author Yasuharu.Okawauchi
 */
public enum RuleEnforcementMode {

    // The first violated rule aborts the pipeline.
    STOP,

    // Violating rows are removed and recorded; the pipeline continues.
    SKIP;

    /**
     * Resolves a mode from its configuration value.
     *
     * @param value {@code stop} or {@code skip} (case-insensitive)
     * @return matching mode
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static RuleEnforcementMode fromValue(String value) {
        String key = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        for (RuleEnforcementMode mode : values()) {
            if (mode.name().equals(key)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported custom_validation_mode: " + value);
    }
}
