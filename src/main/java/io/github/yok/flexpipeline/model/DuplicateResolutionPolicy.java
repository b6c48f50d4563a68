package io.github.yok.flexpipeline.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Policy applied to groups of records sharing the same composite key value.
 *
 * @author Yasuharu.Okawauchi
 */
public enum DuplicateResolutionPolicy {

    // Retain the earliest record of each group.
    KEEP_FIRST("keep_first", "first"),

    // Retain the latest record of each group.
    KEEP_LAST("keep_last", "last"),

    // Remove every record of each group, including the one that would otherwise survive.
    EXCLUDE_ALL("exclude_all");

    // Canonical configuration value
    private final String label;

    private final Set<String> names;

    DuplicateResolutionPolicy(String... names) {
        this.label = names[0];
        this.names = Arrays.stream(names).collect(Collectors.toSet());
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a policy from its configuration value.
     *
     * @param value configuration value, e.g. {@code keep_last} or {@code last}
     * @return matching policy
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static DuplicateResolutionPolicy fromValue(String value) {
        String key = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (DuplicateResolutionPolicy policy : values()) {
            if (policy.names.contains(key)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unsupported duplicate_resolution: " + value);
    }
}
