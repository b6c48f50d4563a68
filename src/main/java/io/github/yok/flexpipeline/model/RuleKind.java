package io.github.yok.flexpipeline.model;

import java.util.List;
import java.util.Locale;
import lombok.Getter;

/**
 * Kinds of custom business rule.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum RuleKind {

    // The age implied by a date field, in whole years, must be at least params.min_age.
    AGE_GTE("age_gte", "min_age");

    // Name used in the transformations configuration
    private final String configName;

    // Parameters that must be numeric when present
    private final List<String> numericParams;

    RuleKind(String configName, String... numericParams) {
        this.configName = configName;
        this.numericParams = List.of(numericParams);
    }

    /**
     * Resolves a kind from its configuration name.
     *
     * @param value configuration name (case-insensitive)
     * @return matching kind
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static RuleKind fromValue(String value) {
        String key = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (RuleKind kind : values()) {
            if (kind.configName.equals(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported custom validation: " + value);
    }
}
