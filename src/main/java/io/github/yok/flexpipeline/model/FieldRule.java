package io.github.yok.flexpipeline.model;

import java.util.Optional;
import java.util.regex.Pattern;
import lombok.Getter;
import lombok.ToString;

/**
 * Validation rule for a single schema field.
 *
 * <p>
 * Holds the field type, the required flag, an optional regular expression (matched against the
 * whole value) and an optional inclusive numeric minimum. The minimum is only meaningful for
 * numeric types.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public class FieldRule {

    private final FieldType type;

    private final boolean required;

    @ToString.Exclude
    private final Pattern pattern;

    private final Double minimum;

    /**
     * Creates a rule.
     *
     * @param type field type
     * @param required whether a value must be present
     * @param pattern regular expression source, or {@code null}
     * @param minimum inclusive minimum, or {@code null}
     * @throws java.util.regex.PatternSyntaxException if the pattern is malformed
     */
    public FieldRule(FieldType type, boolean required, String pattern, Double minimum) {
        this.type = type;
        this.required = required;
        this.pattern = pattern == null ? null : Pattern.compile(pattern);
        this.minimum = minimum;
    }

    /**
     * Returns the compiled pattern, if configured.
     *
     * @return optional pattern
     */
    public Optional<Pattern> getPattern() {
        return Optional.ofNullable(pattern);
    }

    /**
     * Returns the inclusive minimum, if configured.
     *
     * @return optional minimum
     */
    public Optional<Double> getMinimum() {
        return Optional.ofNullable(minimum);
    }
}
