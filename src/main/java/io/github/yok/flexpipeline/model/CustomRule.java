package io.github.yok.flexpipeline.model;

import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A named business rule applied to one field of the deduplicated dataset.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CustomRule {

    private final String field;

    private final RuleKind kind;

    private final Map<String, Object> params;

    /**
     * Creates a rule.
     *
     * @param field target field
     * @param kind rule kind
     * @param params rule parameters, may be {@code null}; {@code null} values are dropped
     */
    public CustomRule(String field, RuleKind kind, Map<String, Object> params) {
        this.field = field;
        this.kind = kind;
        Map<String, Object> copy = new LinkedHashMap<>();
        if (params != null) {
            params.forEach((k, v) -> {
                if (v != null) {
                    copy.put(k, v);
                }
            });
        }
        this.params = ImmutableMap.copyOf(copy);
    }

    /**
     * Returns a numeric parameter without narrowing it.
     *
     * @param name parameter name
     * @param defaultValue value used when the parameter is absent
     * @return parameter value
     * @throws IllegalArgumentException if the parameter is present but not a number
     */
    public BigDecimal getDecimalParam(String name, BigDecimal defaultValue) {
        Object value = params.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Parameter '" + name + "' of rule " + describe() + " is not a number: "
                            + value, e);
        }
    }

    /**
     * Returns a short identity of this rule, e.g. {@code birthday_on age_gte}.
     *
     * @return rule identity
     */
    public String describe() {
        return field + " " + Objects.requireNonNull(kind).getConfigName();
    }
}
