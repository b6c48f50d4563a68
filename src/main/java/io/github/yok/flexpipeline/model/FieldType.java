package io.github.yok.flexpipeline.model;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of the primitive field types a schema can declare.
 *
 * <p>
 * Each type defines the names accepted in the transformations configuration (for example
 * {@code int} and {@code integer} both select {@link #INTEGER}), the SQL column type used when the
 * validated dataset is loaded into the query engine, and the coercion applied to raw CSV cells.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum FieldType {

    // Free text; never fails coercion.
    STRING("VARCHAR", "string", "str", "string"),

    // 64-bit integer; integral decimals such as "12.0" are accepted.
    INTEGER("BIGINT", "integer", "int", "integer", "long"),

    // Double-precision floating point number.
    FLOAT("DOUBLE PRECISION", "float", "float", "double"),

    // true/false, 1/0, yes/no, on/off (case-insensitive).
    BOOLEAN("BOOLEAN", "boolean", "bool", "boolean");

    private static final Set<String> TRUE_LITERALS = Set.of("true", "1", "yes", "on", "y", "t");
    private static final Set<String> FALSE_LITERALS = Set.of("false", "0", "no", "off", "n", "f");

    // SQL column type used by the query engine
    private final String sqlType;

    // Human-readable name used in validation messages
    private final String label;

    // Set of configuration names for this type (all lowercase)
    private final Set<String> names;

    FieldType(String sqlType, String label, String... names) {
        this.sqlType = sqlType;
        this.label = label;
        this.names = Arrays.stream(names).map(n -> n.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Resolves a type from its configuration name.
     *
     * @param name configuration name (case-insensitive); {@code null} selects {@link #STRING}
     * @return matching type
     * @throws IllegalArgumentException if the name is not recognized
     */
    public static FieldType fromName(String name) {
        if (name == null) {
            return STRING;
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (FieldType type : values()) {
            if (type.names.contains(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported field type: " + name);
    }

    /**
     * Coerces a non-null raw value into this type's Java representation.
     *
     * <p>
     * The returned value is a {@link String}, {@link Long}, {@link Double} or {@link Boolean}
     * respectively.
     * </p>
     *
     * @param raw raw value (usually the CSV cell text)
     * @return coerced value
     * @throws IllegalArgumentException if the value cannot be represented in this type
     */
    public Object coerce(Object raw) {
        switch (this) {
            case STRING:
                return raw.toString();
            case INTEGER:
                return toLong(raw);
            case FLOAT:
                return toDouble(raw);
            case BOOLEAN:
                return toBoolean(raw);
            default:
                throw new IllegalStateException("Unhandled field type: " + this);
        }
    }

    /**
     * Returns whether this type carries a numeric value (minimum bounds apply).
     *
     * @return {@code true} for {@link #INTEGER} and {@link #FLOAT}
     */
    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    private static Long toLong(Object raw) {
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short) {
            return ((Number) raw).longValue();
        }
        String text = raw.toString().trim();
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            try {
                return new BigDecimal(text).longValueExact();
            } catch (NumberFormatException | ArithmeticException ex) {
                throw new IllegalArgumentException("value is not a valid integer", ex);
            }
        }
    }

    private static Double toDouble(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        try {
            return Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("value is not a valid float", e);
        }
    }

    private static Boolean toBoolean(Object raw) {
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        String text = raw.toString().trim().toLowerCase(Locale.ROOT);
        if (TRUE_LITERALS.contains(text)) {
            return Boolean.TRUE;
        }
        if (FALSE_LITERALS.contains(text)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("value could not be parsed to a boolean");
    }
}
