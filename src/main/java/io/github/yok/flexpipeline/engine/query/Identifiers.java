package io.github.yok.flexpipeline.engine.query;

import java.util.regex.Pattern;

/**
 * Helpers for SQL identifiers.
 *
 * <p>
 * Every identifier rendered into SQL is double-quoted, so names keep their case and cannot be
 * confused with keywords. Relation and alias names must additionally be plain identifiers.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class Identifiers {

    private static final Pattern PLAIN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private Identifiers() {
        // Utility class; do not instantiate.
    }

    /**
     * Returns whether the name is a plain identifier ({@code [A-Za-z_][A-Za-z0-9_]*}).
     *
     * @param name candidate name
     * @return {@code true} if plain
     */
    public static boolean isPlain(String name) {
        return name != null && PLAIN.matcher(name).matches();
    }

    /**
     * Checks that the name is a plain identifier.
     *
     * @param name candidate name
     * @param what description used in the error message
     * @return {@code name}
     * @throws IllegalArgumentException if the name is not plain
     */
    public static String requirePlain(String name, String what) {
        if (!isPlain(name)) {
            throw new IllegalArgumentException("Invalid " + what + " identifier: '" + name + "'");
        }
        return name;
    }

    /**
     * Double-quotes an identifier, doubling embedded quotes.
     *
     * @param name identifier
     * @return quoted identifier
     */
    public static String quote(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }
}
