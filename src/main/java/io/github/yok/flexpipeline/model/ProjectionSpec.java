package io.github.yok.flexpipeline.model;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Declarative definition of one projection.
 *
 * <p>
 * The expression is written against the logical entity name, e.g.
 * {@code SELECT employee_id, email FROM employees WHERE country = 'ES'}. Aliases map a schema
 * field name to the output column name; the map keeps declaration order.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ProjectionSpec {

    private final String name;

    private final ProjectionKind kind;

    private final String expression;

    private final Map<String, String> aliases;

    /**
     * Creates a projection definition.
     *
     * @param name relation name
     * @param kind view or table
     * @param expression relational expression, may be blank
     * @param aliases original field → alias, may be {@code null}
     */
    public ProjectionSpec(String name, ProjectionKind kind, String expression,
            Map<String, String> aliases) {
        this.name = name;
        this.kind = kind;
        this.expression = expression;
        this.aliases = aliases == null ? ImmutableMap.of() : ImmutableMap.copyOf(aliases);
    }
}
