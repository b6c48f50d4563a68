package io.github.yok.flexpipeline.engine.query;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One filter term: {@code <field> <operator> [<literal>]}, preceded by a connector when it is not
 * the first term.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Condition {

    /**
     * Logical connector joining a condition to the previous one.
     */
    public enum Connector {
        AND, OR
    }

    // null for the first condition
    private final Connector connector;

    private final String field;

    private final ComparisonOperator operator;

    // String, Long, Double or Boolean; null for IS [NOT] NULL
    private final Object literal;

    public Condition(Connector connector, String field, ComparisonOperator operator,
            Object literal) {
        this.connector = connector;
        this.field = field;
        this.operator = operator;
        this.literal = literal;
    }
}
