package io.github.yok.flexpipeline.engine.query;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import lombok.Getter;
import lombok.ToString;

/**
 * Structured form of a projection expression.
 *
 * <p>
 * Produced by {@link ProjectionExpressionParser}. The query never carries SQL text from the
 * configuration; {@link #toSql(String, List, Map)} renders it with every identifier quoted and
 * every literal escaped.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class ProjectionQuery {

    // empty when the query selects "*"
    private final ImmutableList<String> fields;

    private final String entity;

    private final ImmutableList<Condition> conditions;

    private final ImmutableList<OrderItem> orderBy;

    public ProjectionQuery(List<String> fields, String entity, List<Condition> conditions,
            List<OrderItem> orderBy) {
        this.fields = ImmutableList.copyOf(fields);
        this.entity = entity;
        this.conditions = ImmutableList.copyOf(conditions);
        this.orderBy = ImmutableList.copyOf(orderBy);
    }

    public boolean isSelectAll() {
        return fields.isEmpty();
    }

    /**
     * Returns every field identifier the query references (select list, filters and ordering).
     *
     * @return referenced identifiers in order of appearance, duplicates included
     */
    public List<String> referencedFields() {
        List<String> refs = new ArrayList<>(fields);
        conditions.forEach(c -> refs.add(c.getField()));
        orderBy.forEach(o -> refs.add(o.getField()));
        return refs;
    }

    /**
     * Renders the query as SQL against the given relation.
     *
     * @param relation relation to select from (replaces the entity name)
     * @param allFields column list used to expand {@code *} when aliases must be applied
     * @param aliases source field → output name; entries whose source is not selected are ignored
     * @return SQL text
     */
    public String toSql(String relation, List<String> allFields, Map<String, String> aliases) {
        StringBuilder sql = new StringBuilder("SELECT ");
        if (isSelectAll() && aliases.isEmpty()) {
            sql.append('*');
        } else {
            StringJoiner select = new StringJoiner(", ");
            for (String field : isSelectAll() ? allFields : fields) {
                String column = Identifiers.quote(field);
                String alias = aliases.get(field);
                select.add(alias == null ? column : column + " AS " + Identifiers.quote(alias));
            }
            sql.append(select);
        }
        sql.append(" FROM ").append(Identifiers.quote(relation));

        if (!conditions.isEmpty()) {
            sql.append(" WHERE");
            for (Condition c : conditions) {
                if (c.getConnector() != null) {
                    sql.append(' ').append(c.getConnector().name());
                }
                sql.append(' ').append(Identifiers.quote(c.getField())).append(' ')
                        .append(c.getOperator().getSql());
                if (c.getOperator().isBinary()) {
                    sql.append(' ').append(renderLiteral(c.getLiteral()));
                }
            }
        }

        if (!orderBy.isEmpty()) {
            StringJoiner order = new StringJoiner(", ", " ORDER BY ", "");
            orderBy.forEach(o -> order
                    .add(Identifiers.quote(o.getField()) + (o.isDescending() ? " DESC" : " ASC")));
            sql.append(order);
        }
        return sql.toString();
    }

    static String renderLiteral(Object literal) {
        if (literal instanceof String) {
            return "'" + ((String) literal).replace("'", "''") + "'";
        }
        if (literal instanceof Boolean) {
            return ((Boolean) literal) ? "TRUE" : "FALSE";
        }
        return String.valueOf(literal);
    }
}
