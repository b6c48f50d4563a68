package io.github.yok.flexpipeline.engine.query;

import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;

/**
 * Comparison operators allowed in projection filters.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum ComparisonOperator {

    EQ("="),
    NE("<>"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    IS_NULL("IS NULL"),
    IS_NOT_NULL("IS NOT NULL");

    private final String sql;

    ComparisonOperator(String sql) {
        this.sql = sql;
    }

    /**
     * Resolves a binary operator symbol. {@code !=} is accepted as {@link #NE}.
     *
     * @param symbol operator text
     * @return matching operator, or empty if the symbol is not a binary comparison
     */
    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        if ("!=".equals(symbol)) {
            return Optional.of(NE);
        }
        return Arrays.stream(values()).filter(ComparisonOperator::isBinary)
                .filter(op -> op.sql.equals(symbol)).findFirst();
    }

    public boolean isBinary() {
        return this != IS_NULL && this != IS_NOT_NULL;
    }
}
