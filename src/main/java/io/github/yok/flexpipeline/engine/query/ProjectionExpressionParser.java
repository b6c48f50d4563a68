package io.github.yok.flexpipeline.engine.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Parses projection expressions into {@link ProjectionQuery} instances.
 *
 * <p>
 * Accepted grammar (keywords are case-insensitive):
 * </p>
 *
 * <pre>
 * SELECT (* | ident {, ident}) FROM ident
 *   [WHERE cond {(AND | OR) cond}]
 *   [ORDER BY ident [ASC | DESC] {, ident [ASC | DESC]}]
 * cond := ident (= | &lt;&gt; | != | &lt; | &lt;= | &gt; | &gt;=) literal
 *       | ident IS [NOT] NULL
 * literal := 'text' | number | TRUE | FALSE
 * </pre>
 *
 * <p>
 * Identifiers may be bare or double-quoted. A trailing semicolon is tolerated. Anything else is
 * rejected with an {@link IllegalArgumentException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ProjectionExpressionParser {

    private static final Set<String> KEYWORDS = Set.of("SELECT", "FROM", "WHERE", "AND", "OR",
            "IS", "NOT", "NULL", "ORDER", "BY", "ASC", "DESC", "TRUE", "FALSE");

    private enum TokenType {
        WORD, QUOTED_IDENT, STRING, NUMBER, SYMBOL, END
    }

    private static final class Token {
        final TokenType type;
        final String text;
        final int position;

        Token(TokenType type, String text, int position) {
            this.type = type;
            this.text = text;
            this.position = position;
        }

        boolean isKeyword(String keyword) {
            return type == TokenType.WORD && text.equalsIgnoreCase(keyword);
        }

        boolean isSymbol(String symbol) {
            return type == TokenType.SYMBOL && text.equals(symbol);
        }
    }

    /**
     * Parses an expression.
     *
     * @param expression expression text
     * @return structured query
     * @throws IllegalArgumentException on any syntax error
     */
    public ProjectionQuery parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Projection expression is empty");
        }
        return new Cursor(tokenize(expression)).parseQuery();
    }

    private static List<Token> tokenize(String s) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < s.length()
                        && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(TokenType.WORD, s.substring(start, i), start));
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < s.length()
                    && Character.isDigit(s.charAt(i + 1)))) {
                int start = i++;
                while (i < s.length() && (Character.isDigit(s.charAt(i)) || s.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(TokenType.NUMBER, s.substring(start, i), start));
            } else if (c == '\'' || c == '"') {
                int start = i;
                StringBuilder text = new StringBuilder();
                i++;
                while (true) {
                    if (i >= s.length()) {
                        throw new IllegalArgumentException(
                                "Unterminated quote starting at position " + start);
                    }
                    char ch = s.charAt(i);
                    if (ch == c) {
                        if (i + 1 < s.length() && s.charAt(i + 1) == c) {
                            text.append(c);
                            i += 2;
                            continue;
                        }
                        i++;
                        break;
                    }
                    text.append(ch);
                    i++;
                }
                tokens.add(new Token(c == '\'' ? TokenType.STRING : TokenType.QUOTED_IDENT,
                        text.toString(), start));
            } else if (c == '<' || c == '>' || c == '!') {
                int start = i++;
                if (i < s.length() && (s.charAt(i) == '=' || (c == '<' && s.charAt(i) == '>'))) {
                    i++;
                }
                String op = s.substring(start, i);
                if ("!".equals(op)) {
                    throw new IllegalArgumentException("Unexpected '!' at position " + start);
                }
                tokens.add(new Token(TokenType.SYMBOL, op, start));
            } else if (c == '=' || c == ',' || c == '*' || c == ';') {
                tokens.add(new Token(TokenType.SYMBOL, String.valueOf(c), i));
                i++;
            } else {
                throw new IllegalArgumentException(
                        "Unexpected character '" + c + "' at position " + i);
            }
        }
        tokens.add(new Token(TokenType.END, "", s.length()));
        return tokens;
    }

    private static final class Cursor {

        private final List<Token> tokens;
        private int index;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        ProjectionQuery parseQuery() {
            expectKeyword("SELECT");
            List<String> fields = new ArrayList<>();
            if (peek().isSymbol("*")) {
                next();
            } else {
                fields.add(identifier());
                while (peek().isSymbol(",")) {
                    next();
                    fields.add(identifier());
                }
            }
            expectKeyword("FROM");
            String entity = identifier();

            List<Condition> conditions = new ArrayList<>();
            if (peek().isKeyword("WHERE")) {
                next();
                conditions.add(condition(null));
                while (peek().isKeyword("AND") || peek().isKeyword("OR")) {
                    Condition.Connector connector = Condition.Connector
                            .valueOf(next().text.toUpperCase(Locale.ROOT));
                    conditions.add(condition(connector));
                }
            }

            List<OrderItem> orderBy = new ArrayList<>();
            if (peek().isKeyword("ORDER")) {
                next();
                expectKeyword("BY");
                do {
                    if (!orderBy.isEmpty()) {
                        next();
                    }
                    String field = identifier();
                    boolean descending = false;
                    if (peek().isKeyword("ASC")) {
                        next();
                    } else if (peek().isKeyword("DESC")) {
                        next();
                        descending = true;
                    }
                    orderBy.add(new OrderItem(field, descending));
                } while (peek().isSymbol(","));
            }

            if (peek().isSymbol(";")) {
                next();
            }
            if (peek().type != TokenType.END) {
                throw unexpected(peek());
            }
            return new ProjectionQuery(fields, entity, conditions, orderBy);
        }

        private Condition condition(Condition.Connector connector) {
            String field = identifier();
            if (peek().isKeyword("IS")) {
                next();
                boolean negated = false;
                if (peek().isKeyword("NOT")) {
                    next();
                    negated = true;
                }
                expectKeyword("NULL");
                return new Condition(connector, field,
                        negated ? ComparisonOperator.IS_NOT_NULL : ComparisonOperator.IS_NULL,
                        null);
            }
            Token opToken = next();
            Optional<ComparisonOperator> op = opToken.type == TokenType.SYMBOL
                    ? ComparisonOperator.fromSymbol(opToken.text)
                    : Optional.empty();
            if (op.isEmpty()) {
                throw unexpected(opToken);
            }
            return new Condition(connector, field, op.get(), literal());
        }

        private Object literal() {
            Token t = next();
            switch (t.type) {
                case STRING:
                    return t.text;
                case NUMBER:
                    try {
                        return t.text.contains(".") ? (Object) Double.valueOf(t.text)
                                : (Object) Long.valueOf(t.text);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException(
                                "Invalid number '" + t.text + "' at position " + t.position, e);
                    }
                case WORD:
                    if (t.isKeyword("TRUE")) {
                        return Boolean.TRUE;
                    }
                    if (t.isKeyword("FALSE")) {
                        return Boolean.FALSE;
                    }
                    throw unexpected(t);
                default:
                    throw unexpected(t);
            }
        }

        private String identifier() {
            Token t = next();
            if (t.type == TokenType.QUOTED_IDENT) {
                return t.text;
            }
            if (t.type == TokenType.WORD && !KEYWORDS.contains(t.text.toUpperCase(Locale.ROOT))) {
                return t.text;
            }
            throw new IllegalArgumentException("Expected identifier but found '" + t.text
                    + "' at position " + t.position);
        }

        private void expectKeyword(String keyword) {
            Token t = next();
            if (!t.isKeyword(keyword)) {
                throw new IllegalArgumentException("Expected " + keyword + " but found '"
                        + t.text + "' at position " + t.position);
            }
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token next() {
            Token t = tokens.get(index);
            if (t.type != TokenType.END) {
                index++;
            }
            return t;
        }

        private static IllegalArgumentException unexpected(Token t) {
            if (t.type == TokenType.END) {
                return new IllegalArgumentException("Unexpected end of expression");
            }
            return new IllegalArgumentException(
                    "Unexpected token '" + t.text + "' at position " + t.position);
        }
    }
}
