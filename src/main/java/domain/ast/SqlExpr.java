package domain.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Expression node of the formatter AST.
 *
 * <p>Parser output (JSqlParser objects or node-sql-parser JSON) is converted into these
 * records once at ingestion; the renderer only ever matches on this closed set.</p>
 */
public interface SqlExpr {

    /** {@code table.column}; table may be null. */
    record ColumnRef(String table, String column) implements SqlExpr {
        public ColumnRef {
            column = column == null ? "" : column;
        }
    }

    /** Numeric literal kept in its source spelling. */
    record NumberLiteral(String text) implements SqlExpr {
    }

    record StringLiteral(QuoteStyle style, String value) implements SqlExpr {
        public StringLiteral {
            style = style == null ? QuoteStyle.SINGLE : style;
            value = value == null ? "" : value;
        }
    }

    record BooleanLiteral(boolean value) implements SqlExpr {
    }

    record NullLiteral() implements SqlExpr {
    }

    /** {@code DATE '2024-01-01'} and friends; value is the unquoted body. */
    record TemporalLiteral(TemporalKind kind, String value) implements SqlExpr {
    }

    /** Text emitted verbatim (DEFAULT, CURRENT_DATE, parser-native fragments). */
    record RawValue(String text) implements SqlExpr {
        public RawValue {
            text = text == null ? "" : text;
        }
    }

    record Star() implements SqlExpr {
    }

    /**
     * Binary operator node. {@code parenthesized} is set when the source wrapped the node in
     * parentheses that the tree shape alone does not imply.
     */
    record BinaryExpr(String operator, SqlExpr left, SqlExpr right, boolean parenthesized) implements SqlExpr {
        public BinaryExpr {
            operator = operator == null ? "" : operator;
        }

        public BinaryExpr(String operator, SqlExpr left, SqlExpr right) {
            this(operator, left, right, false);
        }
    }

    /** Prefix (NOT, -, EXISTS) or postfix (IS NULL) operator; see the renderer for which is which. */
    record UnaryExpr(String operator, SqlExpr operand) implements SqlExpr {
        public UnaryExpr {
            operator = operator == null ? "" : operator;
        }
    }

    record FunctionCall(String name, List<SqlExpr> args) implements SqlExpr {
        public FunctionCall {
            args = copy(args);
        }
    }

    /** Aggregate with at most one argument; argument is {@link Star} for {@code count(*)}, null for {@code f()}. */
    record AggregateCall(String name, boolean distinct, SqlExpr argument) implements SqlExpr {
    }

    record WindowCall(String name, List<SqlExpr> args, boolean distinct, WindowSpec window) implements SqlExpr {
        public WindowCall {
            args = copy(args);
            window = window == null ? WindowSpec.EMPTY : window;
        }
    }

    /** Searched CASE when operand is null, simple CASE otherwise. */
    record CaseExpr(SqlExpr operand, List<WhenClause> whens, SqlExpr elseResult) implements SqlExpr {
        public CaseExpr {
            whens = copy(whens);
        }
    }

    record CastExpr(SqlExpr expr, String targetType, CastStyle style) implements SqlExpr {
        public CastExpr {
            style = style == null ? CastStyle.CALL : style;
        }
    }

    record ArrayExpr(List<SqlExpr> elements) implements SqlExpr {
        public ArrayExpr {
            elements = copy(elements);
        }
    }

    /** Bind parameter in its source spelling ({@code ?}, {@code :id}). */
    record Param(String text) implements SqlExpr {
    }

    /** Parenthesized list: IN lists, BETWEEN bounds, row values. */
    record ExprList(List<SqlExpr> items) implements SqlExpr {
        public ExprList {
            items = copy(items);
        }
    }

    record IntervalExpr(SqlExpr value, String unit) implements SqlExpr {
    }

    record ExtractExpr(String field, SqlExpr source) implements SqlExpr {
    }

    /** Nested SELECT used as an expression or as the operand of IN/EXISTS/ANY/ALL. */
    record Subquery(SqlStatement.SelectStatement query) implements SqlExpr {
    }

    /** Anything the ingestion layer did not recognize; value may be null. */
    record Unsupported(String kind, String value) implements SqlExpr {
    }

    record WhenClause(SqlExpr condition, SqlExpr result) {
    }

    record WindowSpec(List<SqlExpr> partitionBy, List<OrderItem> orderBy, String frame) {

        public static final WindowSpec EMPTY = new WindowSpec(List.of(), List.of(), null);

        public WindowSpec {
            partitionBy = copy(partitionBy);
            orderBy = copy(orderBy);
        }

        public boolean isEmpty() {
            return partitionBy.isEmpty() && orderBy.isEmpty() && (frame == null || frame.isBlank());
        }
    }

    enum QuoteStyle {
        SINGLE("", "'"),
        DOUBLE("", "\""),
        BACKTICK("", "`"),
        NATIONAL("N", "'"),
        HEX("X", "'"),
        BIT("B", "'"),
        REGEX("~", "'");

        private final String prefix;
        private final String quote;

        QuoteStyle(String prefix, String quote) {
            this.prefix = prefix;
            this.quote = quote;
        }

        public String quote(String body) {
            return prefix + quote + body + quote;
        }
    }

    enum TemporalKind {
        DATE, TIME, TIMESTAMP, DATETIME
    }

    enum CastStyle {
        /** {@code CAST(x AS t)} */
        CALL,
        /** {@code x::t} */
        OPERATOR
    }

    private static <T> List<T> copy(List<T> in) {
        if (in == null || in.isEmpty()) return List.of();
        List<T> out = new ArrayList<>(in.size());
        for (T t : in) {
            if (t != null) out.add(t);
        }
        return Collections.unmodifiableList(out);
    }
}
