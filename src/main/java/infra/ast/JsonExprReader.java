package infra.ast;

import com.fasterxml.jackson.databind.JsonNode;
import domain.ast.OrderItem;
import domain.ast.SqlExpr;
import domain.ast.SqlExpr.AggregateCall;
import domain.ast.SqlExpr.ArrayExpr;
import domain.ast.SqlExpr.BinaryExpr;
import domain.ast.SqlExpr.BooleanLiteral;
import domain.ast.SqlExpr.CaseExpr;
import domain.ast.SqlExpr.CastExpr;
import domain.ast.SqlExpr.CastStyle;
import domain.ast.SqlExpr.ColumnRef;
import domain.ast.SqlExpr.ExprList;
import domain.ast.SqlExpr.ExtractExpr;
import domain.ast.SqlExpr.FunctionCall;
import domain.ast.SqlExpr.IntervalExpr;
import domain.ast.SqlExpr.NullLiteral;
import domain.ast.SqlExpr.NumberLiteral;
import domain.ast.SqlExpr.Param;
import domain.ast.SqlExpr.QuoteStyle;
import domain.ast.SqlExpr.RawValue;
import domain.ast.SqlExpr.Star;
import domain.ast.SqlExpr.StringLiteral;
import domain.ast.SqlExpr.Subquery;
import domain.ast.SqlExpr.TemporalKind;
import domain.ast.SqlExpr.TemporalLiteral;
import domain.ast.SqlExpr.UnaryExpr;
import domain.ast.SqlExpr.Unsupported;
import domain.ast.SqlExpr.WhenClause;
import domain.ast.SqlExpr.WindowCall;
import domain.ast.SqlExpr.WindowSpec;
import domain.model.FormatWarning;
import domain.model.FormatWarningSink;
import domain.model.WarningCode;

import java.util.ArrayList;
import java.util.List;

import static infra.ast.AstNames.textOrNull;

/**
 * Expression half of {@link JsonAstReader}.
 */
final class JsonExprReader {

    private final JsonAstReader statements;
    private final FormatWarningSink sink;

    JsonExprReader(JsonAstReader statements, FormatWarningSink sink) {
        this.statements = statements;
        this.sink = sink;
    }

    SqlExpr expr(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return null;
        if (n.isArray()) return new ExprList(list(n));
        if (!n.isObject()) return new RawValue(n.asText());

        JsonNode ast = n.get("ast");
        if (ast != null && ast.isObject()) return new Subquery(statements.select(ast));

        String type = textOrNull(n.get("type"));
        if (type == null) {
            JsonNode cols = n.get("columns");
            if (cols != null && cols.isArray()) return new ExprList(list(cols));
            return unsupported("undefined", n);
        }

        switch (type) {
            case "column_ref":
                return columnRef(n);
            case "binary_expr":
                return binary(n);
            case "unary_expr":
                return new UnaryExpr(textOrNull(n.get("operator")), expr(n.get("expr")));
            case "function":
                return function(n);
            case "aggr_func":
                return aggregate(n);
            case "window_func":
                return windowFunc(n);
            case "case":
                return caseExpr(n);
            case "cast":
                return cast(n);
            case "array":
                return new ArrayExpr(list(n.get("value")));
            case "param":
                return new Param(value(n));
            case "expr_list":
                return new ExprList(list(n.get("value")));
            case "interval":
                return new IntervalExpr(expr(n.get("expr")), textOrNull(n.get("unit")));
            case "extract":
                return extract(n);
            case "backticks_quote_string":
                return new StringLiteral(QuoteStyle.BACKTICK, value(n));
            case "double_quote_string":
                return new StringLiteral(QuoteStyle.DOUBLE, value(n));
            case "single_quote_string":
            case "string":
                return new StringLiteral(QuoteStyle.SINGLE, value(n));
            case "natural_string":
                return new StringLiteral(QuoteStyle.NATIONAL, value(n));
            case "regex_string":
                return new StringLiteral(QuoteStyle.REGEX, value(n));
            case "hex_string":
                return new StringLiteral(QuoteStyle.HEX, value(n));
            case "bit_string":
                return new StringLiteral(QuoteStyle.BIT, value(n));
            case "number":
                return new NumberLiteral(value(n));
            case "bool":
            case "boolean":
                return new BooleanLiteral(n.path("value").asBoolean(false)
                        || "true".equalsIgnoreCase(value(n)));
            case "null":
                return new NullLiteral();
            case "date":
                return new TemporalLiteral(TemporalKind.DATE, value(n));
            case "time":
                return new TemporalLiteral(TemporalKind.TIME, value(n));
            case "timestamp":
                return new TemporalLiteral(TemporalKind.TIMESTAMP, value(n));
            case "datetime":
                return new TemporalLiteral(TemporalKind.DATETIME, value(n));
            case "star":
                return new Star();
            case "origin":
            case "default":
                return new RawValue(value(n));
            default:
                return unsupported(type, n);
        }
    }

    List<SqlExpr> list(JsonNode n) {
        List<SqlExpr> out = new ArrayList<>();
        if (n == null || n.isNull()) return out;
        if (n.isArray()) {
            for (JsonNode item : n) out.add(expr(item));
            return out;
        }
        // {type:'expr_list', value:[...]}
        JsonNode v = n.get("value");
        if (n.isObject() && "expr_list".equals(textOrNull(n.get("type"))) && v != null && v.isArray()) {
            return list(v);
        }
        out.add(expr(n));
        return out;
    }

    List<OrderItem> orderItems(JsonNode n) {
        List<OrderItem> out = new ArrayList<>();
        if (n == null || !n.isArray()) return out;
        for (JsonNode o : n) {
            JsonNode e = o.has("expr") ? o.get("expr") : o;
            out.add(new OrderItem(expr(e), OrderItem.Direction.parse(textOrNull(o.get("type")))));
        }
        return out;
    }

    private SqlExpr columnRef(JsonNode n) {
        String table = AstNames.plainText(n.get("table"));
        JsonNode col = n.get("column");
        String column = AstNames.columnName(col);
        if (column == null) {
            column = unresolved(AstNames.UNKNOWN_COLUMN, "column", col);
        }
        if ("*".equals(column) && table == null) return new Star();
        return new ColumnRef(table, column);
    }

    private SqlExpr binary(JsonNode n) {
        String op = textOrNull(n.get("operator"));
        boolean parens = n.path("parentheses").asBoolean(false);
        return new BinaryExpr(op == null ? "" : op, expr(n.get("left")), expr(n.get("right")), parens);
    }

    private SqlExpr function(JsonNode n) {
        String name = AstNames.functionName(n.get("name"));
        if (name == null) name = unresolved(AstNames.UNKNOWN_FUNCTION, "function", n.get("name"));
        List<SqlExpr> args = args(n.get("args"));
        JsonNode over = n.get("over");
        if (over != null && over.isObject()) {
            return new WindowCall(name, args, false, windowSpec(over));
        }
        return new FunctionCall(name, args);
    }

    private List<SqlExpr> args(JsonNode args) {
        if (args == null || args.isNull()) return List.of();
        if (args.isArray()) return list(args);
        JsonNode v = args.get("value");
        if (v != null && v.isArray()) return list(v);
        if (args.has("expr")) return list(args.get("expr"));
        return List.of();
    }

    private SqlExpr aggregate(JsonNode n) {
        String name = AstNames.functionName(n.get("name"));
        if (name == null) name = unresolved(AstNames.UNKNOWN_FUNCTION, "aggregate", n.get("name"));
        JsonNode args = n.get("args");
        SqlExpr arg = args == null ? null : expr(args.get("expr"));
        boolean distinct = args != null && distinctFlag(args.get("distinct"));
        JsonNode over = n.get("over");
        if (over != null && over.isObject()) {
            return new WindowCall(name, arg == null ? List.of() : List.of(arg), distinct, windowSpec(over));
        }
        return new AggregateCall(name, distinct, arg);
    }

    private SqlExpr windowFunc(JsonNode n) {
        String name = AstNames.functionName(n.get("name"));
        if (name == null) name = unresolved(AstNames.UNKNOWN_FUNCTION, "window function", n.get("name"));
        JsonNode over = n.get("over");
        WindowSpec spec = over == null || !over.isObject() ? WindowSpec.EMPTY : windowSpec(over);
        return new WindowCall(name, args(n.get("args")), false, spec);
    }

    private WindowSpec windowSpec(JsonNode over) {
        JsonNode spec = over.path("as_window_specification").path("window_specification");
        if (!spec.isObject()) return WindowSpec.EMPTY;

        List<SqlExpr> partition = new ArrayList<>();
        JsonNode pb = spec.get("partitionby");
        if (pb != null && pb.isArray()) {
            for (JsonNode p : pb) partition.add(expr(p.has("expr") ? p.get("expr") : p));
        }
        String frame = null;
        JsonNode f = spec.get("window_frame_clause");
        if (f != null && !f.isNull()) {
            frame = f.isValueNode() ? f.asText() : textOrNull(f.get("raw"));
        }
        return new WindowSpec(partition, orderItems(spec.get("orderby")), frame);
    }

    private SqlExpr caseExpr(JsonNode n) {
        List<WhenClause> whens = new ArrayList<>();
        SqlExpr elseResult = null;
        JsonNode args = n.get("args");
        if (args != null && args.isArray()) {
            for (JsonNode a : args) {
                String t = textOrNull(a.get("type"));
                if ("when".equals(t)) {
                    whens.add(new WhenClause(expr(a.get("cond")), expr(a.get("result"))));
                } else if ("else".equals(t)) {
                    elseResult = expr(a.get("result"));
                }
            }
        }
        return new CaseExpr(expr(n.get("expr")), whens, elseResult);
    }

    private SqlExpr cast(JsonNode n) {
        String symbol = textOrNull(n.get("symbol"));
        String operator = textOrNull(n.get("operator"));
        CastStyle style = "::".equals(symbol) || "::".equals(operator) ? CastStyle.OPERATOR : CastStyle.CALL;
        return new CastExpr(expr(n.get("expr")), targetType(n.get("target")), style);
    }

    /** {@code "INT"}, {@code {dataType, length, scale}} or an array of those. */
    static String targetType(JsonNode target) {
        if (target == null || target.isNull()) return "UNKNOWN";
        if (target.isValueNode()) return target.asText();
        if (target.isArray()) return target.size() == 0 ? "UNKNOWN" : targetType(target.get(0));
        String type = textOrNull(target.get("dataType"));
        if (type == null) return "UNKNOWN";
        String length = textOrNull(target.get("length"));
        if (length == null) return type;
        String scale = textOrNull(target.get("scale"));
        return type + "(" + length + (scale == null ? "" : ", " + scale) + ")";
    }

    private SqlExpr extract(JsonNode n) {
        JsonNode args = n.get("args");
        JsonNode holder = args != null && args.isObject() ? args : n;
        String field = AstNames.plainText(holder.get("field"));
        return new ExtractExpr(field == null ? "UNKNOWN" : field, expr(holder.get("source")));
    }

    static boolean distinctFlag(JsonNode d) {
        if (d == null || d.isNull()) return false;
        if (d.isBoolean()) return d.asBoolean();
        if (d.isTextual()) return "DISTINCT".equalsIgnoreCase(d.asText().trim());
        return d.isObject() && "DISTINCT".equalsIgnoreCase(textOrNull(d.get("type")));
    }

    private static String value(JsonNode n) {
        JsonNode v = n.get("value");
        if (v == null || v.isNull()) return "";
        return v.isValueNode() ? v.asText() : v.toString();
    }

    private SqlExpr unsupported(String type, JsonNode n) {
        JsonNode v = n.get("value");
        String text = v != null && v.isValueNode() ? v.asText() : null;
        return new Unsupported(type, text);
    }

    private String unresolved(String sentinel, String what, JsonNode node) {
        sink.warn(new FormatWarning(WarningCode.UNRESOLVED_NAME, null,
                "unrecognized " + what + " name shape", node == null ? "" : node.toString()));
        return sentinel;
    }
}
