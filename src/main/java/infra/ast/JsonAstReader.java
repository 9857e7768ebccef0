package infra.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import domain.ast.SqlExpr;
import domain.ast.SqlStatement;
import domain.ast.SqlStatement.Assignment;
import domain.ast.SqlStatement.CommonTableExpr;
import domain.ast.SqlStatement.DeleteStatement;
import domain.ast.SqlStatement.DerivedTable;
import domain.ast.SqlStatement.FromItem;
import domain.ast.SqlStatement.InsertStatement;
import domain.ast.SqlStatement.LimitClause;
import domain.ast.SqlStatement.SelectColumn;
import domain.ast.SqlStatement.SelectStatement;
import domain.ast.SqlStatement.TableSource;
import domain.ast.SqlStatement.UnresolvedSource;
import domain.ast.SqlStatement.UnsupportedStatement;
import domain.ast.SqlStatement.UpdateStatement;
import domain.ast.SqlStatement.WithClause;
import domain.model.FormatWarning;
import domain.model.FormatWarningSink;
import domain.model.WarningCode;
import domain.parse.SqlParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static infra.ast.AstNames.textOrNull;

/**
 * Reads node-sql-parser style JSON into the formatter AST.
 *
 * <p>Accepts a statement object, an array of statements, or the parser's
 * {@code {"ast": ...}} envelope. Loose shapes are resolved here once; name nodes that match
 * no known shape become sentinel names and raise {@link WarningCode#UNRESOLVED_NAME}.</p>
 */
public final class JsonAstReader {

    private static final Logger log = LoggerFactory.getLogger(JsonAstReader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final FormatWarningSink sink;
    private final JsonExprReader exprs;

    public JsonAstReader() {
        this(FormatWarningSink.none());
    }

    public JsonAstReader(FormatWarningSink sink) {
        this.sink = sink == null ? FormatWarningSink.none() : sink;
        this.exprs = new JsonExprReader(this, this.sink);
    }

    /**
     * @throws SqlParseException when the text is not JSON
     */
    public List<SqlStatement> read(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json == null ? "" : json);
        } catch (JsonProcessingException e) {
            throw new SqlParseException("invalid AST JSON: " + e.getOriginalMessage(), e);
        }
        return read(root);
    }

    public List<SqlStatement> read(JsonNode root) {
        List<SqlStatement> out = new ArrayList<>();
        collect(root, out);
        if (out.isEmpty()) {
            throw new SqlParseException("AST JSON holds no statement");
        }
        return out;
    }

    private void collect(JsonNode n, List<SqlStatement> out) {
        if (n == null || n.isNull() || n.isMissingNode()) return;
        if (n.isArray()) {
            for (JsonNode item : n) collect(item, out);
            return;
        }
        if (!n.isObject()) return;
        if (!n.has("type") && n.has("ast")) {
            collect(n.get("ast"), out);
            return;
        }
        out.add(statement(n));
    }

    SqlStatement statement(JsonNode n) {
        String type = textOrNull(n.get("type"));
        String kind = type == null ? "" : type.toLowerCase(Locale.ROOT);
        switch (kind) {
            case "select":
                return select(n);
            case "insert":
            case "replace":
                return insert(n);
            case "update":
                return update(n);
            case "delete":
                return delete(n);
            default:
                log.debug("No renderer for statement type '{}'", type);
                return new UnsupportedStatement(type == null ? "unknown" : type.toUpperCase(Locale.ROOT));
        }
    }

    // ------------------------------------------------------------
    // SELECT
    // ------------------------------------------------------------

    SelectStatement select(JsonNode n) {
        if (n.has("ast") && !n.has("type")) return select(n.get("ast"));

        SelectStatement s = new SelectStatement(
                null,
                JsonExprReader.distinctFlag(n.get("distinct")),
                columns(n.get("columns")),
                from(n.get("from")),
                exprs.expr(n.get("where")),
                groupBy(n.get("groupby")),
                exprs.expr(n.get("having")),
                exprs.orderItems(n.get("orderby")),
                limit(n.get("limit")),
                null);

        JsonNode with = n.get("with");
        if (with != null && !with.isNull()) {
            s = s.withWith(with(with));
        }

        JsonNode next = n.get("_next");
        if (next != null && next.isObject()) {
            String op = textOrNull(n.get("set_op"));
            s = s.appendSetOperation(op == null ? "UNION" : op.toUpperCase(Locale.ROOT), select(next));
        }
        return s;
    }

    private WithClause with(JsonNode with) {
        if (!with.isArray()) {
            warn(WarningCode.MALFORMED_CLAUSE, "WITH clause is not a list", with);
            return WithClause.malformed();
        }
        List<CommonTableExpr> ctes = new ArrayList<>();
        for (JsonNode cte : with) {
            String name = AstNames.cteName(cte.get("name"));
            if (name == null) {
                warn(WarningCode.UNRESOLVED_NAME, "unrecognized CTE name shape", cte.get("name"));
                name = AstNames.UNNAMED_CTE;
            }
            JsonNode stmt = cte.path("stmt");
            JsonNode body = stmt.has("ast") ? stmt.get("ast") : stmt;
            if (!body.isObject()) {
                warn(WarningCode.MALFORMED_CLAUSE, "CTE '" + name + "' has no body", cte);
                return WithClause.malformed();
            }
            ctes.add(new CommonTableExpr(name, select(body)));
        }
        return new WithClause(ctes, true);
    }

    private List<SelectColumn> columns(JsonNode n) {
        List<SelectColumn> out = new ArrayList<>();
        if (n == null || n.isNull()) return out;
        if (n.isTextual()) {
            out.add(new SelectColumn(new SqlExpr.Star(), null));
            return out;
        }
        if (!n.isArray()) return out;
        for (JsonNode c : n) {
            if (c.isTextual() && "*".equals(c.asText())) {
                out.add(new SelectColumn(new SqlExpr.Star(), null));
                continue;
            }
            JsonNode e = c.has("expr") ? c.get("expr") : c;
            out.add(new SelectColumn(exprs.expr(e), AstNames.alias(c.get("as"))));
        }
        return out;
    }

    private List<FromItem> from(JsonNode n) {
        List<FromItem> out = new ArrayList<>();
        if (n == null || !n.isArray()) return out;
        for (JsonNode f : n) {
            out.add(fromItem(f, !out.isEmpty()));
        }
        return out;
    }

    private FromItem fromItem(JsonNode f, boolean joinable) {
        String alias = AstNames.alias(f.get("as"));
        String join = joinable ? joinKeyword(textOrNull(f.get("join"))) : null;
        SqlExpr on = join == null ? null : exprs.expr(f.get("on"));

        List<String> using = new ArrayList<>();
        JsonNode u = f.get("using");
        if (u != null && u.isArray()) {
            for (JsonNode col : u) {
                String c = AstNames.columnName(col);
                if (c != null) using.add(c);
            }
        }

        JsonNode expr = f.get("expr");
        if (expr != null && expr.isObject() && expr.has("ast")) {
            return new FromItem(new DerivedTable(select(expr.get("ast"))), alias, join, on, using);
        }
        String table = AstNames.tableName(f);
        if (table == null) {
            warn(WarningCode.UNRESOLVED_NAME, "unrecognized table shape", f);
            return new FromItem(new UnresolvedSource(AstNames.UNKNOWN_TABLE), alias, join, on, using);
        }
        return new FromItem(new TableSource(table), alias, join, on, using);
    }

    private static String joinKeyword(String join) {
        if (join == null || join.isBlank()) return null;
        String j = join.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        return j.equals("JOIN") ? "INNER JOIN" : j;
    }

    private List<SqlExpr> groupBy(JsonNode n) {
        if (n == null || n.isNull()) return List.of();
        if (n.isObject() && n.has("columns")) return exprs.list(n.get("columns"));
        return exprs.list(n);
    }

    /** {@code {seperator: "" | "offset" | ",", value: [...]}}. */
    private LimitClause limit(JsonNode n) {
        if (n == null || !n.isObject()) return null;
        JsonNode values = n.get("value");
        if (values == null || !values.isArray() || values.size() == 0) return null;
        String sep = textOrNull(n.get("seperator"));
        SqlExpr first = exprs.expr(values.get(0));
        SqlExpr second = values.size() > 1 ? exprs.expr(values.get(1)) : null;
        if (second == null) return new LimitClause(first, null);
        if (",".equals(sep)) return new LimitClause(second, first);
        return new LimitClause(first, second);
    }

    // ------------------------------------------------------------
    // DML
    // ------------------------------------------------------------

    private SqlStatement insert(JsonNode n) {
        String table = firstTable(n.get("table"));
        List<String> columns = new ArrayList<>();
        JsonNode cols = n.get("columns");
        if (cols != null && cols.isArray()) {
            for (JsonNode c : cols) {
                String name = c.has("column") ? AstNames.columnName(c.get("column")) : AstNames.columnName(c);
                columns.add(name == null ? AstNames.UNKNOWN_COLUMN : name);
            }
        }

        JsonNode values = n.get("values");
        JsonNode select = n.get("select");
        if (values != null && values.isObject()) {
            String vt = textOrNull(values.get("type"));
            if ("select".equals(vt) || values.has("ast")) {
                return new InsertStatement(table, columns, List.of(), select(values));
            }
            if ("values".equals(vt)) values = values.get("values");
        }
        if (select != null && select.isObject()) {
            return new InsertStatement(table, columns, List.of(), select(select));
        }

        List<List<SqlExpr>> rows = new ArrayList<>();
        if (values != null && values.isArray()) {
            for (JsonNode row : values) rows.add(exprs.list(row));
        }
        return new InsertStatement(table, columns, rows, null);
    }

    private SqlStatement update(JsonNode n) {
        JsonNode tables = n.get("table");
        String table = firstTable(tables);
        String alias = tables != null && tables.isArray() && tables.size() > 0
                ? AstNames.alias(tables.get(0).get("as")) : null;

        List<Assignment> assignments = new ArrayList<>();
        JsonNode set = n.get("set");
        if (set != null && set.isArray()) {
            for (JsonNode a : set) {
                String col = AstNames.columnName(a.get("column"));
                if (col == null) {
                    warn(WarningCode.UNRESOLVED_NAME, "unrecognized column name shape", a.get("column"));
                    col = AstNames.UNKNOWN_COLUMN;
                }
                String t = AstNames.plainText(a.get("table"));
                assignments.add(new Assignment(t == null ? col : t + "." + col, exprs.expr(a.get("value"))));
            }
        }
        return new UpdateStatement(table, alias, assignments, exprs.expr(n.get("where")));
    }

    private SqlStatement delete(JsonNode n) {
        JsonNode from = n.get("from");
        String table = from != null && from.isArray() && from.size() > 0 ? firstTable(from) : firstTable(n.get("table"));
        return new DeleteStatement(table, exprs.expr(n.get("where")));
    }

    private String firstTable(JsonNode tables) {
        JsonNode first = tables != null && tables.isArray() && tables.size() > 0 ? tables.get(0) : tables;
        String name = AstNames.tableName(first);
        if (name == null) {
            warn(WarningCode.UNRESOLVED_NAME, "unrecognized table shape", first);
            return AstNames.UNKNOWN_TABLE;
        }
        return name;
    }

    private void warn(WarningCode code, String message, JsonNode node) {
        log.debug("{}: {}", code, message);
        sink.warn(new FormatWarning(code, null, message, node == null ? "" : node.toString()));
    }
}
