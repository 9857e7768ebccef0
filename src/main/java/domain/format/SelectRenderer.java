package domain.format;

import domain.ast.SqlExpr;
import domain.ast.SqlStatement.CommonTableExpr;
import domain.ast.SqlStatement.DerivedTable;
import domain.ast.SqlStatement.FromItem;
import domain.ast.SqlStatement.FromSource;
import domain.ast.SqlStatement.LimitClause;
import domain.ast.SqlStatement.SelectColumn;
import domain.ast.SqlStatement.SelectStatement;
import domain.ast.SqlStatement.TableSource;
import domain.ast.SqlStatement.UnresolvedSource;
import domain.ast.SqlStatement.WithClause;
import domain.model.WarningCode;

import java.util.ArrayList;
import java.util.List;

import static domain.format.TextLayout.indentLines;
import static domain.format.TextLayout.spaces;

/**
 * Composes the clause lines of a SELECT statement.
 *
 * <p>The context passed in already carries the gutter width; this class never recomputes it.
 * CTE bodies and set-operation continuations reuse the caller's context unchanged, embedded
 * SELECTs get a {@link IndentContext#deriveSubquery(int) subquery context}.</p>
 */
final class SelectRenderer {

    /** Derived tables are never narrower than this. */
    static final int MIN_DERIVED_TABLE_WIDTH = 8;

    static final String INVALID_CTE_PLACEHOLDER = "/* invalid CTE */";

    private final RenderSession session;
    private final ExpressionRenderer expressions;

    SelectRenderer(RenderSession session, ExpressionRenderer expressions) {
        this.session = session;
        this.expressions = expressions;
    }

    String render(SelectStatement stmt, IndentContext ctx) {
        if (!session.enter()) return RenderSession.NESTING_PLACEHOLDER;
        try {
            return renderClauses(stmt, ctx);
        } finally {
            session.exit();
        }
    }

    private String renderClauses(SelectStatement stmt, IndentContext ctx) {
        int w = ctx.getBaseKeywordWidth();
        List<String> parts = new ArrayList<>();

        if (stmt.with() != null) parts.add(withClause(stmt.with(), ctx));
        parts.add(selectList(stmt, ctx));
        if (!stmt.from().isEmpty()) parts.add(from(stmt.from(), ctx));
        if (stmt.where() != null) {
            parts.add(session.gutter("WHERE", w) + " " + expressions.render(stmt.where(), ctx.deriveSibling(ContextKind.WHERE_CLAUSE)));
        }
        if (!stmt.groupBy().isEmpty()) {
            parts.add(session.gutter("GROUP BY", w) + " " + expressions.joinArgs(stmt.groupBy(), ctx));
        }
        if (stmt.having() != null) {
            parts.add(session.gutter("HAVING", w) + " " + expressions.render(stmt.having(), ctx));
        }
        if (!stmt.orderBy().isEmpty()) {
            parts.add(session.gutter("ORDER BY", w) + " " + expressions.orderItems(stmt.orderBy(), ctx));
        }
        String limit = limit(stmt.limit(), ctx);
        if (limit != null) parts.add(limit);

        if (stmt.setOperation() != null && stmt.setOperation().next() != null) {
            parts.add(session.gutter(ExpressionRenderer.normOp(stmt.setOperation().operator()), w));
            parts.add(render(stmt.setOperation().next(), ctx));
        }
        return String.join("\n", parts);
    }

    // ------------------------------------------------------------
    // WITH
    // ------------------------------------------------------------

    private String withClause(WithClause with, IndentContext ctx) {
        int w = ctx.getBaseKeywordWidth();
        if (!with.wellFormed() || with.ctes().isEmpty()) {
            session.warn(WarningCode.MALFORMED_CLAUSE, "WITH clause has no usable CTE list", null);
            return session.gutter("WITH", w) + " " + INVALID_CTE_PLACEHOLDER;
        }
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < with.ctes().size(); i++) {
            CommonTableExpr cte = with.ctes().get(i);
            String name = cte.name() == null || cte.name().isBlank() ? "unnamed_cte" : cte.name();
            String head = name + " " + session.keyword("AS") + " (";
            lines.add(i == 0 ? session.gutter("WITH", w) + " " + head : spaces(w - 1) + ", " + head);
            // bodies share the block's width and stay at nest 0
            if (cte.body() != null) lines.add(render(cte.body(), ctx));
            lines.add(")");
        }
        return String.join("\n", lines);
    }

    // ------------------------------------------------------------
    // SELECT list
    // ------------------------------------------------------------

    private String selectList(SelectStatement stmt, IndentContext ctx) {
        int w = ctx.getBaseKeywordWidth();
        String head = session.gutter("SELECT", w);
        if (stmt.distinct()) head += " " + session.keyword("DISTINCT");
        List<SelectColumn> columns = stmt.columns();
        if (columns.isEmpty()) return head;

        IndentContext selectCtx = ctx.deriveSibling(ContextKind.SELECT_CLAUSE);
        boolean inlineFirst = columns.size() == 1 || session.layout() == SelectLayout.COMPACT;

        List<String> exprs = new ArrayList<>(columns.size());
        List<String> aliases = new ArrayList<>(columns.size());
        List<Integer> starts = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            SelectColumn c = columns.get(i);
            exprs.add(expressions.render(c.expr(), selectCtx));
            aliases.add(c.alias());
            starts.add(i == 0 && inlineFirst ? head.length() + 1 : w + 1);
        }
        List<String> cols = AliasColumnAligner.align(exprs, aliases, starts, session.keyword("AS"));

        StringBuilder sb = new StringBuilder(head);
        if (inlineFirst) {
            sb.append(' ').append(cols.get(0));
        } else {
            sb.append('\n').append(spaces(w + 1)).append(cols.get(0));
        }
        for (int i = 1; i < cols.size(); i++) {
            sb.append('\n').append(spaces(w - 1)).append(", ").append(cols.get(i));
        }
        return sb.toString();
    }

    // ------------------------------------------------------------
    // FROM / JOIN
    // ------------------------------------------------------------

    private String from(List<FromItem> items, IndentContext ctx) {
        int w = ctx.getBaseKeywordWidth();
        String first = session.gutter("FROM", w) + " " + tableRef(items.get(0), ctx);
        if (items.size() == 1) return first;

        List<String> lines = new ArrayList<>();
        lines.add(first);
        IndentContext joinCtx = ctx.deriveSibling(ContextKind.JOIN_CONDITION);
        for (int i = 1; i < items.size(); i++) {
            FromItem item = items.get(i);
            if (item.join() == null) {
                lines.add(spaces(w - 1) + ", " + tableRef(item, ctx));
                continue;
            }
            String line = session.gutter(item.join(), w) + " " + tableRef(item, ctx);
            if (!item.using().isEmpty()) {
                line += " " + session.keyword("USING") + " (" + String.join(", ", item.using()) + ")";
            }
            lines.add(line);
            if (item.on() != null) {
                List<SqlExpr> conjuncts = new ArrayList<>();
                ExpressionRenderer.flatten(item.on(), "AND", conjuncts);
                for (int c = 0; c < conjuncts.size(); c++) {
                    String kw = c == 0 ? "ON" : "AND";
                    lines.add(session.gutter(kw, w) + " " + expressions.render(conjuncts.get(c), joinCtx));
                }
            }
        }
        return String.join("\n", lines);
    }

    private String tableRef(FromItem item, IndentContext ctx) {
        FromSource src = item.source();
        String base;
        if (src instanceof TableSource t) {
            base = t.name();
        } else if (src instanceof DerivedTable d) {
            base = derivedTable(d.query(), ctx);
        } else if (src instanceof UnresolvedSource u) {
            session.warn(WarningCode.UNRESOLVED_NAME, "table reference emitted best-effort", u.name());
            base = u.name() == null || u.name().isBlank() ? "unknown_table" : u.name();
        } else {
            base = "unknown_table";
        }
        if (item.alias() == null || item.alias().isBlank()) return base;
        return base + " " + session.keyword("AS") + " " + item.alias();
    }

    private String derivedTable(SelectStatement query, IndentContext ctx) {
        int width = Math.max(MIN_DERIVED_TABLE_WIDTH, KeywordWidthAnalyzer.subqueryWidth(query));
        IndentContext subCtx = ctx.deriveSubquery(width);
        String body = render(query, subCtx);
        String indent = subCtx.closingIndentString();
        return "(\n" + indentLines(body, indent) + "\n" + indent + ")";
    }

    // ------------------------------------------------------------
    // LIMIT
    // ------------------------------------------------------------

    private String limit(LimitClause limit, IndentContext ctx) {
        if (limit == null) return null;
        int w = ctx.getBaseKeywordWidth();
        if (limit.count() != null) {
            String s = session.gutter("LIMIT", w) + " " + expressions.render(limit.count(), ctx);
            if (limit.offset() != null) {
                s += " " + session.keyword("OFFSET") + " " + expressions.render(limit.offset(), ctx);
            }
            return s;
        }
        if (limit.offset() != null) {
            return session.gutter("OFFSET", w) + " " + expressions.render(limit.offset(), ctx);
        }
        return null;
    }
}
