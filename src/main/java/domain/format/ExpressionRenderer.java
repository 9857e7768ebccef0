package domain.format;

import domain.ast.OrderItem;
import domain.ast.SqlExpr;
import domain.ast.SqlExpr.AggregateCall;
import domain.ast.SqlExpr.ArrayExpr;
import domain.ast.SqlExpr.BinaryExpr;
import domain.ast.SqlExpr.BooleanLiteral;
import domain.ast.SqlExpr.CaseExpr;
import domain.ast.SqlExpr.CastExpr;
import domain.ast.SqlExpr.ColumnRef;
import domain.ast.SqlExpr.ExprList;
import domain.ast.SqlExpr.ExtractExpr;
import domain.ast.SqlExpr.FunctionCall;
import domain.ast.SqlExpr.IntervalExpr;
import domain.ast.SqlExpr.NullLiteral;
import domain.ast.SqlExpr.NumberLiteral;
import domain.ast.SqlExpr.Param;
import domain.ast.SqlExpr.RawValue;
import domain.ast.SqlExpr.Star;
import domain.ast.SqlExpr.StringLiteral;
import domain.ast.SqlExpr.Subquery;
import domain.ast.SqlExpr.TemporalLiteral;
import domain.ast.SqlExpr.UnaryExpr;
import domain.ast.SqlExpr.Unsupported;
import domain.ast.SqlExpr.WhenClause;
import domain.ast.SqlExpr.WindowCall;
import domain.ast.SqlExpr.WindowSpec;
import domain.ast.SqlStatement.SelectStatement;
import domain.model.WarningCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static domain.format.TextLayout.indentLines;
import static domain.format.TextLayout.spaces;

/**
 * Renders one expression subtree for a given {@link IndentContext}.
 *
 * <p>Created per render call together with its {@link SelectRenderer}; both share one
 * {@link RenderSession}.</p>
 */
final class ExpressionRenderer {

    private static final Logger log = LoggerFactory.getLogger(ExpressionRenderer.class);

    static final String UNSUPPORTED_PLACEHOLDER = "/* unsupported expression */";

    private static final Set<String> QUANTIFIERS = Set.of("ANY", "ALL", "SOME");
    private static final Set<String> PREFIX_SIGNS = Set.of("-", "+", "~", "!");

    private final RenderSession session;
    private final SelectRenderer selects;

    ExpressionRenderer(RenderSession session) {
        this.session = session;
        this.selects = new SelectRenderer(session, this);
    }

    SelectRenderer selects() {
        return selects;
    }

    String render(SqlExpr expr, IndentContext ctx) {
        if (expr == null) return "";
        if (!session.enter()) return RenderSession.NESTING_PLACEHOLDER;
        try {
            return dispatch(expr, ctx);
        } finally {
            session.exit();
        }
    }

    private String dispatch(SqlExpr expr, IndentContext ctx) {
        if (expr instanceof ColumnRef c) return column(c);
        if (expr instanceof NumberLiteral n) return n.text();
        if (expr instanceof StringLiteral s) return s.style().quote(s.value());
        if (expr instanceof BooleanLiteral b) return kw(b.value() ? "TRUE" : "FALSE");
        if (expr instanceof NullLiteral) return kw("NULL");
        if (expr instanceof TemporalLiteral t) return kw(t.kind().name()) + " '" + t.value() + "'";
        if (expr instanceof RawValue r) return r.text();
        if (expr instanceof Star) return "*";
        if (expr instanceof BinaryExpr b) return binary(b, ctx);
        if (expr instanceof UnaryExpr u) return unary(u, ctx);
        if (expr instanceof FunctionCall f) return function(f, ctx);
        if (expr instanceof AggregateCall a) return aggregate(a, ctx);
        if (expr instanceof WindowCall w) return window(w, ctx);
        if (expr instanceof CaseExpr c) return caseExpr(c, ctx, -1);
        if (expr instanceof CastExpr c) return cast(c, ctx);
        if (expr instanceof ArrayExpr a) return kw("ARRAY") + "[" + joinArgs(a.elements(), ctx.deriveChild(ContextKind.FUNCTION_ARG)) + "]";
        if (expr instanceof Param p) return p.text();
        if (expr instanceof ExprList l) return "(" + joinArgs(l.items(), ctx.deriveChild(ContextKind.FUNCTION_ARG)) + ")";
        if (expr instanceof IntervalExpr i) return interval(i, ctx);
        if (expr instanceof ExtractExpr e) return extract(e, ctx);
        if (expr instanceof Subquery s) return scalarSubquery(s.query(), ctx);
        if (expr instanceof Unsupported u) return unsupported(u);
        return unsupported(new Unsupported(expr.getClass().getSimpleName(), null));
    }

    // ------------------------------------------------------------
    // leaves
    // ------------------------------------------------------------

    private static String column(ColumnRef c) {
        if (c.table() == null || c.table().isBlank()) return c.column();
        return c.table() + "." + c.column();
    }

    private String unsupported(Unsupported u) {
        log.debug("Unsupported expression node: {}", u.kind());
        session.warn(WarningCode.UNSUPPORTED_EXPRESSION, "unsupported expression: " + u.kind(), u.value());
        if (u.value() != null && !u.value().isBlank()) return u.value();
        return UNSUPPORTED_PLACEHOLDER;
    }

    // ------------------------------------------------------------
    // operators
    // ------------------------------------------------------------

    private String binary(BinaryExpr b, IndentContext ctx) {
        if (b.parenthesized()) {
            return "(" + binaryBody(b, ctx.deriveChild(ContextKind.FUNCTION_ARG)) + ")";
        }
        return binaryBody(b, ctx);
    }

    private String binaryBody(BinaryExpr b, IndentContext ctx) {
        String op = normOp(b.operator());

        // NOT wrapping BETWEEN / IN: "a NOT (BETWEEN ...)" encodings
        if (op.equals("NOT") && b.right() instanceof BinaryExpr inner) {
            String innerOp = normOp(inner.operator());
            if (innerOp.equals("BETWEEN")) return between(b.left(), inner.right(), true, ctx);
            if (innerOp.equals("IN")) return subqueryPredicate(render(b.left(), ctx), "NOT IN", inner.right(), ctx);
        }
        if (op.equals("BETWEEN")) return between(b.left(), b.right(), false, ctx);
        if (op.equals("NOT BETWEEN")) return between(b.left(), b.right(), true, ctx);
        if (op.equals("IN") || op.equals("NOT IN")) {
            return subqueryPredicate(render(b.left(), ctx), op, b.right(), ctx);
        }
        if ((op.equals("AND") || op.equals("OR")) && flattens(ctx)) {
            return chain(b, op, ctx);
        }

        String left = render(b.left(), ctx);
        if (op.equals("=") && b.right() instanceof CaseExpr c && ctx.isConditionContext() && ctx.getNestLevel() == 0) {
            // WHEN lines go under the operator; condition text starts right after the keyword gutter
            int opCol = TextLayout.endColumn(left, ctx.getBaseKeywordWidth() + 1) + 1;
            return left + " = " + caseExpr(c, ctx, opCol);
        }
        return left + " " + opText(op) + " " + render(b.right(), ctx);
    }

    private static boolean flattens(IndentContext ctx) {
        return ctx.getNestLevel() == 0 && ctx.getKind() != ContextKind.CASE_WHEN;
    }

    /** One leaf per line; lines after the first start with the operator right-aligned to the gutter. */
    private String chain(BinaryExpr b, String op, IndentContext ctx) {
        List<SqlExpr> leaves = new ArrayList<>();
        flatten(b, op, leaves);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < leaves.size(); i++) {
            if (i > 0) sb.append('\n').append(session.gutter(op, ctx.getBaseKeywordWidth())).append(' ');
            sb.append(chainLeaf(leaves.get(i), ctx));
        }
        return sb.toString();
    }

    private String chainLeaf(SqlExpr leaf, IndentContext ctx) {
        if (leaf instanceof BinaryExpr lb && !lb.parenthesized()) {
            String lop = normOp(lb.operator());
            if (lop.equals("AND") || lop.equals("OR")) {
                // mixed AND/OR: keep precedence explicit
                return "(" + render(leaf, ctx.deriveChild(ContextKind.FUNCTION_ARG)) + ")";
            }
        }
        return render(leaf, ctx);
    }

    static void flatten(SqlExpr expr, String op, List<SqlExpr> out) {
        if (expr instanceof BinaryExpr b && normOp(b.operator()).equals(op)) {
            flatten(b.left(), op, out);
            flatten(b.right(), op, out);
            return;
        }
        if (expr != null) out.add(expr);
    }

    private String between(SqlExpr leftExpr, SqlExpr range, boolean negated, IndentContext ctx) {
        String left = render(leftExpr, ctx);
        String op = kw(negated ? "NOT BETWEEN" : "BETWEEN");
        if (range instanceof ExprList l && l.items().size() == 2) {
            return left + " " + op + " " + render(l.items().get(0), ctx) + " " + kw("AND") + " " + render(l.items().get(1), ctx);
        }
        return left + " " + op + " " + render(range, ctx);
    }

    /**
     * IN / NOT IN / EXISTS / NOT EXISTS. {@code leftText} is empty for EXISTS.
     */
    private String subqueryPredicate(String leftText, String op, SqlExpr right, IndentContext ctx) {
        String prefix = leftText.isEmpty() ? kw(op) + " " : leftText + " " + kw(op) + " ";
        SelectStatement sub = subqueryOf(right);
        if (sub != null) return prefix + subqueryBlock(sub, ctx);

        if (right instanceof ExprList list && list.items().size() >= 2 && ctx.isConditionContext()) {
            return prefix + verticalList(list.items(), ctx);
        }
        return prefix + render(right, ctx);
    }

    /**
     * Parenthesized block for a subquery operand. Condition contexts use the compact form
     * (body at width+1, ")" at width-2); elsewhere the body and ")" sit at the subquery context's indent.
     */
    String subqueryBlock(SelectStatement sub, IndentContext ctx) {
        IndentContext subCtx = ctx.deriveSubquery(KeywordWidthAnalyzer.subqueryWidth(sub));
        String body = selects.render(sub, subCtx);
        int w = ctx.getBaseKeywordWidth();
        if (ctx.isConditionContext()) {
            return "(\n" + indentLines(body, spaces(Math.max(w + 1, 2))) + "\n" + spaces(Math.max(0, w - 2)) + ")";
        }
        String indent = subCtx.indentString();
        return "(\n" + indentLines(body, indent) + "\n" + indent + ")";
    }

    private String scalarSubquery(SelectStatement sub, IndentContext ctx) {
        IndentContext subCtx = ctx.deriveSubquery(KeywordWidthAnalyzer.subqueryWidth(sub));
        String body = selects.render(sub, subCtx);
        if (ctx.isConditionContext()) {
            String indent = spaces(ctx.getBaseKeywordWidth() + 1);
            return "(\n" + indentLines(body, indent) + "\n" + indent + ")";
        }
        return "(\n" + indentLines(body, subCtx.indentString()) + "\n" + subCtx.closingIndentString() + ")";
    }

    private String verticalList(List<SqlExpr> items, IndentContext ctx) {
        int w = ctx.getBaseKeywordWidth();
        IndentContext itemCtx = ctx.deriveChild(ContextKind.FUNCTION_ARG);
        StringBuilder sb = new StringBuilder("(\n");
        sb.append(spaces(w + 3)).append(render(items.get(0), itemCtx));
        for (int i = 1; i < items.size(); i++) {
            sb.append('\n').append(spaces(w + 1)).append(", ").append(render(items.get(i), itemCtx));
        }
        sb.append('\n').append(spaces(w + 1)).append(')');
        return sb.toString();
    }

    /** Subquery attached directly or as the single item of a list wrapper; null otherwise. */
    static SelectStatement subqueryOf(SqlExpr e) {
        if (e instanceof Subquery s) return s.query();
        if (e instanceof ExprList l && l.items().size() == 1 && l.items().get(0) instanceof Subquery s) return s.query();
        return null;
    }

    private String unary(UnaryExpr u, IndentContext ctx) {
        String op = normOp(u.operator());
        SqlExpr operand = u.operand();

        if (op.equals("NOT") && operand instanceof BinaryExpr b && !b.parenthesized()) {
            String inner = normOp(b.operator());
            if (inner.equals("BETWEEN")) return between(b.left(), b.right(), true, ctx);
            if (inner.equals("IN")) return subqueryPredicate(render(b.left(), ctx), "NOT IN", b.right(), ctx);
        }
        if (op.equals("NOT") && operand instanceof FunctionCall f && isExists(f)) {
            return subqueryPredicate("", "NOT EXISTS", f.args().get(0), ctx);
        }
        if (op.equals("NOT") && operand instanceof UnaryExpr inner && normOp(inner.operator()).equals("EXISTS")) {
            return subqueryPredicate("", "NOT EXISTS", inner.operand(), ctx);
        }
        if (op.equals("EXISTS") || op.equals("NOT EXISTS")) {
            return subqueryPredicate("", op, operand, ctx);
        }

        String text = render(operand, ctx);
        if (op.equals("NOT")) return kw("NOT") + " " + text;
        if (PREFIX_SIGNS.contains(op)) {
            // "--x" would read as a line comment
            return text.startsWith(op) || text.startsWith("-") ? op + " " + text : op + text;
        }
        if (op.startsWith("IS")) return text + " " + kw(op);
        return kw(op) + " " + text;
    }

    // ------------------------------------------------------------
    // calls
    // ------------------------------------------------------------

    private static boolean isExists(FunctionCall f) {
        return "EXISTS".equalsIgnoreCase(f.name()) && f.args().size() == 1 && subqueryOf(f.args().get(0)) != null;
    }

    private String function(FunctionCall f, IndentContext ctx) {
        String upper = f.name() == null ? "" : f.name().toUpperCase(Locale.ROOT);
        if (isExists(f)) {
            return subqueryPredicate("", "EXISTS", f.args().get(0), ctx);
        }
        if (QUANTIFIERS.contains(upper) && f.args().size() == 1) {
            SelectStatement sub = subqueryOf(f.args().get(0));
            if (sub != null) return kw(upper) + " " + subqueryBlock(sub, ctx);
        }
        return f.name() + "(" + joinArgs(f.args(), ctx.deriveChild(ContextKind.FUNCTION_ARG)) + ")";
    }

    private String aggregate(AggregateCall a, IndentContext ctx) {
        StringBuilder sb = new StringBuilder(a.name()).append('(');
        if (a.distinct()) sb.append(kw("DISTINCT")).append(' ');
        if (a.argument() != null) sb.append(render(a.argument(), ctx.deriveChild(ContextKind.FUNCTION_ARG)));
        return sb.append(')').toString();
    }

    private String window(WindowCall w, IndentContext ctx) {
        IndentContext argCtx = ctx.deriveChild(ContextKind.FUNCTION_ARG);
        StringBuilder sb = new StringBuilder(w.name()).append('(');
        if (w.distinct()) sb.append(kw("DISTINCT")).append(' ');
        sb.append(joinArgs(w.args(), argCtx)).append(") ").append(kw("OVER")).append(" (");

        WindowSpec spec = w.window();
        List<String> parts = new ArrayList<>(3);
        if (!spec.partitionBy().isEmpty()) {
            parts.add(kw("PARTITION BY") + " " + joinArgs(spec.partitionBy(), argCtx));
        }
        if (!spec.orderBy().isEmpty()) {
            parts.add(kw("ORDER BY") + " " + orderItems(spec.orderBy(), argCtx));
        }
        if (spec.frame() != null && !spec.frame().isBlank()) {
            parts.add(kw(spec.frame().trim()));
        }
        return sb.append(String.join(" ", parts)).append(')').toString();
    }

    private String cast(CastExpr c, IndentContext ctx) {
        String type = c.targetType() == null ? "" : c.targetType();
        if (c.style() == SqlExpr.CastStyle.OPERATOR) {
            return render(c.expr(), ctx) + "::" + type;
        }
        return kw("CAST") + "(" + render(c.expr(), ctx.deriveChild(ContextKind.FUNCTION_ARG)) + " " + kw("AS") + " " + type + ")";
    }

    private String interval(IntervalExpr i, IndentContext ctx) {
        String s = kw("INTERVAL") + " " + render(i.value(), ctx);
        if (i.unit() != null && !i.unit().isBlank()) s += " " + kw(i.unit().trim());
        return s;
    }

    private String extract(ExtractExpr e, IndentContext ctx) {
        return kw("EXTRACT") + "(" + kw(e.field() == null ? "" : e.field()) + " " + kw("FROM") + " "
                + render(e.source(), ctx.deriveChild(ContextKind.FUNCTION_ARG)) + ")";
    }

    // ------------------------------------------------------------
    // CASE
    // ------------------------------------------------------------

    /**
     * @param anchorColumn absolute column for WHEN/ELSE/END, or -1 for the default
     *                     (WHEN at the CASE_WHEN sibling's indent, END at this context's indent)
     */
    private String caseExpr(CaseExpr c, IndentContext ctx, int anchorColumn) {
        IndentContext caseCtx = ctx.deriveSibling(ContextKind.CASE_WHEN);
        int whenCol = anchorColumn >= 0 ? anchorColumn : caseCtx.indentWidth();
        int endCol = anchorColumn >= 0 ? anchorColumn : ctx.indentWidth();

        StringBuilder sb = new StringBuilder(kw("CASE"));
        if (c.operand() != null) sb.append(' ').append(render(c.operand(), caseCtx));
        for (WhenClause w : c.whens()) {
            sb.append('\n').append(spaces(whenCol))
                    .append(kw("WHEN")).append(' ').append(render(w.condition(), caseCtx))
                    .append(' ').append(kw("THEN")).append(' ').append(render(w.result(), caseCtx));
        }
        if (c.elseResult() != null) {
            sb.append('\n').append(spaces(whenCol)).append(kw("ELSE")).append(' ').append(render(c.elseResult(), caseCtx));
        }
        sb.append('\n').append(spaces(endCol)).append(kw("END"));
        return sb.toString();
    }

    // ------------------------------------------------------------
    // helpers
    // ------------------------------------------------------------

    String orderItems(List<OrderItem> items, IndentContext ctx) {
        List<String> out = new ArrayList<>(items.size());
        for (OrderItem o : items) {
            String s = render(o.expr(), ctx);
            if (o.direction() != null) s += " " + kw(o.direction().name());
            out.add(s);
        }
        return String.join(", ", out);
    }

    String joinArgs(List<SqlExpr> args, IndentContext ctx) {
        List<String> out = new ArrayList<>(args.size());
        for (SqlExpr a : args) out.add(render(a, ctx));
        return String.join(", ", out);
    }

    private String kw(String k) {
        return session.keyword(k);
    }

    /** Word operators are keyword-cased; symbols are emitted as-is. */
    private String opText(String op) {
        for (int i = 0; i < op.length(); i++) {
            if (Character.isLetter(op.charAt(i))) return kw(op);
        }
        return op;
    }

    static String normOp(String op) {
        if (op == null) return "";
        return op.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    }
}
