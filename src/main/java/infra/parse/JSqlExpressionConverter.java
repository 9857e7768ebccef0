package infra.parse;

import domain.ast.OrderItem;
import domain.ast.SqlExpr;
import domain.ast.SqlExpr.AggregateCall;
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
import net.sf.jsqlparser.expression.AnalyticExpression;
import net.sf.jsqlparser.expression.AnalyticType;
import net.sf.jsqlparser.expression.AnyComparisonExpression;
import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.CaseExpression;
import net.sf.jsqlparser.expression.CastExpression;
import net.sf.jsqlparser.expression.DateTimeLiteralExpression;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExtractExpression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.IntervalExpression;
import net.sf.jsqlparser.expression.JdbcNamedParameter;
import net.sf.jsqlparser.expression.JdbcParameter;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.NotExpression;
import net.sf.jsqlparser.expression.NullValue;
import net.sf.jsqlparser.expression.SignedExpression;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.TimeKeyExpression;
import net.sf.jsqlparser.expression.operators.relational.Between;
import net.sf.jsqlparser.expression.operators.relational.ExistsExpression;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.expression.operators.relational.LikeExpression;
import net.sf.jsqlparser.expression.operators.relational.ParenthesedExpressionList;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.AllTableColumns;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.Select;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * JSqlParser expression tree to {@link SqlExpr}.
 *
 * <p>Anything without a dedicated mapping becomes {@link Unsupported} carrying JSqlParser's own
 * rendering, so the renderer can still emit valid text for it.</p>
 */
final class JSqlExpressionConverter {

    private static final Set<String> AGGREGATES = Set.of("COUNT", "SUM", "AVG", "MIN", "MAX");

    private final JSqlStatementConverter statements;

    JSqlExpressionConverter(JSqlStatementConverter statements) {
        this.statements = statements;
    }

    SqlExpr expr(Expression e) {
        if (e == null) return null;

        if (e instanceof Column c) return column(c);
        if (e instanceof LongValue || e instanceof DoubleValue) return new NumberLiteral(e.toString());
        if (e instanceof StringValue s) return string(s);
        if (e instanceof NullValue) return new NullLiteral();
        if (e instanceof DateTimeLiteralExpression d) return temporal(d);
        if (e instanceof TimeKeyExpression t) return new RawValue(t.getStringValue());
        if (e instanceof AllTableColumns atc) return new ColumnRef(atc.getTable().getFullyQualifiedName(), "*");
        if (e instanceof AllColumns) return new Star();
        if (e instanceof JdbcParameter || e instanceof JdbcNamedParameter) return new Param(e.toString());
        if (e instanceof SignedExpression s) return new UnaryExpr(String.valueOf(s.getSign()), expr(s.getExpression()));
        if (e instanceof NotExpression n) return new UnaryExpr("NOT", expr(n.getExpression()));
        if (e instanceof IsNullExpression n) {
            return new UnaryExpr(n.isNot() ? "IS NOT NULL" : "IS NULL", expr(n.getLeftExpression()));
        }
        if (e instanceof InExpression in) {
            return new BinaryExpr(in.isNot() ? "NOT IN" : "IN", expr(in.getLeftExpression()), inRight(in.getRightExpression()));
        }
        if (e instanceof Between b) {
            ExprList range = new ExprList(List.of(expr(b.getBetweenExpressionStart()), expr(b.getBetweenExpressionEnd())));
            return new BinaryExpr(b.isNot() ? "NOT BETWEEN" : "BETWEEN", expr(b.getLeftExpression()), range);
        }
        if (e instanceof ExistsExpression ex) {
            FunctionCall exists = new FunctionCall("EXISTS", List.of(expr(ex.getRightExpression())));
            return ex.isNot() ? new UnaryExpr("NOT", exists) : exists;
        }
        if (e instanceof AnyComparisonExpression any) {
            return new FunctionCall(any.getAnyType().name(), List.of(new Subquery(statements.select(any.getSelect()))));
        }
        if (e instanceof LikeExpression like) return like(like);
        if (e instanceof BinaryExpression b) {
            return new BinaryExpr(b.getStringExpression(), expr(b.getLeftExpression()), expr(b.getRightExpression()));
        }
        if (e instanceof AnalyticExpression a) return analytic(a);
        if (e instanceof Function f) return function(f);
        if (e instanceof CaseExpression c) return caseExpr(c);
        if (e instanceof CastExpression c) return cast(c);
        if (e instanceof IntervalExpression i) return interval(i);
        if (e instanceof ExtractExpression x) return new ExtractExpr(x.getName(), expr(x.getExpression()));
        if (e instanceof Select s) return new Subquery(statements.select(s));
        if (e instanceof ExpressionList<?> list) return exprList(list);

        return new Unsupported(e.getClass().getSimpleName(), e.toString());
    }

    List<OrderItem> orderItems(List<OrderByElement> elements) {
        List<OrderItem> out = new ArrayList<>();
        if (elements == null) return out;
        for (OrderByElement o : elements) {
            OrderItem.Direction dir = null;
            if (o.isAscDescPresent()) dir = o.isAsc() ? OrderItem.Direction.ASC : OrderItem.Direction.DESC;
            out.add(new OrderItem(expr(o.getExpression()), dir));
        }
        return out;
    }

    List<SqlExpr> list(ExpressionList<?> list) {
        List<SqlExpr> out = new ArrayList<>();
        if (list == null) return out;
        for (Object o : list) {
            if (o instanceof Expression e) out.add(expr(e));
        }
        return out;
    }

    private SqlExpr column(Column c) {
        Table t = c.getTable();
        String table = t == null ? null : blankToNull(t.getFullyQualifiedName());
        String name = c.getColumnName();
        if (table == null && name != null) {
            if (name.equalsIgnoreCase("TRUE")) return new BooleanLiteral(true);
            if (name.equalsIgnoreCase("FALSE")) return new BooleanLiteral(false);
        }
        return new ColumnRef(table, name);
    }

    private static SqlExpr string(StringValue s) {
        String prefix = s.getPrefix();
        if (prefix == null || prefix.isEmpty()) return new StringLiteral(QuoteStyle.SINGLE, s.getValue());
        switch (prefix.toUpperCase(Locale.ROOT)) {
            case "N":
                return new StringLiteral(QuoteStyle.NATIONAL, s.getValue());
            case "X":
                return new StringLiteral(QuoteStyle.HEX, s.getValue());
            case "B":
                return new StringLiteral(QuoteStyle.BIT, s.getValue());
            default:
                return new RawValue(s.toString());
        }
    }

    private static SqlExpr temporal(DateTimeLiteralExpression d) {
        String kind = d.getType() == null ? "" : d.getType().name();
        String value = d.getValue() == null ? "" : d.getValue();
        if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
            value = value.substring(1, value.length() - 1);
        }
        for (TemporalKind k : TemporalKind.values()) {
            if (k.name().equals(kind)) return new TemporalLiteral(k, value);
        }
        return new RawValue(d.toString());
    }

    private SqlExpr like(LikeExpression like) {
        String text = like.toString();
        if (text.toUpperCase(Locale.ROOT).contains(" ESCAPE ")) {
            return new Unsupported("LikeExpression", text);
        }
        String op = like.getStringExpression();
        if (like.isNot() && !op.trim().toUpperCase(Locale.ROOT).startsWith("NOT")) op = "NOT " + op;
        return new BinaryExpr(op, expr(like.getLeftExpression()), expr(like.getRightExpression()));
    }

    private SqlExpr inRight(Expression r) {
        if (r instanceof Select s) return new Subquery(statements.select(s));
        if (r instanceof ExpressionList<?> list) return new ExprList(list(list));
        return expr(r);
    }

    private SqlExpr exprList(ExpressionList<?> list) {
        List<SqlExpr> items = list(list);
        // "(a OR b)" arrives as a one-element parenthesized list
        if (list instanceof ParenthesedExpressionList<?> && items.size() == 1 && items.get(0) instanceof BinaryExpr b) {
            return new BinaryExpr(b.operator(), b.left(), b.right(), true);
        }
        return new ExprList(items);
    }

    private SqlExpr function(Function f) {
        String name = f.getName();
        List<SqlExpr> args = list(f.getParameters());
        boolean star = f.isAllColumns() || (args.size() == 1 && args.get(0) instanceof Star);
        boolean aggregate = name != null && AGGREGATES.contains(name.toUpperCase(Locale.ROOT));

        if ((aggregate || f.isDistinct()) && args.size() <= 1) {
            SqlExpr arg = star ? new Star() : (args.isEmpty() ? null : args.get(0));
            return new AggregateCall(name, f.isDistinct(), arg);
        }
        if (f.isDistinct()) {
            // DISTINCT over several arguments has no node of its own
            return new Unsupported("Function", f.toString());
        }
        if (star && args.isEmpty()) args = List.of(new Star());
        return new FunctionCall(name, args);
    }

    private SqlExpr analytic(AnalyticExpression a) {
        if (a.getType() != null && a.getType() != AnalyticType.OVER) {
            return new Unsupported("AnalyticExpression", a.toString());
        }
        List<SqlExpr> args = new ArrayList<>();
        if (a.isAllColumns()) args.add(new Star());
        if (a.getExpression() != null) args.add(expr(a.getExpression()));
        if (a.getOffset() != null) args.add(expr(a.getOffset()));
        if (a.getDefaultValue() != null) args.add(expr(a.getDefaultValue()));

        List<SqlExpr> partition = list(a.getPartitionExpressionList());
        String frame = a.getWindowElement() == null ? null : a.getWindowElement().toString();
        return new WindowCall(a.getName(), args, a.isDistinct(),
                new WindowSpec(partition, orderItems(a.getOrderByElements()), frame));
    }

    private SqlExpr caseExpr(CaseExpression c) {
        List<WhenClause> whens = new ArrayList<>();
        if (c.getWhenClauses() != null) {
            for (net.sf.jsqlparser.expression.WhenClause w : c.getWhenClauses()) {
                whens.add(new WhenClause(expr(w.getWhenExpression()), expr(w.getThenExpression())));
            }
        }
        return new CaseExpr(expr(c.getSwitchExpression()), whens, expr(c.getElseExpression()));
    }

    private SqlExpr cast(CastExpression c) {
        String text = c.toString().trim().toUpperCase(Locale.ROOT);
        if (text.startsWith("TRY_CAST") || text.startsWith("SAFE_CAST")) {
            return new Unsupported("CastExpression", c.toString());
        }
        String type = c.getColDataType() == null ? "" : c.getColDataType().toString();
        return new CastExpr(expr(c.getLeftExpression()), type, c.isUseCastKeyword() ? CastStyle.CALL : CastStyle.OPERATOR);
    }

    private SqlExpr interval(IntervalExpression i) {
        SqlExpr value;
        if (i.getExpression() != null) {
            value = expr(i.getExpression());
        } else if (i.getParameter() != null) {
            value = new RawValue(i.getParameter());
        } else {
            return new Unsupported("IntervalExpression", i.toString());
        }
        return new IntervalExpr(value, i.getIntervalType());
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
