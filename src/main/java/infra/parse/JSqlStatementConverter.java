package infra.parse;

import domain.ast.OrderItem;
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
import net.sf.jsqlparser.expression.Alias;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.select.GroupByElement;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.Offset;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SetOperation;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.Values;
import net.sf.jsqlparser.statement.select.WithItem;
import net.sf.jsqlparser.statement.update.Update;
import net.sf.jsqlparser.statement.update.UpdateSet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Maps a parsed JSqlParser {@link Statement} onto the formatter AST.
 */
final class JSqlStatementConverter {

    private final JSqlExpressionConverter expressions = new JSqlExpressionConverter(this);

    SqlStatement convert(Statement stmt) {
        if (stmt instanceof Select s) return select(s);
        if (stmt instanceof Insert i) return insert(i);
        if (stmt instanceof Update u) return update(u);
        if (stmt instanceof Delete d) return delete(d);
        return new UnsupportedStatement(stmt == null ? "EMPTY" : stmt.getClass().getSimpleName());
    }

    SelectStatement select(Select select) {
        if (select == null) return SelectStatement.of(List.of(), List.of(), null);

        SelectStatement out;
        if (select instanceof ParenthesedSelect p) {
            out = select(p.getSelect());
        } else if (select instanceof SetOperationList set) {
            out = setOperations(set);
        } else if (select instanceof PlainSelect plain) {
            out = plain(plain);
        } else {
            out = SelectStatement.of(List.of(new SelectColumn(
                    new SqlExpr.Unsupported(select.getClass().getSimpleName(), select.toString()), null)), List.of(), null);
        }

        List<WithItem<?>> withItems = select.getWithItemsList();
        if (withItems != null && !withItems.isEmpty()) {
            out = out.withWith(with(withItems));
        }
        return out;
    }

    private WithClause with(List<WithItem<?>> items) {
        List<CommonTableExpr> ctes = new ArrayList<>();
        for (WithItem<?> item : items) {
            if (item == null) continue;
            String name = item.getAliasName();
            if (name == null || name.isBlank()) name = "unnamed_cte";
            Select body = item.getSelect();
            if (body == null) return WithClause.malformed();
            ctes.add(new CommonTableExpr(name, select(body)));
        }
        return new WithClause(ctes, true);
    }

    private SelectStatement setOperations(SetOperationList set) {
        List<Select> selects = set.getSelects();
        List<SetOperation> ops = set.getOperations();
        if (selects == null || selects.isEmpty()) {
            return SelectStatement.of(List.of(), List.of(), null);
        }

        SelectStatement head = select(selects.get(0));
        for (int i = 1; i < selects.size(); i++) {
            String op = ops != null && ops.size() >= i ? ops.get(i - 1).toString().trim() : "UNION";
            head = head.appendSetOperation(op.toUpperCase(Locale.ROOT), select(selects.get(i)));
        }

        List<OrderItem> order = expressions.orderItems(set.getOrderByElements());
        LimitClause limit = limit(set.getLimit(), set.getOffset());
        if (order.isEmpty() && limit == null) return head;
        return attachToTail(head, order, limit);
    }

    /** ORDER BY / LIMIT after the last operand belong to the last SELECT of the chain. */
    private static SelectStatement attachToTail(SelectStatement s, List<OrderItem> order, LimitClause limit) {
        if (s.setOperation() == null) {
            return s.withOrderByAndLimit(order, limit);
        }
        SelectStatement next = attachToTail(s.setOperation().next(), order, limit);
        return s.withSetOperation(new SqlStatement.SetOperation(s.setOperation().operator(), next));
    }

    private SelectStatement plain(PlainSelect ps) {
        List<SelectColumn> columns = new ArrayList<>();
        if (ps.getSelectItems() != null) {
            for (SelectItem<?> item : ps.getSelectItems()) {
                columns.add(new SelectColumn(expressions.expr(item.getExpression()), aliasName(item.getAlias())));
            }
        }

        List<FromItem> from = new ArrayList<>();
        if (ps.getFromItem() != null) {
            from.add(fromItem(ps.getFromItem(), null, null, List.of()));
        }
        if (ps.getJoins() != null) {
            for (Join j : ps.getJoins()) {
                from.add(join(j));
            }
        }

        List<SqlExpr> groupBy = new ArrayList<>();
        GroupByElement gb = ps.getGroupBy();
        if (gb != null) {
            groupBy.addAll(expressions.list(gb.getGroupByExpressionList()));
        }

        return new SelectStatement(
                null,
                ps.getDistinct() != null,
                columns,
                from,
                expressions.expr(ps.getWhere()),
                groupBy,
                expressions.expr(ps.getHaving()),
                expressions.orderItems(ps.getOrderByElements()),
                limit(ps.getLimit(), ps.getOffset()),
                null);
    }

    private FromItem join(Join j) {
        List<String> using = new ArrayList<>();
        if (j.getUsingColumns() != null) {
            for (Column c : j.getUsingColumns()) using.add(c.getColumnName());
        }
        String keyword = j.isSimple() ? null : joinKeyword(j);
        return fromItem(j.getRightItem(), keyword, onCondition(j.getOnExpressions()), using);
    }

    private SqlExpr onCondition(Collection<Expression> ons) {
        if (ons == null || ons.isEmpty()) return null;
        SqlExpr out = null;
        for (Expression e : ons) {
            SqlExpr next = expressions.expr(e);
            out = out == null ? next : new SqlExpr.BinaryExpr("AND", out, next);
        }
        return out;
    }

    static String joinKeyword(Join j) {
        if (j.isCross()) return "CROSS JOIN";
        StringBuilder sb = new StringBuilder();
        if (j.isNatural()) sb.append("NATURAL ");
        if (j.isFull()) {
            sb.append("FULL ");
        } else if (j.isLeft()) {
            sb.append("LEFT ");
        } else if (j.isRight()) {
            sb.append("RIGHT ");
        }
        if (j.isOuter()) sb.append("OUTER ");
        // plain JOIN is written as INNER JOIN
        if (sb.length() == 0) sb.append("INNER ");
        return sb.append("JOIN").toString();
    }

    private FromItem fromItem(net.sf.jsqlparser.statement.select.FromItem item, String join, SqlExpr on,
                              List<String> using) {
        String alias = aliasName(item.getAlias());
        if (item instanceof Table t) {
            return new FromItem(new TableSource(t.getFullyQualifiedName()), alias, join, on, using);
        }
        if (item instanceof Select s) {
            return new FromItem(new DerivedTable(select(s)), alias, join, on, using);
        }
        String text = item.toString();
        if (alias != null && item.getAlias() != null) {
            // toString() carries the alias; keep the bare reference
            String suffix = item.getAlias().toString();
            if (text.endsWith(suffix)) text = text.substring(0, text.length() - suffix.length());
        }
        return new FromItem(new UnresolvedSource(text.trim()), alias, join, on, using);
    }

    private LimitClause limit(Limit limit, Offset offset) {
        SqlExpr count = null;
        SqlExpr off = null;
        if (limit != null) {
            count = expressions.expr(limit.getRowCount());
            off = expressions.expr(limit.getOffset());
        }
        if (offset != null && offset.getOffset() != null) {
            off = expressions.expr(offset.getOffset());
        }
        if (count == null && off == null) return null;
        return new LimitClause(count, off);
    }

    private SqlStatement insert(Insert insert) {
        String table = insert.getTable() == null ? "" : insert.getTable().getFullyQualifiedName();
        List<String> columns = new ArrayList<>();
        if (insert.getColumns() != null) {
            for (Column c : insert.getColumns()) columns.add(c.getColumnName());
        }

        Select source = insert.getSelect();
        if (source instanceof Values values) {
            return new InsertStatement(table, columns, rows(values.getExpressions()), null);
        }
        if (source instanceof ParenthesedSelect p && p.getSelect() instanceof Values values) {
            return new InsertStatement(table, columns, rows(values.getExpressions()), null);
        }
        if (source != null) {
            return new InsertStatement(table, columns, List.of(), select(source));
        }
        return new InsertStatement(table, columns, List.of(), null);
    }

    private List<List<SqlExpr>> rows(ExpressionList<?> values) {
        List<List<SqlExpr>> rows = new ArrayList<>();
        if (values == null) return rows;
        boolean allRows = !values.isEmpty();
        for (Object o : values) {
            if (!(o instanceof ExpressionList<?>)) {
                allRows = false;
                break;
            }
        }
        if (!allRows) {
            rows.add(expressions.list(values));
            return rows;
        }
        for (Object o : values) {
            rows.add(expressions.list((ExpressionList<?>) o));
        }
        return rows;
    }

    private SqlStatement update(Update update) {
        Table t = update.getTable();
        String table = t == null ? "" : t.getFullyQualifiedName();
        String alias = t == null ? null : aliasName(t.getAlias());

        List<Assignment> assignments = new ArrayList<>();
        if (update.getUpdateSets() != null) {
            for (UpdateSet set : update.getUpdateSets()) {
                List<Column> cols = new ArrayList<>();
                if (set.getColumns() != null) {
                    for (Column c : set.getColumns()) cols.add(c);
                }
                List<SqlExpr> values = expressions.list(set.getValues());
                for (int i = 0; i < cols.size(); i++) {
                    SqlExpr v = i < values.size() ? values.get(i) : new SqlExpr.NullLiteral();
                    assignments.add(new Assignment(cols.get(i).getFullyQualifiedName(), v));
                }
            }
        }
        return new UpdateStatement(table, alias, assignments, expressions.expr(update.getWhere()));
    }

    private SqlStatement delete(Delete delete) {
        String table = delete.getTable() == null ? "" : delete.getTable().getFullyQualifiedName();
        return new DeleteStatement(table, expressions.expr(delete.getWhere()));
    }

    private static String aliasName(Alias alias) {
        if (alias == null || alias.getName() == null || alias.getName().isBlank()) return null;
        return alias.getName();
    }
}
