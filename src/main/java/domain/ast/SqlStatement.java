package domain.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Statement node of the formatter AST.
 *
 * <p>Clause payloads are plain records; absent clauses are null (single values) or empty
 * (lists), never both.</p>
 */
public interface SqlStatement {

    record SelectStatement(
            WithClause with,
            boolean distinct,
            List<SelectColumn> columns,
            List<FromItem> from,
            SqlExpr where,
            List<SqlExpr> groupBy,
            SqlExpr having,
            List<OrderItem> orderBy,
            LimitClause limit,
            SetOperation setOperation
    ) implements SqlStatement {

        public SelectStatement {
            columns = copy(columns);
            from = copy(from);
            groupBy = copy(groupBy);
            orderBy = copy(orderBy);
        }

        public static SelectStatement of(List<SelectColumn> columns, List<FromItem> from, SqlExpr where) {
            return new SelectStatement(null, false, columns, from, where, List.of(), null, List.of(), null, null);
        }

        public SelectStatement withWith(WithClause w) {
            return new SelectStatement(w, distinct, columns, from, where, groupBy, having, orderBy, limit, setOperation);
        }

        public SelectStatement withSetOperation(SetOperation op) {
            return new SelectStatement(with, distinct, columns, from, where, groupBy, having, orderBy, limit, op);
        }

        public SelectStatement withOrderByAndLimit(List<OrderItem> order, LimitClause lim) {
            return new SelectStatement(with, distinct, columns, from, where, groupBy, having, order, lim, setOperation);
        }

        /** Appends {@code op next} after the last statement of this set-operation chain. */
        public SelectStatement appendSetOperation(String op, SelectStatement next) {
            if (setOperation == null) {
                return withSetOperation(new SetOperation(op, next));
            }
            return withSetOperation(new SetOperation(
                    setOperation.operator(), setOperation.next().appendSetOperation(op, next)));
        }

        /** Last statement of the set-operation chain (this when there is none). */
        public SelectStatement chainTail() {
            return setOperation == null ? this : setOperation.next().chainTail();
        }
    }

    record InsertStatement(String table, List<String> columns, List<List<SqlExpr>> rows, SelectStatement query)
            implements SqlStatement {
        public InsertStatement {
            columns = copy(columns);
            List<List<SqlExpr>> r = new ArrayList<>();
            if (rows != null) {
                for (List<SqlExpr> row : rows) {
                    if (row != null) r.add(copy(row));
                }
            }
            rows = Collections.unmodifiableList(r);
        }
    }

    record UpdateStatement(String table, String alias, List<Assignment> assignments, SqlExpr where)
            implements SqlStatement {
        public UpdateStatement {
            assignments = copy(assignments);
        }
    }

    record DeleteStatement(String table, SqlExpr where) implements SqlStatement {
    }

    /** Statement kind with no renderer (DDL, MERGE, ...). */
    record UnsupportedStatement(String kind) implements SqlStatement {
    }

    /**
     * @param wellFormed false when the source carried a WITH payload of the wrong shape
     */
    record WithClause(List<CommonTableExpr> ctes, boolean wellFormed) {
        public WithClause {
            ctes = copy(ctes);
        }

        public static WithClause malformed() {
            return new WithClause(List.of(), false);
        }
    }

    record CommonTableExpr(String name, SelectStatement body) {
    }

    record SelectColumn(SqlExpr expr, String alias) {
    }

    /**
     * One FROM entry. {@code join} is the join keyword text ("LEFT JOIN"); null for the first
     * table and for comma-separated tables.
     */
    record FromItem(FromSource source, String alias, String join, SqlExpr on, List<String> using) {
        public FromItem {
            using = copy(using);
        }

        public static FromItem table(String name, String alias) {
            return new FromItem(new TableSource(name), alias, null, null, List.of());
        }

        public FromItem joined(String joinKeyword, SqlExpr condition) {
            return new FromItem(source, alias, joinKeyword, condition, using);
        }
    }

    interface FromSource {
    }

    record TableSource(String name) implements FromSource {
    }

    record DerivedTable(SelectStatement query) implements FromSource {
    }

    /** Table reference of a shape ingestion could not classify; name is best effort. */
    record UnresolvedSource(String name) implements FromSource {
    }

    /** count and/or offset; at least one is non-null. */
    record LimitClause(SqlExpr count, SqlExpr offset) {
    }

    record SetOperation(String operator, SelectStatement next) {
    }

    record Assignment(String column, SqlExpr value) {
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
