package domain.format;

import domain.ast.SqlExpr;
import domain.ast.SqlStatement;
import domain.ast.SqlStatement.CommonTableExpr;
import domain.ast.SqlStatement.DeleteStatement;
import domain.ast.SqlStatement.FromItem;
import domain.ast.SqlStatement.InsertStatement;
import domain.ast.SqlStatement.SelectStatement;
import domain.ast.SqlStatement.UpdateStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * First pass of rendering: the set of keywords a statement will emit, and from it the gutter width.
 *
 * <p>The keyword list may hold duplicates (one AND per conjunct); only the longest entry matters.</p>
 */
public final class KeywordWidthAnalyzer {

    /** Width used when no keyword is collected. */
    public static final int FALLBACK_WIDTH = 6;

    private KeywordWidthAnalyzer() {}

    /**
     * Keywords emitted at the gutter for the statement, including every CTE body of a WITH block
     * and every set-operation continuation.
     */
    public static List<String> collectKeywords(SqlStatement statement) {
        List<String> out = new ArrayList<>();
        if (statement instanceof SelectStatement s) {
            collectWithBlock(s, out);
        } else if (statement instanceof InsertStatement i) {
            out.add("INSERT INTO");
            if (!i.rows().isEmpty()) out.add("VALUES");
            if (i.query() != null) collectWithBlock(i.query(), out);
        } else if (statement instanceof UpdateStatement u) {
            out.add("UPDATE");
            if (!u.assignments().isEmpty()) out.add("SET");
            if (u.where() != null) out.add("WHERE");
        } else if (statement instanceof DeleteStatement d) {
            out.add("DELETE FROM");
            if (d.where() != null) out.add("WHERE");
        }
        return out;
    }

    /** Width for a statement rendered at the root: the shared width of its whole WITH block. */
    public static int globalWidth(SqlStatement statement) {
        return widthOf(collectKeywords(statement));
    }

    /** Width recomputed for an embedded SELECT (subquery, derived table). */
    public static int subqueryWidth(SelectStatement query) {
        return widthOf(collectKeywords(query));
    }

    static int widthOf(List<String> keywords) {
        int max = 0;
        for (String k : keywords) {
            if (k != null) max = Math.max(max, k.length());
        }
        return max == 0 ? FALLBACK_WIDTH : max;
    }

    private static void collectWithBlock(SelectStatement s, List<String> out) {
        if (s.with() != null && s.with().wellFormed() && !s.with().ctes().isEmpty()) {
            out.add("WITH");
            for (CommonTableExpr cte : s.with().ctes()) {
                if (cte.body() != null) collectWithBlock(cte.body(), out);
            }
        }
        SelectStatement cur = s;
        while (cur != null) {
            collectSelect(cur, out);
            cur = cur.setOperation() == null ? null : cur.setOperation().next();
        }
    }

    private static void collectSelect(SelectStatement s, List<String> out) {
        out.add("SELECT");
        if (!s.from().isEmpty()) out.add("FROM");
        if (s.where() != null) out.add("WHERE");
        if (!s.groupBy().isEmpty()) out.add("GROUP BY");
        if (s.having() != null) out.add("HAVING");
        if (!s.orderBy().isEmpty()) out.add("ORDER BY");
        if (s.limit() != null) {
            if (s.limit().count() != null) {
                out.add("LIMIT");
                if (s.limit().offset() != null) out.add("OFFSET");
            } else if (s.limit().offset() != null) {
                out.add("OFFSET");
            }
        }
        for (int i = 1; i < s.from().size(); i++) {
            FromItem item = s.from().get(i);
            if (item.join() == null) continue;
            out.add(item.join().toUpperCase(Locale.ROOT));
            if (item.on() != null) {
                out.add("ON");
                int ands = countAndKeywords(item.on());
                for (int a = 0; a < ands; a++) out.add("AND");
            }
        }
    }

    /** Number of AND nodes reachable through AND nodes only (OR branches are not entered). */
    static int countAndKeywords(SqlExpr expr) {
        if (expr instanceof SqlExpr.BinaryExpr b && "AND".equalsIgnoreCase(b.operator().trim())) {
            return 1 + countAndKeywords(b.left()) + countAndKeywords(b.right());
        }
        return 0;
    }
}
