package domain.format;

import domain.ast.SqlExpr;
import domain.ast.SqlStatement;
import domain.ast.SqlStatement.Assignment;
import domain.ast.SqlStatement.DeleteStatement;
import domain.ast.SqlStatement.InsertStatement;
import domain.ast.SqlStatement.SelectStatement;
import domain.ast.SqlStatement.UnsupportedStatement;
import domain.ast.SqlStatement.UpdateStatement;
import domain.model.FormatWarningSink;

import java.util.ArrayList;
import java.util.List;

import static domain.format.TextLayout.spaces;

/**
 * Entry point of the rendering engine: one statement AST in, one text block out (no terminator).
 *
 * <p>Stateless and thread-safe; every call builds its own session and contexts.</p>
 */
public final class StatementRenderer {

    private final FormatterOptions options;

    public StatementRenderer(FormatterOptions options) {
        this.options = options == null ? FormatterOptions.defaults() : options;
    }

    public String render(SqlStatement statement) {
        return render(statement, SelectLayout.of(statement), FormatWarningSink.none());
    }

    /**
     * @throws UnsupportedStatementException for statement kinds without a renderer
     */
    public String render(SqlStatement statement, SelectLayout layout, FormatWarningSink warnings) {
        if (statement == null) throw new IllegalArgumentException("statement is null");

        RenderSession session = new RenderSession(options, layout, warnings);
        ExpressionRenderer expressions = new ExpressionRenderer(session);
        IndentContext root = IndentContext.root(KeywordWidthAnalyzer.globalWidth(statement));

        if (statement instanceof SelectStatement s) return expressions.selects().render(s, root);
        if (statement instanceof InsertStatement i) return insert(i, root, session, expressions);
        if (statement instanceof UpdateStatement u) return update(u, root, session, expressions);
        if (statement instanceof DeleteStatement d) return delete(d, root, session, expressions);
        if (statement instanceof UnsupportedStatement u) throw new UnsupportedStatementException(u.kind());
        throw new UnsupportedStatementException(statement.getClass().getSimpleName());
    }

    private static String insert(InsertStatement stmt, IndentContext root, RenderSession session, ExpressionRenderer expressions) {
        int w = root.getBaseKeywordWidth();
        List<String> lines = new ArrayList<>();
        String head = session.gutter("INSERT INTO", w) + " " + stmt.table();
        if (!stmt.columns().isEmpty()) head += " (" + String.join(", ", stmt.columns()) + ")";
        lines.add(head);

        if (!stmt.rows().isEmpty()) {
            IndentContext valueCtx = root.deriveChild(ContextKind.FUNCTION_ARG);
            for (int i = 0; i < stmt.rows().size(); i++) {
                String row = "(" + expressions.joinArgs(stmt.rows().get(i), valueCtx) + ")";
                lines.add(i == 0 ? session.gutter("VALUES", w) + " " + row : spaces(w - 1) + ", " + row);
            }
        } else if (stmt.query() != null) {
            lines.add(expressions.selects().render(stmt.query(), root));
        }
        return String.join("\n", lines);
    }

    private static String update(UpdateStatement stmt, IndentContext root, RenderSession session, ExpressionRenderer expressions) {
        int w = root.getBaseKeywordWidth();
        List<String> lines = new ArrayList<>();
        String head = session.gutter("UPDATE", w) + " " + stmt.table();
        if (stmt.alias() != null && !stmt.alias().isBlank()) head += " " + session.keyword("AS") + " " + stmt.alias();
        lines.add(head);

        IndentContext valueCtx = root.deriveChild(ContextKind.FUNCTION_ARG);
        for (int i = 0; i < stmt.assignments().size(); i++) {
            Assignment a = stmt.assignments().get(i);
            String set = a.column() + " = " + expressions.render(a.value(), valueCtx);
            lines.add(i == 0 ? session.gutter("SET", w) + " " + set : spaces(w - 1) + ", " + set);
        }
        addWhere(stmt.where(), lines, root, session, expressions);
        return String.join("\n", lines);
    }

    private static String delete(DeleteStatement stmt, IndentContext root, RenderSession session, ExpressionRenderer expressions) {
        List<String> lines = new ArrayList<>();
        lines.add(session.gutter("DELETE FROM", root.getBaseKeywordWidth()) + " " + stmt.table());
        addWhere(stmt.where(), lines, root, session, expressions);
        return String.join("\n", lines);
    }

    private static void addWhere(SqlExpr where, List<String> lines, IndentContext root, RenderSession session, ExpressionRenderer expressions) {
        if (where == null) return;
        lines.add(session.gutter("WHERE", root.getBaseKeywordWidth()) + " "
                + expressions.render(where, root.deriveSibling(ContextKind.WHERE_CLAUSE)));
    }
}
