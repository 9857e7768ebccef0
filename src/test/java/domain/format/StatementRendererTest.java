package domain.format;

import domain.ast.OrderItem;
import domain.ast.SqlExpr;
import domain.ast.SqlExpr.AggregateCall;
import domain.ast.SqlExpr.BinaryExpr;
import domain.ast.SqlExpr.CaseExpr;
import domain.ast.SqlExpr.CastExpr;
import domain.ast.SqlExpr.CastStyle;
import domain.ast.SqlExpr.ColumnRef;
import domain.ast.SqlExpr.ExprList;
import domain.ast.SqlExpr.FunctionCall;
import domain.ast.SqlExpr.NumberLiteral;
import domain.ast.SqlExpr.StringLiteral;
import domain.ast.SqlExpr.Subquery;
import domain.ast.SqlExpr.UnaryExpr;
import domain.ast.SqlExpr.Unsupported;
import domain.ast.SqlExpr.WhenClause;
import domain.ast.SqlExpr.WindowCall;
import domain.ast.SqlExpr.WindowSpec;
import domain.ast.SqlStatement.Assignment;
import domain.ast.SqlStatement.CommonTableExpr;
import domain.ast.SqlStatement.DeleteStatement;
import domain.ast.SqlStatement.DerivedTable;
import domain.ast.SqlStatement.FromItem;
import domain.ast.SqlStatement.InsertStatement;
import domain.ast.SqlStatement.LimitClause;
import domain.ast.SqlStatement.SelectColumn;
import domain.ast.SqlStatement.SelectStatement;
import domain.ast.SqlStatement.UnsupportedStatement;
import domain.ast.SqlStatement.UpdateStatement;
import domain.ast.SqlStatement.WithClause;
import domain.model.FormatWarning;
import domain.model.ListFormatWarningSink;
import domain.model.WarningCode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatementRendererTest {

    private final StatementRenderer renderer = new StatementRenderer(FormatterOptions.defaults());

    private static ColumnRef col(String name) {
        return new ColumnRef(null, name);
    }

    private static NumberLiteral num(String n) {
        return new NumberLiteral(n);
    }

    private static SelectColumn column(String name) {
        return new SelectColumn(col(name), null);
    }

    private static SelectStatement select(List<SelectColumn> columns, String table, SqlExpr where) {
        return SelectStatement.of(columns, List.of(FromItem.table(table, null)), where);
    }

    @Test
    void multi_column_select_puts_columns_under_the_gutter() {
        SelectStatement s = select(List.of(column("id"), column("name")), "users", null);

        assertEquals("SELECT\n       id\n     , name\n  FROM users", renderer.render(s));
    }

    @Test
    void single_column_stays_on_the_keyword_line() {
        SelectStatement s = select(List.of(column("id")), "users", null);

        assertEquals("SELECT id\n  FROM users", renderer.render(s));
    }

    @Test
    void compact_layout_keeps_first_column_inline() {
        SelectStatement s = select(List.of(column("id"), column("name")), "users", null);

        String out = renderer.render(s, SelectLayout.COMPACT, null);

        assertEquals("SELECT id\n     , name\n  FROM users", out);
    }

    @Test
    void where_conjuncts_are_flattened_onto_gutter_lines() {
        SqlExpr where = new BinaryExpr("AND",
                new BinaryExpr("=", col("x"), num("1")),
                new BinaryExpr("=", col("y"), num("2")));

        String out = renderer.render(select(List.of(column("a")), "t", where));

        assertEquals("SELECT a\n  FROM t\n WHERE x = 1\n   AND y = 2", out);
    }

    @Test
    void mixed_and_or_leaf_is_parenthesized() {
        SqlExpr where = new BinaryExpr("AND",
                new BinaryExpr("OR",
                        new BinaryExpr("=", col("x"), num("1")),
                        new BinaryExpr("=", col("x"), num("2"))),
                new BinaryExpr("=", col("y"), num("3")));

        String out = renderer.render(select(List.of(column("a")), "t", where));

        assertTrue(out.contains(" WHERE (x = 1 OR x = 2)\n   AND y = 3"), out);
    }

    @Test
    void join_keywords_widen_the_gutter_and_on_conditions_split_at_and() {
        FromItem b = FromItem.table("b", null).joined("LEFT JOIN", new BinaryExpr("AND",
                new BinaryExpr("=", new ColumnRef("a", "id"), new ColumnRef("b", "id")),
                new BinaryExpr("=", new ColumnRef("b", "x"), num("1"))));
        SelectStatement s = SelectStatement.of(
                List.of(new SelectColumn(new ColumnRef("a", "id"), null)),
                List.of(FromItem.table("a", null), b),
                null);

        String out = renderer.render(s);

        assertEquals("   SELECT a.id\n     FROM a\nLEFT JOIN b\n       ON a.id = b.id\n      AND b.x = 1", out);
    }

    @Test
    void comma_separated_tables_use_leading_commas() {
        SelectStatement s = SelectStatement.of(
                List.of(column("x")),
                List.of(FromItem.table("a", null), FromItem.table("b", "bb")),
                null);

        assertEquals("SELECT x\n  FROM a\n     , b AS bb", renderer.render(s));
    }

    @Test
    void aliases_line_up_on_one_column() {
        SelectStatement s = select(List.of(
                new SelectColumn(col("id"), "i"),
                new SelectColumn(col("name"), "nm")), "t", null);

        assertEquals("SELECT\n       id   AS i\n     , name AS nm\n  FROM t", renderer.render(s));
    }

    @Test
    void in_list_in_where_is_laid_out_vertically() {
        SqlExpr where = new BinaryExpr("IN", col("id"), new ExprList(List.of(num("1"), num("2"), num("3"))));

        String out = renderer.render(select(List.of(column("a")), "t", where));

        assertTrue(out.endsWith(" WHERE id IN (\n         1\n       , 2\n       , 3\n       )"), out);
    }

    @Test
    void single_value_in_list_stays_inline() {
        SqlExpr where = new BinaryExpr("IN", col("id"), new ExprList(List.of(num("1"))));

        String out = renderer.render(select(List.of(column("a")), "t", where));

        assertTrue(out.endsWith(" WHERE id IN (1)"), out);
    }

    @Test
    void in_subquery_in_where_uses_compact_block() {
        SelectStatement sub = select(List.of(column("id")), "u", null);
        SqlExpr where = new BinaryExpr("IN", col("id"), new Subquery(sub));

        String out = renderer.render(select(List.of(column("a")), "t", where));

        assertTrue(out.endsWith(" WHERE id IN (\n       SELECT id\n         FROM u\n    )"), out);
    }

    @Test
    void not_exists_wrapping_exists_call_renders_as_one_predicate() {
        SelectStatement sub = select(List.of(new SelectColumn(num("1"), null)), "u", null);
        SqlExpr where = new UnaryExpr("NOT", new FunctionCall("EXISTS", List.of(new Subquery(sub))));

        String out = renderer.render(select(List.of(column("a")), "t", where));

        assertTrue(out.endsWith(" WHERE NOT EXISTS (\n       SELECT 1\n         FROM u\n    )"), out);
    }

    @Test
    void every_not_between_encoding_renders_the_same() {
        ExprList range = new ExprList(List.of(num("1"), num("2")));
        List<SqlExpr> encodings = List.of(
                new BinaryExpr("NOT BETWEEN", col("a"), range),
                new UnaryExpr("NOT", new BinaryExpr("BETWEEN", col("a"), range)),
                new BinaryExpr("NOT", col("a"), new BinaryExpr("BETWEEN", col("a"), range)));

        for (SqlExpr e : encodings) {
            String out = renderer.render(select(List.of(column("a")), "t", e));
            assertTrue(out.endsWith(" WHERE a NOT BETWEEN 1 AND 2"), out);
        }
    }

    @Test
    void cte_bodies_share_the_main_query_gutter() {
        SqlExpr cteWhere = new BinaryExpr("=", col("a"), num("1"));
        SelectStatement body = select(List.of(column("a")), "t", cteWhere);
        SelectStatement main = select(List.of(column("b")), "x", null)
                .withOrderByAndLimit(List.of(new domain.ast.OrderItem(col("b"), null)), null)
                .withWith(new WithClause(List.of(new CommonTableExpr("x", body)), true));

        String out = renderer.render(main);

        assertEquals("    WITH x AS (\n"
                + "  SELECT a\n"
                + "    FROM t\n"
                + "   WHERE a = 1\n"
                + ")\n"
                + "  SELECT b\n"
                + "    FROM x\n"
                + "ORDER BY b", out);
    }

    @Test
    void cte_and_main_query_with_where_align_on_select() {
        SelectStatement body = select(List.of(column("a")), "t", new BinaryExpr("=", col("a"), num("1")));
        SelectStatement main = select(List.of(column("a")), "x", new BinaryExpr(">", col("a"), num("0")))
                .withWith(new WithClause(List.of(new CommonTableExpr("x", body)), true));

        String out = renderer.render(main);

        assertEquals("  WITH x AS (\n"
                + "SELECT a\n"
                + "  FROM t\n"
                + " WHERE a = 1\n"
                + ")\n"
                + "SELECT a\n"
                + "  FROM x\n"
                + " WHERE a > 0", out);
    }

    @Test
    void malformed_with_renders_placeholder_and_warns() {
        List<FormatWarning> warnings = new ArrayList<>();
        SelectStatement s = select(List.of(column("a")), "t", null).withWith(WithClause.malformed());

        String out = renderer.render(s, SelectLayout.of(s), new ListFormatWarningSink(warnings));

        assertTrue(out.startsWith("  WITH /* invalid CTE */\nSELECT a"), out);
        assertTrue(warnings.stream().anyMatch(w -> w.getCode() == WarningCode.MALFORMED_CLAUSE));
    }

    @Test
    void set_operation_keyword_sits_between_the_selects_without_widening_the_gutter() {
        SelectStatement s = select(List.of(column("a")), "t", null)
                .appendSetOperation("UNION ALL", select(List.of(column("b")), "u", null));

        assertEquals("SELECT a\n  FROM t\nUNION ALL\nSELECT b\n  FROM u", renderer.render(s));
    }

    @Test
    void derived_table_gets_its_own_width_and_closing_paren() {
        SelectStatement inner = select(List.of(column("x")), "t", null);
        SelectStatement s = SelectStatement.of(
                List.of(column("x")),
                List.of(new FromItem(new DerivedTable(inner), "d", null, null, List.of())),
                null);

        String out = renderer.render(s);

        assertEquals("SELECT x\n  FROM (\n         SELECT x\n           FROM t\n       ) AS d", out);
    }

    @Test
    void case_in_select_list_puts_when_under_the_case_context() {
        CaseExpr c = new CaseExpr(null,
                List.of(new WhenClause(new BinaryExpr("=", col("a"), num("1")), new StringLiteral(null, "x"))),
                new StringLiteral(null, "y"));
        SelectStatement s = select(List.of(new SelectColumn(c, "k")), "t", null);

        assertEquals("SELECT CASE\n"
                + "         WHEN a = 1 THEN 'x'\n"
                + "         ELSE 'y'\n"
                + "       END AS k\n"
                + "  FROM t", renderer.render(s));
    }

    @Test
    void case_compared_in_where_is_anchored_at_the_operator() {
        CaseExpr c = new CaseExpr(null,
                List.of(new WhenClause(new BinaryExpr("=", col("a"), num("1")), new StringLiteral(null, "x"))),
                new StringLiteral(null, "y"));
        SqlExpr where = new BinaryExpr("=", col("status"), c);

        String out = renderer.render(select(List.of(column("a")), "t", where));

        String pad = " ".repeat(14);
        assertTrue(out.endsWith(" WHERE status = CASE\n"
                + pad + "WHEN a = 1 THEN 'x'\n"
                + pad + "ELSE 'y'\n"
                + pad + "END"), out);
    }

    @Test
    void and_inside_case_when_stays_on_the_when_line() {
        CaseExpr c = new CaseExpr(null,
                List.of(new WhenClause(new BinaryExpr("AND",
                        new BinaryExpr("=", col("a"), num("1")),
                        new BinaryExpr("=", col("b"), num("2"))), new StringLiteral(null, "x"))),
                null);
        SelectStatement s = select(List.of(new SelectColumn(c, "k")), "t", null);

        assertEquals("SELECT CASE\n"
                + "         WHEN a = 1 AND b = 2 THEN 'x'\n"
                + "       END AS k\n"
                + "  FROM t", renderer.render(s));
    }

    @Test
    void empty_window_renders_bare_over() {
        SqlExpr rn = new WindowCall("row_number", List.of(), false, WindowSpec.EMPTY);

        assertEquals("SELECT row_number() OVER ()\n  FROM t",
                renderer.render(select(List.of(new SelectColumn(rn, null)), "t", null)));
    }

    @Test
    void window_with_partition_and_order() {
        WindowSpec spec = new WindowSpec(List.of(col("dept")),
                List.of(new OrderItem(col("salary"), OrderItem.Direction.DESC)), null);
        SqlExpr rank = new WindowCall("rank", List.of(), false, spec);

        assertEquals("SELECT rank() OVER (PARTITION BY dept ORDER BY salary DESC)\n  FROM t",
                renderer.render(select(List.of(new SelectColumn(rank, null)), "t", null)));
    }

    @Test
    void cast_keeps_its_source_encoding() {
        SelectStatement s = select(List.of(
                new SelectColumn(new CastExpr(col("a"), "int", CastStyle.CALL), null),
                new SelectColumn(new CastExpr(col("a"), "text", CastStyle.OPERATOR), null)), "t", null);

        assertEquals("SELECT\n       CAST(a AS int)\n     , a::text\n  FROM t", renderer.render(s));
    }

    @Test
    void aggregate_keeps_distinct() {
        SqlExpr count = new AggregateCall("count", true, col("a"));

        assertEquals("SELECT count(DISTINCT a)\n  FROM t",
                renderer.render(select(List.of(new SelectColumn(count, null)), "t", null)));
    }

    @Test
    void unsupported_expression_falls_back_to_value_or_placeholder_and_warns() {
        List<FormatWarning> warnings = new ArrayList<>();
        SelectStatement s = select(List.of(
                new SelectColumn(new Unsupported("Collate", "name COLLATE nocase"), null),
                new SelectColumn(new Unsupported("Lambda", null), null)), "t", null);

        String out = renderer.render(s, SelectLayout.STANDARD, new ListFormatWarningSink(warnings));

        assertEquals("SELECT\n"
                + "       name COLLATE nocase\n"
                + "     , /* unsupported expression */\n"
                + "  FROM t", out);
        assertEquals(2, warnings.size());
        assertTrue(warnings.stream().allMatch(w -> w.getCode() == WarningCode.UNSUPPORTED_EXPRESSION));
    }

    @Test
    void exists_in_select_list_indents_body_and_paren_at_subquery_indent() {
        SelectStatement sub = select(List.of(new SelectColumn(num("1"), null)), "u", null);
        SqlExpr exists = new FunctionCall("EXISTS", List.of(new Subquery(sub)));

        String out = renderer.render(select(List.of(new SelectColumn(exists, "e")), "t", null));

        assertEquals("SELECT EXISTS (\n"
                + "         SELECT 1\n"
                + "           FROM u\n"
                + "         ) AS e\n"
                + "  FROM t", out);
    }

    @Test
    void limit_and_offset_share_one_line() {
        SelectStatement s = select(List.of(column("a")), "t", null)
                .withOrderByAndLimit(List.of(), new LimitClause(num("10"), num("20")));

        assertTrue(renderer.render(s).endsWith(" LIMIT 10 OFFSET 20"));
    }

    @Test
    void lower_keyword_case_touches_keywords_only() {
        StatementRenderer lower = new StatementRenderer(FormatterOptions.defaults().withKeywordCase(KeywordCase.LOWER));
        SqlExpr where = new UnaryExpr("IS NOT NULL", col("Name"));

        String out = lower.render(select(List.of(column("ID")), "Users", where));

        assertEquals("select ID\n  from Users\n where Name is not null", out);
    }

    @Test
    void insert_values_rows_use_leading_commas() {
        InsertStatement i = new InsertStatement("t", List.of("a", "b"), List.of(
                List.of(num("1"), new StringLiteral(null, "x")),
                List.of(num("2"), new StringLiteral(null, "y"))), null);

        assertEquals("INSERT INTO t (a, b)\n     VALUES (1, 'x')\n          , (2, 'y')", renderer.render(i));
    }

    @Test
    void update_assignments_and_where_share_the_gutter() {
        UpdateStatement u = new UpdateStatement("t", null, List.of(
                new Assignment("c", num("1")),
                new Assignment("d", new StringLiteral(null, "x"))),
                new BinaryExpr("=", col("id"), num("5")));

        assertEquals("UPDATE t\n   SET c = 1\n     , d = 'x'\n WHERE id = 5", renderer.render(u));
    }

    @Test
    void delete_pads_where_to_delete_from() {
        DeleteStatement d = new DeleteStatement("t", new BinaryExpr("=", col("id"), num("5")));

        assertEquals("DELETE FROM t\n      WHERE id = 5", renderer.render(d));
    }

    @Test
    void unsupported_statement_is_rejected() {
        UnsupportedStatementException e = assertThrows(UnsupportedStatementException.class,
                () -> renderer.render(new UnsupportedStatement("CREATE TABLE")));

        assertEquals("CREATE TABLE", e.getStatementKind());
    }

    @Test
    void nesting_beyond_the_limit_becomes_a_placeholder() {
        StatementRenderer shallow = new StatementRenderer(FormatterOptions.defaults().withMaxNestingDepth(3));
        List<FormatWarning> warnings = new ArrayList<>();
        SqlExpr nested = new FunctionCall("f", List.of(new FunctionCall("g", List.of(new FunctionCall("h", List.of(col("x")))))));
        SelectStatement s = SelectStatement.of(List.of(new SelectColumn(nested, null)), List.of(), null);

        String out = shallow.render(s, SelectLayout.STANDARD, new ListFormatWarningSink(warnings));

        assertEquals("SELECT f(g(/* nesting too deep */))", out);
        assertEquals(1, warnings.size());
        assertEquals(WarningCode.NESTING_TOO_DEEP, warnings.get(0).getCode());
    }

    @Test
    void very_deep_tree_does_not_overflow_with_default_limit() {
        SqlExpr e = col("x");
        for (int i = 0; i < 5_000; i++) e = new UnaryExpr("NOT", e);
        SelectStatement s = SelectStatement.of(List.of(new SelectColumn(e, null)), List.of(), null);

        String out = renderer.render(s);

        assertTrue(out.contains("/* nesting too deep */"));
    }
}
