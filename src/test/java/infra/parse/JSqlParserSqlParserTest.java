package infra.parse;

import domain.ast.SqlExpr;
import domain.ast.SqlStatement;
import domain.ast.SqlStatement.InsertStatement;
import domain.ast.SqlStatement.SelectStatement;
import domain.ast.SqlStatement.UnsupportedStatement;
import domain.ast.SqlStatement.UpdateStatement;
import domain.format.FormatterOptions;
import domain.format.SqlFormatter;
import domain.parse.SqlParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JSqlParserSqlParserTest {

    private final JSqlParserSqlParser parser = new JSqlParserSqlParser();
    private final SqlFormatter formatter = new SqlFormatter(parser, FormatterOptions.defaults());

    @Test
    void two_column_select_end_to_end() {
        assertEquals("SELECT\n       id\n     , name\n  FROM users;", formatter.format("select id, name from users"));
    }

    @Test
    void join_where_and_in_list_end_to_end() {
        String out = formatter.format(
                "select a.id, b.x from a left join b on a.id = b.id and b.flag = 1 where a.id in (1, 2)");

        assertEquals("   SELECT\n"
                + "          a.id\n"
                + "        , b.x\n"
                + "     FROM a\n"
                + "LEFT JOIN b\n"
                + "       ON a.id = b.id\n"
                + "      AND b.flag = 1\n"
                + "    WHERE a.id IN (\n"
                + "            1\n"
                + "          , 2\n"
                + "          );", out);
    }

    @Test
    void union_all_end_to_end() {
        assertEquals("SELECT a\n  FROM t\nUNION ALL\nSELECT b\n  FROM u;",
                formatter.format("SELECT a FROM t UNION ALL SELECT b FROM u"));
    }

    @Test
    void parenthesized_or_inside_and_chain_keeps_its_parentheses() {
        String out = formatter.format("SELECT a FROM t WHERE (x = 1 OR x = 2) AND y = 3");

        assertTrue(out.endsWith(" WHERE (x = 1 OR x = 2)\n   AND y = 3;"), out);
    }

    @Test
    void converts_select_clauses() {
        SelectStatement s = (SelectStatement) parser.parse(
                "SELECT DISTINCT t.a AS x, COUNT(*) FROM s.t t GROUP BY t.a ORDER BY x DESC LIMIT 5").get(0);

        assertTrue(s.distinct());
        assertEquals("x", s.columns().get(0).alias());
        assertEquals(new SqlExpr.ColumnRef("t", "a"), s.columns().get(0).expr());
        assertEquals(new SqlExpr.AggregateCall("COUNT", false, new SqlExpr.Star()), s.columns().get(1).expr());
        assertEquals("t", s.from().get(0).alias());
        assertEquals(1, s.groupBy().size());
        assertEquals(domain.ast.OrderItem.Direction.DESC, s.orderBy().get(0).direction());
        assertEquals(new SqlExpr.NumberLiteral("5"), s.limit().count());
    }

    @Test
    void converts_dml() {
        InsertStatement i = (InsertStatement) parser.parse("INSERT INTO t (a, b) VALUES (1, 'x')").get(0);
        assertEquals("t", i.table());
        assertEquals(List.of("a", "b"), i.columns());
        assertEquals(1, i.rows().size());
        assertEquals(List.of(new SqlExpr.NumberLiteral("1"), new SqlExpr.StringLiteral(SqlExpr.QuoteStyle.SINGLE, "x")),
                i.rows().get(0));

        UpdateStatement u = (UpdateStatement) parser.parse("UPDATE t SET a = 1 WHERE id = 5").get(0);
        assertEquals("a", u.assignments().get(0).column());

        assertEquals("DELETE FROM t\n      WHERE id = 5;", formatter.format("delete from t where id = 5"));
    }

    @Test
    void ddl_is_reported_as_unsupported() {
        List<SqlStatement> out = parser.parse("CREATE TABLE t (id INT)");

        assertInstanceOf(UnsupportedStatement.class, out.get(0));
        assertEquals("CREATE TABLE t (id INT)", formatter.format("CREATE TABLE t (id INT)"));
    }

    @Test
    void garbage_is_a_parse_failure() {
        assertThrows(SqlParseException.class, () -> parser.parse("SELEC FROM WHERE"));
        assertThrows(SqlParseException.class, () -> parser.parse("  "));
    }
}
