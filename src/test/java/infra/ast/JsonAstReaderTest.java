package infra.ast;

import domain.ast.SqlExpr;
import domain.ast.SqlStatement;
import domain.ast.SqlStatement.DeleteStatement;
import domain.ast.SqlStatement.FromItem;
import domain.ast.SqlStatement.InsertStatement;
import domain.ast.SqlStatement.SelectStatement;
import domain.ast.SqlStatement.TableSource;
import domain.ast.SqlStatement.UnsupportedStatement;
import domain.ast.SqlStatement.UpdateStatement;
import domain.format.FormatterOptions;
import domain.format.StatementRenderer;
import domain.model.FormatWarning;
import domain.model.ListFormatWarningSink;
import domain.model.WarningCode;
import domain.parse.SqlParseException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonAstReaderTest {

    private final List<FormatWarning> warnings = new ArrayList<>();
    private final JsonAstReader reader = new JsonAstReader(new ListFormatWarningSink(warnings));
    private final StatementRenderer renderer = new StatementRenderer(FormatterOptions.defaults());

    @Test
    void reads_select_with_aliases_and_where() {
        String json = """
                {"type":"select",
                 "columns":[
                   {"expr":{"type":"column_ref","table":null,"column":"id"},"as":null},
                   {"expr":{"type":"column_ref","table":"u","column":{"expr":{"type":"default","value":"name"}}},"as":"n"}
                 ],
                 "from":[{"db":null,"table":"users","as":"u"}],
                 "where":{"type":"binary_expr","operator":"=",
                          "left":{"type":"column_ref","table":null,"column":"id"},
                          "right":{"type":"number","value":1}}}
                """;

        List<SqlStatement> out = reader.read(json);

        assertEquals(1, out.size());
        SelectStatement s = assertInstanceOf(SelectStatement.class, out.get(0));
        assertEquals(2, s.columns().size());
        assertEquals("n", s.columns().get(1).alias());
        assertEquals(new SqlExpr.ColumnRef("u", "name"), s.columns().get(1).expr());
        FromItem from = s.from().get(0);
        assertEquals(new TableSource("users"), from.source());
        assertEquals("u", from.alias());

        assertEquals("SELECT\n       id\n     , u.name AS n\n  FROM users AS u\n WHERE id = 1", renderer.render(s));
        assertTrue(warnings.isEmpty());
    }

    @Test
    void reads_envelope_with_several_statements() {
        String json = """
                {"ast":[
                  {"type":"select","columns":"*","from":[{"table":"a"}]},
                  {"type":"delete","from":[{"db":"s","table":"b"}],"where":null}
                ]}
                """;

        List<SqlStatement> out = reader.read(json);

        assertEquals(2, out.size());
        assertEquals("SELECT *\n  FROM a", renderer.render(out.get(0)));
        DeleteStatement d = assertInstanceOf(DeleteStatement.class, out.get(1));
        assertEquals("s.b", d.table());
    }

    @Test
    void with_of_wrong_shape_is_malformed_and_warns() {
        String json = """
                {"type":"select","with":{"name":"x"},"columns":[{"expr":{"type":"number","value":1},"as":null}]}
                """;

        SelectStatement s = (SelectStatement) reader.read(json).get(0);

        assertFalse(s.with().wellFormed());
        assertEquals(WarningCode.MALFORMED_CLAUSE, warnings.get(0).getCode());
        assertTrue(renderer.render(s).startsWith("  WITH /* invalid CTE */"));
    }

    @Test
    void cte_list_reads_names_and_bodies() {
        String json = """
                {"type":"select",
                 "with":[{"name":{"value":"x"},"stmt":{"ast":{"type":"select",
                          "columns":[{"expr":{"type":"column_ref","column":"a"},"as":null}],
                          "from":[{"table":"t"}]}}}],
                 "columns":[{"expr":{"type":"column_ref","column":"a"},"as":null}],
                 "from":[{"table":"x"}]}
                """;

        SelectStatement s = (SelectStatement) reader.read(json).get(0);

        assertTrue(s.with().wellFormed());
        assertEquals("x", s.with().ctes().get(0).name());
        assertEquals("  WITH x AS (\nSELECT a\n  FROM t\n)\nSELECT a\n  FROM x", renderer.render(s));
    }

    @Test
    void unknown_function_name_shape_uses_sentinel() {
        String json = """
                {"type":"select","columns":[{"expr":{"type":"function","name":{"weird":true},"args":{"type":"expr_list","value":[]}},"as":null}]}
                """;

        SelectStatement s = (SelectStatement) reader.read(json).get(0);

        assertEquals("SELECT unknown_function()", renderer.render(s));
        assertEquals(WarningCode.UNRESOLVED_NAME, warnings.get(0).getCode());
    }

    @Test
    void schema_qualified_function_name_is_joined() {
        String json = """
                {"type":"select","columns":[{"expr":{"type":"function",
                  "name":{"name":[{"type":"default","value":"pkg"},{"type":"default","value":"fn"}]},
                  "args":{"type":"expr_list","value":[{"type":"single_quote_string","value":"x"}]}},"as":null}]}
                """;

        SelectStatement s = (SelectStatement) reader.read(json).get(0);

        assertEquals("SELECT pkg.fn('x')", renderer.render(s));
    }

    @Test
    void comma_limit_means_offset_then_count() {
        String json = """
                {"type":"select","columns":"*","from":[{"table":"t"}],
                 "limit":{"seperator":",","value":[{"type":"number","value":20},{"type":"number","value":10}]}}
                """;

        SelectStatement s = (SelectStatement) reader.read(json).get(0);

        assertEquals(new SqlExpr.NumberLiteral("10"), s.limit().count());
        assertEquals(new SqlExpr.NumberLiteral("20"), s.limit().offset());
    }

    @Test
    void plain_join_is_read_as_inner_join() {
        String json = """
                {"type":"select","columns":"*",
                 "from":[{"table":"a"},
                         {"table":"b","join":"JOIN","on":{"type":"binary_expr","operator":"=",
                            "left":{"type":"column_ref","table":"a","column":"id"},
                            "right":{"type":"column_ref","table":"b","column":"id"}}},
                         {"table":"c","join":"LEFT JOIN","using":["id"]}]}
                """;

        SelectStatement s = (SelectStatement) reader.read(json).get(0);

        assertEquals("INNER JOIN", s.from().get(1).join());
        assertEquals(List.of("id"), s.from().get(2).using());
        String out = renderer.render(s);
        assertTrue(out.contains("INNER JOIN b\n        ON a.id = b.id"), out);
        assertTrue(out.contains(" LEFT JOIN c USING (id)"), out);
    }

    @Test
    void union_chain_follows_next_links() {
        String json = """
                {"type":"select","columns":"*","from":[{"table":"a"}],"set_op":"union all",
                 "_next":{"type":"select","columns":"*","from":[{"table":"b"}]}}
                """;

        SelectStatement s = (SelectStatement) reader.read(json).get(0);

        assertEquals("UNION ALL", s.setOperation().operator());
        assertEquals("SELECT *\n  FROM a\nUNION ALL\nSELECT *\n  FROM b", renderer.render(s));
    }

    @Test
    void reads_insert_update_delete() {
        String json = """
                [{"type":"insert","table":[{"table":"t"}],"columns":["a","b"],
                  "values":{"type":"values","values":[
                    {"type":"expr_list","value":[{"type":"number","value":1},{"type":"null","value":null}]}]}},
                 {"type":"update","table":[{"table":"t","as":"x"}],
                  "set":[{"column":"a","value":{"type":"number","value":2},"table":"x"}],
                  "where":{"type":"binary_expr","operator":"=",
                           "left":{"type":"column_ref","column":"id"},"right":{"type":"param","value":"id"}}},
                 {"type":"delete","table":[{"table":"t"}],"from":[]}]
                """;

        List<SqlStatement> out = reader.read(json);

        InsertStatement i = assertInstanceOf(InsertStatement.class, out.get(0));
        assertEquals(List.of("a", "b"), i.columns());
        assertEquals("INSERT INTO t (a, b)\n     VALUES (1, NULL)", renderer.render(i));

        UpdateStatement u = assertInstanceOf(UpdateStatement.class, out.get(1));
        assertEquals("x", u.alias());
        assertEquals("x.a", u.assignments().get(0).column());

        DeleteStatement d = assertInstanceOf(DeleteStatement.class, out.get(2));
        assertEquals("t", d.table());
    }

    @Test
    void other_statement_types_are_unsupported() {
        SqlStatement s = reader.read("{\"type\":\"create\",\"keyword\":\"table\"}").get(0);

        assertEquals(new UnsupportedStatement("CREATE"), s);
    }

    @Test
    void invalid_or_empty_json_is_a_parse_failure() {
        assertThrows(SqlParseException.class, () -> reader.read("{not json"));
        assertThrows(SqlParseException.class, () -> reader.read("[]"));
    }
}
