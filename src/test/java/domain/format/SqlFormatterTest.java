package domain.format;

import domain.ast.SqlExpr.ColumnRef;
import domain.ast.SqlStatement;
import domain.ast.SqlStatement.FromItem;
import domain.ast.SqlStatement.SelectColumn;
import domain.ast.SqlStatement.SelectStatement;
import domain.ast.SqlStatement.UnsupportedStatement;
import domain.model.FormatWarning;
import domain.model.ListFormatWarningSink;
import domain.model.WarningCode;
import domain.parse.SqlParseException;
import domain.parse.SqlParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlFormatterTest {

    /** Parses "SELECT a, b FROM t" style text only; anything starting with CREATE is a DDL. */
    private static final SqlParser FAKE = sql -> {
        String t = sql.trim();
        if (t.toUpperCase().startsWith("CREATE")) return List.of(new UnsupportedStatement("CREATE TABLE"));
        if (!t.toUpperCase().startsWith("SELECT")) throw new SqlParseException("unexpected token at 1");
        String body = t.substring("SELECT".length()).trim();
        int from = body.toUpperCase().indexOf(" FROM ");
        List<SelectColumn> cols = new ArrayList<>();
        for (String c : body.substring(0, from).split(",")) cols.add(new SelectColumn(new ColumnRef(null, c.trim()), null));
        return List.of(SelectStatement.of(cols, List.of(FromItem.table(body.substring(from + 6).trim(), null)), null));
    };

    private final SqlFormatter formatter = new SqlFormatter(FAKE, FormatterOptions.defaults());

    @Test
    void formats_and_terminates_a_statement() {
        FormattedSql out = formatter.formatDetailed("select id, name from users", null);

        assertTrue(out.formatted());
        assertNull(out.failureReason());
        assertEquals("SELECT\n       id\n     , name\n  FROM users;", out.text());
    }

    @Test
    void statements_are_joined_with_a_blank_line() {
        String out = formatter.format("SELECT a FROM t; SELECT b FROM u;");

        assertEquals("SELECT a\n  FROM t;\n\nSELECT b\n  FROM u;", out);
    }

    @Test
    void parse_failure_keeps_original_text_and_warns() {
        List<FormatWarning> warnings = new ArrayList<>();
        String sql = "SELEC broken";

        FormattedSql out = formatter.formatDetailed(sql, new ListFormatWarningSink(warnings));

        assertFalse(out.formatted());
        assertEquals(sql, out.text());
        assertEquals("unexpected token at 1", out.failureReason());
        assertEquals(WarningCode.PARSE_FAILED, warnings.get(0).getCode());
    }

    @Test
    void unsupported_statement_keeps_original_text() {
        List<FormatWarning> warnings = new ArrayList<>();
        String sql = "CREATE TABLE t (id INT)";

        FormattedSql out = formatter.formatDetailed(sql, new ListFormatWarningSink(warnings));

        assertFalse(out.formatted());
        assertEquals(sql, out.text());
        assertEquals(WarningCode.UNSUPPORTED_STATEMENT, warnings.get(0).getCode());
        assertEquals("CREATE TABLE", warnings.get(0).getDetail());
    }

    @Test
    void hint_comment_survives_formatting() {
        String out = formatter.format("SELECT /*+ INDEX(t ix_a) */ a FROM t");

        assertEquals("SELECT /*+ INDEX(t ix_a) */ a\n  FROM t;", out);
    }

    @Test
    void blank_text_is_returned_unchanged() {
        FormattedSql out = formatter.formatDetailed("   ", null);

        assertFalse(out.formatted());
        assertEquals("   ", out.text());
    }

    @Test
    void comment_only_script_is_a_parse_failure() {
        FormattedSql out = formatter.formatDetailed("-- nothing here", null);

        assertFalse(out.formatted());
        assertEquals("-- nothing here", out.text());
    }

    @Test
    void pre_parsed_statements_are_rendered_with_their_own_layout() {
        List<SqlStatement> stmts = FAKE.parse("SELECT a, b FROM t");

        FormattedSql out = formatter.formatStatements(stmts, null);

        assertTrue(out.formatted());
        assertEquals("SELECT\n       a\n     , b\n  FROM t;", out.text());
    }

    @Test
    void formatting_is_idempotent() {
        String once = formatter.format("SELECT a, b FROM t");

        assertEquals(once, formatter.format(once));
    }
}
