package domain.text;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlStatementSplitterTest {

    @Test
    void splits_at_top_level_semicolons_only() {
        List<String> out = SqlStatementSplitter.split("SELECT ';' FROM t; SELECT 2 -- a;b\n; -- end");

        assertEquals(List.of("SELECT ';' FROM t", "SELECT 2 -- a;b"), out);
    }

    @Test
    void block_comments_and_quoted_identifiers_hide_semicolons() {
        List<String> out = SqlStatementSplitter.split("SELECT /* ; */ \"a;b\" FROM t");

        assertEquals(1, out.size());
        assertEquals("SELECT /* ; */ \"a;b\" FROM t", out.get(0));
    }

    @Test
    void blank_input_yields_nothing() {
        assertTrue(SqlStatementSplitter.split("  ;  ; ").isEmpty());
        assertTrue(SqlStatementSplitter.split(null).isEmpty());
    }

    @Test
    void leading_keyword_skips_comments() {
        assertEquals("WITH", SqlStatementSplitter.leadingKeyword("  /* tag */ with x as (select 1) select * from x"));
        assertEquals("SELECT", SqlStatementSplitter.leadingKeyword("-- note\nselect 1"));
        assertEquals("(", SqlStatementSplitter.leadingKeyword(" (select 1)"));
        assertEquals("", SqlStatementSplitter.leadingKeyword(""));
    }
}
