package cli;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliArgParserTest {

    @Test
    void parses_equals_and_space_separated_options() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{"--in=sql", "--out", "dist", "--failFast", "stray"});

        assertEquals("sql", m.get("in"));
        assertEquals("dist", m.get("out"));
        assertEquals("stray", m.get("failFast"));
    }

    @Test
    void flag_is_true_when_present_without_value() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{"--noResult", "--noSqlOut=false"});

        assertTrue(CliArgParser.flag(m, "noResult"));
        assertFalse(CliArgParser.flag(m, "noSqlOut"));
        assertFalse(CliArgParser.flag(m, "failFastUnsetForTest"));
    }

    @Test
    void option_falls_back_to_default() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{"--keywordCase=lower", "--max="});

        assertEquals("lower", CliArgParser.option(m, "keywordCase", "upper"));
        assertEquals("10", CliArgParser.option(m, "max", "10"));
        assertEquals("x", CliArgParser.option(m, "optionUnsetForTest", "x"));
    }

    @Test
    void numbers_and_booleans_are_lenient() {
        assertEquals(7, CliArgParser.parseInt(" 7 ", 1));
        assertEquals(1, CliArgParser.parseInt("seven", 1));
        assertEquals(500L, CliArgParser.parseLong(null, 500L));
        assertTrue(CliArgParser.parseBoolean("Yes", false));
        assertFalse(CliArgParser.parseBoolean("no", true));
    }
}
