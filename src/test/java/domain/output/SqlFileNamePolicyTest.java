package domain.output;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqlFileNamePolicyTest {

    @Test
    void should_flatten_path_separators_and_drop_source_extension() {
        assertEquals("queries_report.sql", SqlFileNamePolicy.build("queries/report.sql"));
        assertEquals("a_b.sql", SqlFileNamePolicy.build("a\\b.json"));
        assertEquals("plain.sql", SqlFileNamePolicy.build("plain"));
    }

    @Test
    void should_replace_unsafe_characters() {
        assertEquals("orders.csv_Q12.sql", SqlFileNamePolicy.build("orders.csv#Q12"));
        assertEquals("my_query_1_.sql", SqlFileNamePolicy.build("my query(1)"));
    }

    @Test
    void should_guard_blank_hidden_and_reserved_names() {
        assertEquals("unknownSource.sql", SqlFileNamePolicy.build("  "));
        assertEquals("unknownSource.sql", SqlFileNamePolicy.build(null));
        assertEquals("_hidden.sql", SqlFileNamePolicy.build(".hidden.sql"));
        assertEquals("_CON.sql", SqlFileNamePolicy.build("CON.sql"));
    }

    @Test
    void should_cap_long_names() {
        String name = SqlFileNamePolicy.build("x".repeat(500));

        assertEquals(184, name.length());
        assertTrue(name.endsWith(".sql"));
    }
}
